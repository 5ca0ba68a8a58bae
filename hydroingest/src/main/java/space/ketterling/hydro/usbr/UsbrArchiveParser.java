package space.ketterling.hydro.usbr;

import space.ketterling.hydro.model.RawRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads {@code YYYY/MM/DD ... value} lines of an archive response. The value
 * is the last token on the line; header and footer lines are skipped.
 */
public final class UsbrArchiveParser {
    private static final Pattern DATE = Pattern.compile("^\\d{4}/\\d{2}/\\d{2}$");

    private UsbrArchiveParser() {
    }

    public static List<RawRecord> parse(String text, String location, String dataset) {
        List<RawRecord> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String line : text.split("\\r?\\n")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 2 || !DATE.matcher(parts[0]).matches()) {
                continue;
            }
            out.add(new RawRecord(location, dataset, parts[0], parts[parts.length - 1]));
        }
        return out;
    }
}
