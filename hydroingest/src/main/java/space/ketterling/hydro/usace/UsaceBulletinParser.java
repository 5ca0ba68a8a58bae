package space.ketterling.hydro.usace;

import space.ketterling.hydro.model.RawRecord;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the whitespace-separated hourly table of a USACE bulletin.
 *
 * <p>
 * A data line starts with a date and an hour, followed by one column per
 * dataset in {@code columns} order. Title, unit and separator lines are
 * skipped because their first token is not a date.
 * </p>
 */
public final class UsaceBulletinParser {
    private static final Pattern DATE = Pattern.compile("^\\d{4}[-/]\\d{2}[-/]\\d{2}$");
    private static final Pattern HOUR_COMPACT = Pattern.compile("^\\d{4}$");
    private static final Pattern HOUR_COLON = Pattern.compile("^\\d{1,2}:\\d{2}$");
    private static final int LEADING_COLUMNS = 2;

    private UsaceBulletinParser() {
    }

    /**
     * Returns one record per (line, dataset). Timestamps come out as
     * {@code yyyy-MM-dd HH:mm}; an hour of {@code 24:00} rolls to midnight of
     * the next day.
     */
    public static List<RawRecord> parse(String text, String location, List<String> columns) {
        List<RawRecord> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        int minTokens = LEADING_COLUMNS + columns.size();
        for (String line : text.split("\\r?\\n")) {
            String[] parts = line.trim().replace("\"", "").split("\\s+");
            if (parts.length < minTokens || !DATE.matcher(parts[0]).matches()) {
                continue;
            }
            String ts = timestamp(parts[0], parts[1]);
            if (ts == null) {
                continue;
            }
            for (int i = 0; i < columns.size(); i++) {
                out.add(new RawRecord(location, columns.get(i), ts, parts[LEADING_COLUMNS + i]));
            }
        }
        return out;
    }

    static String timestamp(String date, String hour) {
        String hhmm;
        if (HOUR_COMPACT.matcher(hour).matches()) {
            hhmm = hour.substring(0, 2) + ":" + hour.substring(2);
        } else if (HOUR_COLON.matcher(hour).matches()) {
            hhmm = hour.length() == 4 ? "0" + hour : hour;
        } else {
            return null;
        }
        LocalDate day;
        try {
            day = LocalDate.parse(date.replace('/', '-'), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
        if ("24:00".equals(hhmm)) {
            day = day.plusDays(1);
            hhmm = "00:00";
        }
        return day + " " + hhmm;
    }
}
