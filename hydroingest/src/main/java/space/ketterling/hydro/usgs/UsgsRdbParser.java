package space.ketterling.hydro.usgs;

import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.model.RawRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads NWIS RDB (tab-separated) text into raw records.
 *
 * <p>
 * Layout: {@code #} comment lines, a header row, a column-format row
 * ({@code 5s 15s 20d ...}), then data. Value columns are named
 * {@code <ts_id>_<parameter code>}; their {@code _cd} siblings hold
 * qualifiers and are ignored. Columns are located by header name, never by
 * position, because the set of columns differs between sites.
 * </p>
 */
public final class UsgsRdbParser {
    private static final Pattern VALUE_COLUMN = Pattern.compile("^\\d+_(\\d{5})$");

    private static final Map<String, String> TZ_OFFSETS = Map.of(
            "EST", "-05:00", "EDT", "-04:00",
            "CST", "-06:00", "CDT", "-05:00",
            "MST", "-07:00", "MDT", "-06:00",
            "PST", "-08:00", "PDT", "-07:00",
            "UTC", "Z", "GMT", "Z");

    private UsgsRdbParser() {
    }

    /**
     * @param parameterNames parameter code to dataset name; columns for codes
     *                       not in the map are skipped
     * @throws PayloadParseException when data lines appear without a header
     */
    public static List<RawRecord> parse(String text, String location, Map<String, String> parameterNames) {
        List<RawRecord> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }

        String[] header = null;
        boolean formatRowSeen = false;
        int dateCol = -1;
        int tzCol = -1;
        Map<Integer, String> valueCols = new LinkedHashMap<>();

        for (String line : text.split("\\r?\\n")) {
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] cells = line.split("\t", -1);

            if (header == null) {
                header = cells;
                for (int i = 0; i < cells.length; i++) {
                    String name = cells[i].trim();
                    if ("datetime".equals(name)) {
                        dateCol = i;
                    } else if ("tz_cd".equals(name)) {
                        tzCol = i;
                    } else {
                        Matcher m = VALUE_COLUMN.matcher(name);
                        if (m.matches() && parameterNames.containsKey(m.group(1))) {
                            valueCols.put(i, parameterNames.get(m.group(1)));
                        }
                    }
                }
                if (dateCol < 0) {
                    throw new PayloadParseException("USGS RDB for " + location + " has no datetime column");
                }
                continue;
            }
            if (!formatRowSeen) {
                formatRowSeen = true;
                continue;
            }

            if (cells.length <= dateCol) {
                continue;
            }
            String ts = isoTimestamp(cells[dateCol].trim(), tzCol >= 0 && tzCol < cells.length ? cells[tzCol] : null);
            for (Map.Entry<Integer, String> col : valueCols.entrySet()) {
                String raw = col.getKey() < cells.length ? cells[col.getKey()] : null;
                out.add(new RawRecord(location, col.getValue(), ts, raw));
            }
        }
        return out;
    }

    /**
     * {@code 2024-05-01 13:15} plus {@code CDT} becomes
     * {@code 2024-05-01T13:15-05:00}. Unknown zones are left zone-less (UTC).
     */
    static String isoTimestamp(String local, String tz) {
        if (local.isEmpty()) {
            return local;
        }
        String iso = local.replace(' ', 'T');
        String offset = tz == null ? null : TZ_OFFSETS.get(tz.trim().toUpperCase(Locale.ROOT));
        if (offset == null) {
            return iso;
        }
        // date-only rows carry no time, an offset alone would not parse
        return iso.indexOf('T') < 0 ? iso : iso + offset;
    }
}
