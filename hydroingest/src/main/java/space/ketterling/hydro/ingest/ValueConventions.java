package space.ketterling.hydro.ingest;

import space.ketterling.hydro.model.ValueReading;

import java.util.Locale;
import java.util.Set;

/**
 * Per-source rules for non-numeric and sentinel values.
 *
 * <p>
 * Upstreams disagree on how they mark missing data, so each source gets its
 * own method. "Missing" keeps the row with a null value; "drop" removes the
 * row entirely.
 * </p>
 */
public final class ValueConventions {

    /** USGS qualifier codes shown in place of a value; kept as explicit missing. */
    static final Set<String> USGS_QUALIFIERS = Set.of(
            "Eqp", "Ssn", "Dis", "Bkw", "Rat", "Mnt", "Fld", "Pr", "Dry", "Zfl", "***");

    /** Shadehill archive values above this are "no data". */
    static final double USBR_SENTINEL = 900_000.0;

    private static final Set<String> USACE_MISSING = Set.of("M", "-", "--", "MISSING", "N/A");

    private ValueConventions() {
    }

    /**
     * USGS NWIS: {@code Ice} on discharge reads as 0, qualifier codes are
     * missing, blank cells and other text are dropped.
     */
    public static ValueReading usgs(String dataset, String raw) {
        if (isBlank(raw)) {
            return ValueReading.drop(null);
        }
        String s = raw.trim();
        if ("Ice".equalsIgnoreCase(s)) {
            return "Discharge".equals(dataset) ? ValueReading.of(0.0) : ValueReading.missing();
        }
        if (USGS_QUALIFIERS.contains(s)) {
            return ValueReading.missing();
        }
        Double v = parse(s);
        return v == null ? ValueReading.drop("non-numeric USGS value '" + s + "'") : ValueReading.of(v);
    }

    /**
     * NOAA CDO: numeric values divided by {@code scale}.
     */
    public static ValueReading noaa(String raw, double scale) {
        Double v = parse(raw);
        if (v == null) {
            return ValueReading.drop(isBlank(raw) ? null : "non-numeric NOAA value '" + raw + "'");
        }
        return ValueReading.of(scale == 0.0 ? v : v / scale);
    }

    /**
     * USACE bulletins: missing markers and non-numeric cells drop the row.
     */
    public static ValueReading usace(String raw) {
        if (isBlank(raw) || USACE_MISSING.contains(raw.trim().toUpperCase(Locale.ROOT))) {
            return ValueReading.drop(null);
        }
        Double v = parse(raw);
        return v == null ? ValueReading.drop("non-numeric USACE value '" + raw.trim() + "'") : ValueReading.of(v);
    }

    /**
     * USBR archive: sentinel or non-numeric values are missing.
     */
    public static ValueReading usbr(String raw) {
        Double v = parse(raw);
        if (v == null || v > USBR_SENTINEL) {
            return ValueReading.missing();
        }
        return ValueReading.of(v);
    }

    /**
     * ACIS: {@code M} (missing), {@code T} (trace), {@code S} (subsequent),
     * {@code A}-flagged accumulations and any other text drop the row.
     */
    public static ValueReading acis(String raw) {
        Double v = parse(raw);
        return v == null ? ValueReading.drop(null) : ValueReading.of(v);
    }

    /**
     * ND DEQ chemistry: {@code *NON-DETECT} and other text are missing.
     */
    public static ValueReading ndgis(String raw) {
        if (isBlank(raw)) {
            return ValueReading.drop(null);
        }
        Double v = parse(raw);
        return v == null ? ValueReading.missing() : ValueReading.of(v);
    }

    /**
     * SD DANR: {@code non-detect}, below-limit strings such as {@code <0.02}
     * and JSON nulls are missing; other text is dropped.
     */
    public static ValueReading danr(String raw) {
        if (isBlank(raw)) {
            return ValueReading.missing();
        }
        String s = raw.trim();
        if ("non-detect".equalsIgnoreCase(s) || s.contains("<")) {
            return ValueReading.missing();
        }
        Double v = parse(s);
        return v == null ? ValueReading.drop("non-numeric DANR value '" + s + "'") : ValueReading.of(v);
    }

    static Double parse(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String s = raw.trim().replace(",", "");
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
