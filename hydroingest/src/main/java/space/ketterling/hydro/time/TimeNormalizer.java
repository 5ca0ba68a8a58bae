package space.ketterling.hydro.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.NormalizationException;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.RawRecord;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;
import space.ketterling.hydro.model.ValueReading;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Detects timestamp encodings, converts raw timestamps to UTC instants and
 * resolves duplicate timestamps.
 *
 * <p>
 * Text without a zone or offset is read as UTC. Rows whose timestamp cannot
 * be read are dropped with a {@code NORMALIZATION} diagnostic; they never fail
 * the whole batch.
 * </p>
 */
public final class TimeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TimeNormalizer.class);

    /** Integers at or below this magnitude are epoch seconds, above it millis. */
    static final long EPOCH_SECONDS_LIMIT = 100_000_000_000L;

    private static final DateTimeFormatter CUSTOM_OUT = strict("uuuu-MM-dd HH:mm:ss");

    // tried in order after ISO-8601
    private static final List<DateTimeFormatter> CUSTOM_DATE_TIMES = List.of(
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm"),
            strict("uuuu/MM/dd HH:mm"),
            strict("M/d/uuuu h:mm:ss a"),
            strict("M/d/uuuu H:mm:ss"),
            strict("M/d/uuuu H:mm"));
    private static final List<DateTimeFormatter> CUSTOM_DATES = List.of(
            strict("uuuu/MM/dd"),
            strict("M/d/uuuu"));

    private static final Comparator<CanonicalPoint> BY_TIME = Comparator.comparing(CanonicalPoint::timestamp);

    private TimeNormalizer() {
    }

    // ------------------------------------------------------------------
    // detection
    // ------------------------------------------------------------------

    /**
     * Classifies a single sample value.
     *
     * @throws NormalizationException when the sample is blank
     */
    public static TimestampEncoding detect(String sample) {
        if (sample == null || sample.isBlank()) {
            throw new NormalizationException(String.valueOf(sample));
        }
        String s = sample.trim();
        Long n = parseLongOrNull(s);
        if (n != null) {
            return Math.abs(n) <= EPOCH_SECONDS_LIMIT ? TimestampEncoding.EPOCH_SECONDS
                    : TimestampEncoding.EPOCH_MILLIS;
        }
        return parseIso(s) != null ? TimestampEncoding.ISO_TEXT : TimestampEncoding.CUSTOM_TEXT;
    }

    /**
     * Detects the encoding of a batch from its first non-blank timestamp.
     * Defaults to {@link TimestampEncoding#ISO_TEXT} when nothing can be sampled.
     */
    public static TimestampEncoding detect(List<RawRecord> records) {
        for (RawRecord r : records) {
            if (r.rawTimestamp() != null && !r.rawTimestamp().isBlank()) {
                return detect(r.rawTimestamp());
            }
        }
        return TimestampEncoding.ISO_TEXT;
    }

    // ------------------------------------------------------------------
    // parsing / formatting
    // ------------------------------------------------------------------

    /**
     * Reads one raw value with an already detected encoding. Text encodings
     * share one family: ISO-8601 first, then the custom formats.
     */
    public static Instant parse(String raw, TimestampEncoding encoding) {
        if (raw == null || raw.isBlank()) {
            throw new NormalizationException(String.valueOf(raw));
        }
        String s = raw.trim();
        if (encoding.isEpoch()) {
            Long n = parseLongOrNull(s);
            if (n == null) {
                throw new NormalizationException(raw);
            }
            return encoding == TimestampEncoding.EPOCH_SECONDS ? Instant.ofEpochSecond(n) : Instant.ofEpochMilli(n);
        }
        Instant t = parseIso(s);
        if (t == null) {
            t = parseCustom(s);
        }
        if (t == null) {
            throw new NormalizationException(raw);
        }
        return t;
    }

    /**
     * Renders an instant in the given encoding. Text output is UTC.
     */
    public static String format(Instant t, TimestampEncoding encoding) {
        switch (encoding) {
            case EPOCH_SECONDS:
                return Long.toString(t.getEpochSecond());
            case EPOCH_MILLIS:
                return Long.toString(t.toEpochMilli());
            case ISO_TEXT:
                return t.toString();
            case CUSTOM_TEXT:
            default:
                return CUSTOM_OUT.format(t.atOffset(ZoneOffset.UTC));
        }
    }

    // ------------------------------------------------------------------
    // batch normalization
    // ------------------------------------------------------------------

    /**
     * Converts raw records to canonical points using one encoding detected from
     * the batch. Value conventions are applied by {@code values}; a dropped
     * value or unreadable timestamp removes only that row.
     */
    public static NormalizedBatch normalize(List<RawRecord> records, Function<RawRecord, ValueReading> values) {
        List<CanonicalPoint> out = new ArrayList<>(records.size());
        List<Diagnostic> diags = new ArrayList<>();
        TimestampEncoding enc;
        try {
            enc = detect(records);
        } catch (NormalizationException e) {
            enc = TimestampEncoding.ISO_TEXT;
        }

        int badTime = 0;
        for (RawRecord r : records) {
            Instant t;
            try {
                t = parse(r.rawTimestamp(), enc);
            } catch (NormalizationException e) {
                badTime++;
                diags.add(Diagnostic.normalization(r.location() + "/" + r.dataset(), e.getMessage()));
                continue;
            }
            ValueReading v = values.apply(r);
            if (!v.keep()) {
                if (v.reason() != null) {
                    diags.add(Diagnostic.parse(r.location() + "/" + r.dataset() + "@" + r.rawTimestamp(),
                            v.reason()));
                }
                continue;
            }
            out.add(new CanonicalPoint(r.location(), r.dataset(), t, v.value()));
        }
        if (badTime > 0) {
            log.warn("Dropped {} of {} rows with unreadable timestamps (encoding={})", badTime, records.size(), enc);
        }
        return new NormalizedBatch(enc, out, diags);
    }

    /**
     * Ingest-path dedup: keep-last per (location, dataset, timestamp), sorted
     * ascending per series. Explicit null values are kept.
     */
    public static List<Series> deduplicate(List<CanonicalPoint> points) {
        return group(points, false);
    }

    /**
     * Report-path dedup: like {@link #deduplicate} but rows without a value
     * are dropped first.
     */
    public static List<Series> collapse(List<CanonicalPoint> points) {
        return group(points, true);
    }

    /**
     * Collapses points known to belong to one series. Returns an empty series
     * for {@code key} when nothing survives.
     */
    public static Series collapse(SeriesKey key, List<CanonicalPoint> points) {
        for (Series s : collapse(points)) {
            if (s.key().equals(key)) {
                return s;
            }
        }
        return Series.empty(key);
    }

    private static List<Series> group(List<CanonicalPoint> points, boolean dropNullValues) {
        Map<SeriesKey, Map<Instant, CanonicalPoint>> bySeries = new LinkedHashMap<>();
        for (CanonicalPoint p : points) {
            if (p == null || (dropNullValues && !p.hasValue())) {
                continue;
            }
            // later rows overwrite earlier ones at the same instant
            bySeries.computeIfAbsent(p.key(), k -> new LinkedHashMap<>()).put(p.timestamp(), p);
        }
        List<Series> out = new ArrayList<>(bySeries.size());
        for (var e : bySeries.entrySet()) {
            List<CanonicalPoint> sorted = new ArrayList<>(e.getValue().values());
            sorted.sort(BY_TIME);
            out.add(new Series(e.getKey().location(), e.getKey().dataset(), sorted));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    private static Instant parseIso(String s) {
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // next
        }
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // next
        }
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // next
        }
        try {
            return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseCustom(String s) {
        for (DateTimeFormatter f : CUSTOM_DATE_TIMES) {
            try {
                return LocalDateTime.parse(s, f).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter f : CUSTOM_DATES) {
            try {
                return LocalDate.parse(s, f).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }

    private static Long parseLongOrNull(String s) {
        int i = (s.startsWith("-") || s.startsWith("+")) ? 1 : 0;
        if (i == s.length()) {
            return null;
        }
        for (; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return null;
            }
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.US).withResolverStyle(ResolverStyle.STRICT);
    }
}
