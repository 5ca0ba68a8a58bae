package space.ketterling.hydro.report;

import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;
import space.ketterling.hydro.time.TimeNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns report rows into chartable series.
 *
 * <p>
 * Rows are relabelled to the report key first, so rows from several physical
 * locations can be reported as one series.
 * </p>
 */
public final class SeriesSplitter {

    private SeriesSplitter() {
    }

    /**
     * Keep-last per timestamp; null values dropped.
     */
    public static Series collapse(SeriesKey key, List<CanonicalPoint> rows) {
        return TimeNormalizer.collapse(key, relabel(key, rows));
    }

    /**
     * Splits rows that share a timestamp into parallel sub-series.
     *
     * <p>
     * Each row gets its zero-based occurrence index among rows with the same
     * timestamp, in input order. Rows with the same index form one sub-series.
     * Sub-series 0 therefore holds every timestamp; sub-series 1 only those
     * that appeared at least twice.
     * </p>
     */
    public static List<Series> split(SeriesKey key, List<CanonicalPoint> rows) {
        Map<Instant, Integer> seen = new HashMap<>();
        List<List<CanonicalPoint>> groups = new ArrayList<>();
        for (CanonicalPoint p : relabel(key, rows)) {
            if (!p.hasValue()) {
                continue;
            }
            int idx = seen.merge(p.timestamp(), 1, Integer::sum) - 1;
            while (groups.size() <= idx) {
                groups.add(new ArrayList<>());
            }
            groups.get(idx).add(p);
        }
        List<Series> out = new ArrayList<>(groups.size());
        for (List<CanonicalPoint> g : groups) {
            out.add(TimeNormalizer.collapse(key, g));
        }
        return out;
    }

    private static List<CanonicalPoint> relabel(SeriesKey key, List<CanonicalPoint> rows) {
        List<CanonicalPoint> out = new ArrayList<>(rows.size());
        for (CanonicalPoint p : rows) {
            if (p.location().equals(key.location()) && p.dataset().equals(key.dataset())) {
                out.add(p);
            } else {
                out.add(new CanonicalPoint(key.location(), key.dataset(), p.timestamp(), p.value()));
            }
        }
        return out;
    }
}
