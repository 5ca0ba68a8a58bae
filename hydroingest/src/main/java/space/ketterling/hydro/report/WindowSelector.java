package space.ketterling.hydro.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.db.MeasurementStore;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the query window for a report with three-tier fallback.
 *
 * <ol>
 * <li>The requested window, or the last {@code defaultDays} days.</li>
 * <li>If that holds no non-null row: a window of the same length ending at
 * the latest non-null row.</li>
 * <li>If that is still empty: the whole stored history.</li>
 * </ol>
 *
 * Only an empty result escalates. Several physical locations may be selected
 * together; the tiers then apply to their combined rows.
 */
public class WindowSelector {
    private static final Logger log = LoggerFactory.getLogger(WindowSelector.class);

    private final MeasurementStore store;
    private final Clock clock;
    private final int defaultDays;

    public WindowSelector(MeasurementStore store, Clock clock, int defaultDays) {
        this.store = store;
        this.clock = clock;
        this.defaultDays = defaultDays;
    }

    public WindowSelection select(DatasetCategory category, String location, String dataset,
            FetchWindow requested) {
        return select(category, List.of(location), dataset, requested);
    }

    /**
     * @param requested null for the default trailing window
     */
    public WindowSelection select(DatasetCategory category, List<String> locations, String dataset,
            FetchWindow requested) {
        FetchWindow window = requested != null ? requested : FetchWindow.lastDays(clock, defaultDays);

        List<CanonicalPoint> rows = queryNonNull(category, locations, dataset, window);
        if (!rows.isEmpty()) {
            return new WindowSelection(WindowSelection.Tier.REQUESTED, window, rows);
        }

        Optional<Instant> latest = latestNonNull(category, locations, dataset);
        if (latest.isPresent()) {
            FetchWindow anchored = FetchWindow.endingAt(latest.get(), window.duration());
            rows = queryNonNull(category, locations, dataset, anchored);
            if (!rows.isEmpty()) {
                log.debug("{} {}: no rows in {}..{}, anchored to latest {}", locations, dataset, window.start(),
                        window.end(), latest.get());
                return new WindowSelection(WindowSelection.Tier.LATEST_ANCHORED, anchored, rows);
            }
        }

        List<CanonicalPoint> all = new ArrayList<>();
        for (String loc : locations) {
            for (CanonicalPoint p : store.queryAll(category, loc, dataset)) {
                if (p.hasValue()) {
                    all.add(p);
                }
            }
        }
        if (all.isEmpty()) {
            return new WindowSelection(WindowSelection.Tier.NONE, window, List.of());
        }
        Instant min = all.get(0).timestamp();
        Instant max = min;
        for (CanonicalPoint p : all) {
            if (p.timestamp().isBefore(min)) {
                min = p.timestamp();
            }
            if (p.timestamp().isAfter(max)) {
                max = p.timestamp();
            }
        }
        log.debug("{} {}: falling back to full history {}..{}", locations, dataset, min, max);
        return new WindowSelection(WindowSelection.Tier.FULL_HISTORY, new FetchWindow(min, max), all);
    }

    private List<CanonicalPoint> queryNonNull(DatasetCategory category, List<String> locations, String dataset,
            FetchWindow w) {
        List<CanonicalPoint> out = new ArrayList<>();
        for (String loc : locations) {
            for (CanonicalPoint p : store.query(category, loc, dataset, w.start(), w.end())) {
                if (p.hasValue()) {
                    out.add(p);
                }
            }
        }
        return out;
    }

    private Optional<Instant> latestNonNull(DatasetCategory category, List<String> locations, String dataset) {
        Instant best = null;
        for (String loc : locations) {
            Optional<Instant> t = store.latestNonNullTimestamp(category, loc, dataset);
            if (t.isPresent() && (best == null || t.get().isAfter(best))) {
                best = t.get();
            }
        }
        return Optional.ofNullable(best);
    }
}
