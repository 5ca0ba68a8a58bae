package space.ketterling.hydro.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * "Already ingested up to here." A record survives processing only when its
 * timestamp is strictly after the cutoff that applies to its series.
 */
public final class PullCutoff {
    private static final PullCutoff NONE = new PullCutoff(null, Map.of());

    private final Instant global;
    private final Map<SeriesKey, Instant> perSeries;

    private PullCutoff(Instant global, Map<SeriesKey, Instant> perSeries) {
        this.global = global;
        this.perSeries = Map.copyOf(perSeries);
    }

    public static PullCutoff none() {
        return NONE;
    }

    /**
     * Caller-supplied cutoff that applies to every series of the pull.
     */
    public static PullCutoff at(Instant instant) {
        return instant == null ? NONE : new PullCutoff(instant, Map.of());
    }

    /**
     * Cutoffs derived from storage, one per series.
     */
    public static PullCutoff perSeries(Map<SeriesKey, Instant> latest) {
        return new PullCutoff(null, latest);
    }

    public Optional<Instant> forSeries(String location, String dataset) {
        if (global != null) {
            return Optional.of(global);
        }
        return Optional.ofNullable(perSeries.get(new SeriesKey(location, dataset)));
    }

    /**
     * True when {@code t} is new for the given series.
     */
    public boolean admits(String location, String dataset, Instant t) {
        Optional<Instant> c = forSeries(location, dataset);
        return c.isEmpty() || t.isAfter(c.get());
    }

    /**
     * The earliest cutoff in effect, used to narrow the fetch start. Empty when
     * any series has no cutoff at all.
     */
    public Optional<Instant> earliest(Iterable<SeriesKey> keys) {
        if (global != null) {
            return Optional.of(global);
        }
        Instant min = null;
        for (SeriesKey k : keys) {
            Instant c = perSeries.get(k);
            if (c == null) {
                return Optional.empty();
            }
            if (min == null || c.isBefore(min)) {
                min = c;
            }
        }
        return Optional.ofNullable(min);
    }

    public boolean isNone() {
        return global == null && perSeries.isEmpty();
    }

    @Override
    public String toString() {
        if (global != null) {
            return "PullCutoff[" + global + "]";
        }
        return perSeries.isEmpty() ? "PullCutoff[none]" : "PullCutoff" + perSeries;
    }
}
