package space.ketterling.hydro.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ordered points for one (location, dataset).
 *
 * <p>
 * Instances are built by {@code TimeNormalizer}, which guarantees ascending,
 * duplicate-free timestamps. The constructor only re-checks that invariant.
 * </p>
 */
public record Series(String location, String dataset, List<CanonicalPoint> points) {

    public Series {
        points = List.copyOf(points);
        Instant prev = null;
        for (CanonicalPoint p : points) {
            if (!p.location().equals(location) || !p.dataset().equals(dataset)) {
                throw new IllegalArgumentException("point " + p + " does not belong to " + location + "/" + dataset);
            }
            if (prev != null && !p.timestamp().isAfter(prev)) {
                throw new IllegalArgumentException("series " + location + "/" + dataset
                        + " is not strictly ascending at " + p.timestamp());
            }
            prev = p.timestamp();
        }
    }

    public static Series empty(SeriesKey key) {
        return new Series(key.location(), key.dataset(), List.of());
    }

    public SeriesKey key() {
        return new SeriesKey(location, dataset);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    public Optional<Instant> first() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(0).timestamp());
    }

    public Optional<Instant> last() {
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1).timestamp());
    }
}
