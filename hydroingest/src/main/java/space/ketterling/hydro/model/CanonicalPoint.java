package space.ketterling.hydro.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One normalized measurement, keyed by (location, dataset, timestamp).
 *
 * <p>
 * A {@code null} value is an explicit "missing / non-detect" reading and is
 * stored as such. It is not the same as having no row at all.
 * </p>
 */
public record CanonicalPoint(String location, String dataset, Instant timestamp, Double value) {

    public CanonicalPoint {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public SeriesKey key() {
        return new SeriesKey(location, dataset);
    }

    public boolean hasValue() {
        return value != null && !value.isNaN();
    }
}
