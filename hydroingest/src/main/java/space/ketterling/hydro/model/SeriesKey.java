package space.ketterling.hydro.model;

import java.util.Objects;

/**
 * Identifies one time series: a location plus a dataset name.
 */
public record SeriesKey(String location, String dataset) {

    public SeriesKey {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(dataset, "dataset");
    }

    @Override
    public String toString() {
        return location + "/" + dataset;
    }
}
