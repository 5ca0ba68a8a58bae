package space.ketterling.hydro.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One independently fetchable unit of a connector: a station, optionally
 * narrowed to a single dataset.
 */
public record PullTarget(String location, String dataset) {

    public PullTarget {
        Objects.requireNonNull(location, "location");
    }

    public static PullTarget of(String location) {
        return new PullTarget(location, null);
    }

    public static PullTarget of(String location, String dataset) {
        return new PullTarget(location, dataset);
    }

    public Optional<String> datasetOpt() {
        return Optional.ofNullable(dataset);
    }

    @Override
    public String toString() {
        return dataset == null ? location : location + "/" + dataset;
    }
}
