package space.ketterling.hydro.ingest;

import java.util.List;
import java.util.UUID;

/**
 * All target reports of one {@code pullAll} for a connector.
 */
public record ConnectorRun(String source, UUID runId, boolean skipped, List<PullReport> reports) {

    public ConnectorRun {
        reports = List.copyOf(reports);
    }

    public static ConnectorRun skipped(String source) {
        return new ConnectorRun(source, null, true, List.of());
    }

    public int storedPoints() {
        return reports.stream().mapToInt(PullReport::storedPoints).sum();
    }

    public boolean partial() {
        return reports.stream().anyMatch(PullReport::partial);
    }

    /**
     * Successful unless every target failed to fetch anything.
     */
    public boolean success() {
        return skipped || reports.isEmpty() || !reports.stream().allMatch(PullReport::failed);
    }
}
