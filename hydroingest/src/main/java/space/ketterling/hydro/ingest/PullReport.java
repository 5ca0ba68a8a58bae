package space.ketterling.hydro.ingest;

import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.ErrorKind;
import space.ketterling.hydro.model.PullTarget;

import java.util.List;

/**
 * Outcome of one fetch, process and store cycle for a single target.
 */
public record PullReport(
        String source,
        PullTarget target,
        PipelineState state,
        int fetchedRecords,
        int normalizedPoints,
        int excludedByCutoff,
        int excludedByWindow,
        int storedPoints,
        int failedKeys,
        boolean cancelled,
        List<Diagnostic> diagnostics) {

    public PullReport {
        diagnostics = List.copyOf(diagnostics);
    }

    /** Something went wrong but the rest of the target still ran. */
    public boolean partial() {
        return cancelled || failedKeys > 0 || !diagnostics.isEmpty();
    }

    /**
     * Nothing was fetched because the upstream failed, as opposed to the
     * upstream having no data in range.
     */
    public boolean failed() {
        return fetchedRecords == 0 && diagnostics.stream().anyMatch(d -> d.kind() == ErrorKind.FETCH);
    }
}
