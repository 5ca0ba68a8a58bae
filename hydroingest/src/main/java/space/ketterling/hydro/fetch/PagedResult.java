package space.ketterling.hydro.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import space.ketterling.hydro.error.Diagnostic;

import java.util.List;

/**
 * All rows gathered across pages, in page order, plus the failure that ended
 * the fetch early (if any).
 */
public record PagedResult(List<JsonNode> rows, int pages, int rateLimitedRetries, List<Diagnostic> diagnostics) {

    public PagedResult {
        rows = List.copyOf(rows);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean partial() {
        return !diagnostics.isEmpty();
    }
}
