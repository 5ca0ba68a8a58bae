package space.ketterling.hydro.ingest;

import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.time.TimestampEncoding;

import java.util.List;

/**
 * Output of {@link SourceConnector#process}: deduplicated, ascending series
 * plus what was dropped on the way.
 */
public record ProcessResult(List<Series> series, List<Diagnostic> diagnostics, int excludedByCutoff,
        TimestampEncoding encoding) {

    public ProcessResult {
        series = List.copyOf(series);
        diagnostics = List.copyOf(diagnostics);
    }

    public int pointCount() {
        int n = 0;
        for (Series s : series) {
            n += s.size();
        }
        return n;
    }
}
