package space.ketterling.hydro.time;

import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.model.CanonicalPoint;

import java.util.List;

/**
 * Points converted from one raw batch, before dedup, plus the rows that were
 * dropped on the way.
 */
public record NormalizedBatch(TimestampEncoding encoding, List<CanonicalPoint> points, List<Diagnostic> diagnostics) {

    public NormalizedBatch {
        points = List.copyOf(points);
        diagnostics = List.copyOf(diagnostics);
    }
}
