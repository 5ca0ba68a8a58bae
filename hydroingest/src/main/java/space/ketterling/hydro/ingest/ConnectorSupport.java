package space.ketterling.hydro.ingest;

import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.RawRecord;
import space.ketterling.hydro.model.ValueReading;
import space.ketterling.hydro.time.NormalizedBatch;
import space.ketterling.hydro.time.TimeNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * The shared tail of every connector's {@code process}: normalize
 * timestamps, apply value conventions, apply the cutoff, deduplicate.
 */
public final class ConnectorSupport {

    private ConnectorSupport() {
    }

    public static ProcessResult process(RawPayload payload, PullCutoff cutoff,
            Function<RawRecord, ValueReading> values) {
        NormalizedBatch batch = TimeNormalizer.normalize(payload.records(), values);

        List<CanonicalPoint> kept = new ArrayList<>(batch.points().size());
        int excluded = 0;
        for (CanonicalPoint p : batch.points()) {
            if (cutoff.admits(p.location(), p.dataset(), p.timestamp())) {
                kept.add(p);
            } else {
                excluded++;
            }
        }

        List<Diagnostic> diags = new ArrayList<>(payload.diagnostics());
        diags.addAll(batch.diagnostics());
        return new ProcessResult(TimeNormalizer.deduplicate(kept), diags, excluded, batch.encoding());
    }
}
