package space.ketterling.hydro.model;

import space.ketterling.hydro.error.Diagnostic;

import java.util.List;

/**
 * Everything one {@code fetch} produced for a target: the raw records that
 * could be retrieved plus the failures met along the way.
 *
 * <p>
 * {@link #failed()} separates "upstream answered with nothing" from
 * "upstream could not be reached".
 * </p>
 */
public record RawPayload(String source, PullTarget target, List<RawRecord> records, List<Diagnostic> diagnostics) {

    public RawPayload {
        records = List.copyOf(records);
        diagnostics = List.copyOf(diagnostics);
    }

    public static RawPayload of(String source, PullTarget target, List<RawRecord> records) {
        return new RawPayload(source, target, records, List.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public boolean partial() {
        return !diagnostics.isEmpty();
    }

    public boolean failed() {
        return records.isEmpty() && !diagnostics.isEmpty();
    }
}
