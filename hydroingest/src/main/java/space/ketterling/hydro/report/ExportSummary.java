package space.ketterling.hydro.report;

import java.util.List;

/**
 * Outcome of a bulk export. {@code failed} names each series (or category)
 * that could not be read or written; the rest were still exported.
 */
public record ExportSummary(int files, List<String> failed) {

    public ExportSummary {
        failed = List.copyOf(failed);
    }

    public boolean partial() {
        return !failed.isEmpty();
    }
}
