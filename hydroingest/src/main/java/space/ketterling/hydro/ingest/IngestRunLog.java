package space.ketterling.hydro.ingest;

import space.ketterling.hydro.error.Diagnostic;

import java.util.UUID;

/**
 * Persistent record of ingest runs and the diagnostics they produced.
 * Implementations must not throw for a failed log write; the ingest itself
 * matters more than its log.
 */
public interface IngestRunLog {

    IngestRunLog NOOP = new IngestRunLog() {
        @Override
        public UUID startRun(String jobName) {
            return UUID.randomUUID();
        }

        @Override
        public void logDiagnostic(UUID runId, String source, Diagnostic d) {
        }

        @Override
        public void finishRun(UUID runId, boolean success, String notes) {
        }
    };

    UUID startRun(String jobName);

    void logDiagnostic(UUID runId, String source, Diagnostic d);

    void finishRun(UUID runId, boolean success, String notes);
}
