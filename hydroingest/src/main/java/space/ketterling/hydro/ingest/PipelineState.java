package space.ketterling.hydro.ingest;

/**
 * Stages of a single pull. {@code DONE} is reached even when a stage failed
 * part way; the report's {@code partial} flag tells the difference.
 */
public enum PipelineState {
    IDLE,
    FETCHING,
    PROCESSING,
    STORING,
    DONE
}
