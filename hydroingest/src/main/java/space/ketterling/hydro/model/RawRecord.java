package space.ketterling.hydro.model;

/**
 * One reading as the upstream reported it, before any timestamp or value
 * conversion. Both fields are kept as text.
 */
public record RawRecord(String location, String dataset, String rawTimestamp, String rawValue) {
}
