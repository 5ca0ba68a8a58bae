package space.ketterling.hydro.time;

/**
 * How a source writes its timestamps. Detected once per payload.
 */
public enum TimestampEncoding {
    EPOCH_SECONDS,
    EPOCH_MILLIS,
    ISO_TEXT,
    CUSTOM_TEXT;

    public boolean isEpoch() {
        return this == EPOCH_SECONDS || this == EPOCH_MILLIS;
    }
}
