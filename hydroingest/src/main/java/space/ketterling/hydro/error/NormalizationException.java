package space.ketterling.hydro.error;

/**
 * A raw timestamp could not be read with any supported encoding.
 */
public class NormalizationException extends HydroException {
    private final String raw;

    public NormalizationException(String raw) {
        super("unrecognized timestamp '" + raw + "'");
        this.raw = raw;
    }

    public String raw() {
        return raw;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NORMALIZATION;
    }
}
