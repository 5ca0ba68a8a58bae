package space.ketterling.hydro.error;

/**
 * An upstream request failed. {@code status} is -1 when no HTTP response was
 * received at all.
 */
public class FetchException extends HydroException {
    private final int status;

    public FetchException(String message, int status) {
        super(message);
        this.status = status;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    public int status() {
        return status;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FETCH;
    }
}
