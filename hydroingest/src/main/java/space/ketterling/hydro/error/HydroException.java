package space.ketterling.hydro.error;

/**
 * Base for ingest failures. Unchecked so that connectors can throw from
 * lambdas; every throw site is caught and turned into a {@link Diagnostic} at
 * the unit boundary.
 */
public abstract class HydroException extends RuntimeException {

    protected HydroException(String message) {
        super(message);
    }

    protected HydroException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
