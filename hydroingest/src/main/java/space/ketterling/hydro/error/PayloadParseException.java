package space.ketterling.hydro.error;

public class PayloadParseException extends HydroException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PARSE;
    }
}
