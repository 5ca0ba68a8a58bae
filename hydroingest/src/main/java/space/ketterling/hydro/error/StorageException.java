package space.ketterling.hydro.error;

public class StorageException extends HydroException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STORAGE;
    }
}
