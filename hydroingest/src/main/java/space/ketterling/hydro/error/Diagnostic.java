package space.ketterling.hydro.error;

import java.util.Objects;

/**
 * A contained failure: what kind, which unit (URL, chunk, row, key) and why.
 */
public record Diagnostic(ErrorKind kind, String unit, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        unit = unit == null ? "" : unit;
        message = message == null ? "" : message;
    }

    public static Diagnostic fetch(String unit, String message) {
        return new Diagnostic(ErrorKind.FETCH, unit, message);
    }

    public static Diagnostic parse(String unit, String message) {
        return new Diagnostic(ErrorKind.PARSE, unit, message);
    }

    public static Diagnostic normalization(String unit, String message) {
        return new Diagnostic(ErrorKind.NORMALIZATION, unit, message);
    }

    public static Diagnostic storage(String unit, String message) {
        return new Diagnostic(ErrorKind.STORAGE, unit, message);
    }

    public static Diagnostic of(HydroException e, String unit) {
        return new Diagnostic(e.kind(), unit, e.getMessage());
    }

    @Override
    public String toString() {
        return kind + " " + unit + ": " + message;
    }
}
