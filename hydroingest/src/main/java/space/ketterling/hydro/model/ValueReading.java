package space.ketterling.hydro.model;

/**
 * Result of applying a source's value conventions to one raw cell.
 *
 * <p>
 * A kept reading may carry a {@code null} value (explicit missing marker). A
 * dropped reading produces no row at all; {@code reason} says why.
 * </p>
 */
public record ValueReading(boolean keep, Double value, String reason) {
    private static final ValueReading MISSING = new ValueReading(true, null, null);

    public static ValueReading of(double value) {
        return new ValueReading(true, value, null);
    }

    public static ValueReading missing() {
        return MISSING;
    }

    public static ValueReading drop(String reason) {
        return new ValueReading(false, null, reason);
    }
}
