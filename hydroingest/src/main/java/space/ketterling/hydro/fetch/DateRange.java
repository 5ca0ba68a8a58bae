package space.ketterling.hydro.fetch;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive day range.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
