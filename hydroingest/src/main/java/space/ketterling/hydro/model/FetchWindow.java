package space.ketterling.hydro.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Inclusive [start, end] range of UTC instants requested from an upstream or
 * from storage.
 */
public record FetchWindow(Instant start, Instant end) {

    public FetchWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
    }

    public static FetchWindow of(LocalDate startDay, LocalDate endDay) {
        return new FetchWindow(startDay.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endDay.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusSeconds(1));
    }

    /**
     * The trailing {@code days} days ending at the clock's current instant.
     */
    public static FetchWindow lastDays(Clock clock, int days) {
        Instant now = clock.instant();
        return new FetchWindow(now.minus(Duration.ofDays(days)), now);
    }

    /**
     * A window of the given length whose end is {@code anchor}.
     */
    public static FetchWindow endingAt(Instant anchor, Duration length) {
        return new FetchWindow(anchor.minus(length), anchor);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public LocalDate startDate() {
        return start.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public LocalDate endDate() {
        return end.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }

    /**
     * Returns a copy whose start is moved forward to {@code newStart} when that
     * is later than the current start. Never moves past the end.
     */
    public FetchWindow narrowStart(Instant newStart) {
        if (newStart == null || !newStart.isAfter(start)) {
            return this;
        }
        return new FetchWindow(newStart.isAfter(end) ? end : newStart, end);
    }
}
