package space.ketterling.hydro.model;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetchWindowTest {

    @Test
    void dayRangeIsInclusive() {
        FetchWindow w = FetchWindow.of(LocalDate.of(2024, 8, 1), LocalDate.of(2024, 8, 2));

        assertTrue(w.contains(Instant.parse("2024-08-02T23:59:59Z")));
        assertFalse(w.contains(Instant.parse("2024-08-03T00:00:00Z")));
        assertEquals(LocalDate.of(2024, 8, 2), w.endDate());
    }

    @Test
    void lastDaysEndsNow() {
        Instant now = Instant.parse("2025-01-31T12:00:00Z");
        FetchWindow w = FetchWindow.lastDays(Clock.fixed(now, ZoneOffset.UTC), 30);
        assertEquals(now, w.end());
        assertEquals(Duration.ofDays(30), w.duration());
    }

    @Test
    void narrowStartNeverWidensOrPassesEnd() {
        FetchWindow w = FetchWindow.of(LocalDate.of(2024, 8, 1), LocalDate.of(2024, 8, 31));

        assertSame(w, w.narrowStart(Instant.parse("2024-07-01T00:00:00Z")));
        assertEquals(Instant.parse("2024-08-10T00:00:00Z"), w.narrowStart(Instant.parse("2024-08-10T00:00:00Z")).start());
        FetchWindow past = w.narrowStart(Instant.parse("2025-01-01T00:00:00Z"));
        assertEquals(past.end(), past.start());
    }

    @Test
    void endBeforeStartIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FetchWindow(Instant.parse("2024-08-02T00:00:00Z"), Instant.parse("2024-08-01T00:00:00Z")));
    }
}
