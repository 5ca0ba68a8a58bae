package space.ketterling.hydro.fetch;

import org.junit.jupiter.api.Test;
import space.ketterling.hydro.error.FetchException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkedRangeFetcherTest {

    @Test
    void splitCoversRangeWithoutOverlap() {
        List<DateRange> chunks = ChunkedRangeFetcher.split(
                LocalDate.of(2020, 1, 1), LocalDate.of(2021, 3, 1), 365);

        assertEquals(2, chunks.size());
        assertEquals(new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 30)), chunks.get(0));
        assertEquals(new DateRange(LocalDate.of(2020, 12, 31), LocalDate.of(2021, 3, 1)), chunks.get(1));
        assertEquals(426, chunks.stream().mapToLong(DateRange::days).sum());
    }

    @Test
    void singleDayRangeIsOneChunk() {
        LocalDate d = LocalDate.of(2024, 2, 29);
        assertEquals(List.of(new DateRange(d, d)), ChunkedRangeFetcher.split(d, d, 30));
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkedRangeFetcher(0, Duration.ZERO, Sleeper.SYSTEM));
    }

    @Test
    void failedChunkIsSkippedAndOthersConcatenatedInOrder() {
        RecordingSleeper sleeper = new RecordingSleeper();
        ChunkedRangeFetcher fetcher = new ChunkedRangeFetcher(10, Duration.ofMillis(50), sleeper);
        List<DateRange> seen = new ArrayList<>();

        ChunkedRangeFetcher.ChunkedResult<String> r = fetcher.fetch("usgs/06340500",
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 30), chunk -> {
                    seen.add(chunk);
                    if (chunk.start().equals(LocalDate.of(2024, 1, 11))) {
                        throw new FetchException("bad gateway", 502);
                    }
                    return List.of(chunk.start().toString(), chunk.end().toString());
                });

        assertEquals(3, r.chunks());
        assertEquals(List.of("2024-01-01", "2024-01-10", "2024-01-21", "2024-01-30"), r.items());
        assertEquals(1, r.diagnostics().size());
        assertTrue(r.diagnostics().get(0).unit().contains("2024-01-11"));
        assertEquals(3, seen.size());
        assertEquals(2, sleeper.sleeps().size());
    }
}
