package space.ketterling.hydro.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.HydroException;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a day range into fixed-size chunks for upstreams that truncate or
 * reject long ranges, fetches each chunk and concatenates the results in
 * chronological order.
 *
 * <p>
 * Chunk ends are inclusive and the next chunk starts the day after, so no
 * boundary day is fetched twice. A failed chunk is recorded and skipped.
 * </p>
 */
public class ChunkedRangeFetcher {
    private static final Logger log = LoggerFactory.getLogger(ChunkedRangeFetcher.class);

    private final int chunkDays;
    private final Duration chunkDelay;
    private final Sleeper sleeper;

    public ChunkedRangeFetcher(int chunkDays, Duration chunkDelay, Sleeper sleeper) {
        if (chunkDays < 1) {
            throw new IllegalArgumentException("chunkDays must be >= 1");
        }
        this.chunkDays = chunkDays;
        this.chunkDelay = chunkDelay;
        this.sleeper = sleeper;
    }

    /**
     * Fetches one chunk. May throw any {@link HydroException}; an empty list is
     * a valid "no data" answer.
     */
    @FunctionalInterface
    public interface ChunkFetch<T> {
        List<T> fetch(DateRange chunk);
    }

    /**
     * Splits {@code [start, end]} into consecutive inclusive ranges of at most
     * {@code chunkDays} days.
     */
    public static List<DateRange> split(LocalDate start, LocalDate end, int chunkDays) {
        List<DateRange> out = new ArrayList<>();
        LocalDate chunkStart = start;
        while (!chunkStart.isAfter(end)) {
            LocalDate chunkEnd = chunkStart.plusDays(chunkDays - 1L);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }
            out.add(new DateRange(chunkStart, chunkEnd));
            chunkStart = chunkEnd.plusDays(1);
        }
        return out;
    }

    public int chunkDays() {
        return chunkDays;
    }

    public <T> ChunkedResult<T> fetch(String unit, LocalDate start, LocalDate end, ChunkFetch<T> fetcher) {
        List<DateRange> chunks = split(start, end, chunkDays);
        List<T> items = new ArrayList<>();
        List<Diagnostic> diags = new ArrayList<>();
        int done = 0;

        for (int i = 0; i < chunks.size(); i++) {
            DateRange chunk = chunks.get(i);
            if (Thread.currentThread().isInterrupted()) {
                diags.add(Diagnostic.fetch(unit + "@" + chunk, "interrupted before chunk"));
                break;
            }
            try {
                List<T> got = fetcher.fetch(chunk);
                items.addAll(got);
                log.debug("{} chunk {} -> {} rows", unit, chunk, got.size());
            } catch (HydroException e) {
                log.warn("{} chunk {} skipped: {}", unit, chunk, e.getMessage());
                diags.add(Diagnostic.of(e, unit + "@" + chunk));
            }
            done++;

            if (i < chunks.size() - 1 && !chunkDelay.isZero()) {
                try {
                    sleeper.sleep(chunkDelay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    diags.add(Diagnostic.fetch(unit, "interrupted between chunks"));
                    break;
                }
            }
        }

        log.info("{}: {} rows from {}/{} chunk(s) of {} days", unit, items.size(), done, chunks.size(), chunkDays);
        return new ChunkedResult<>(items, chunks.size(), diags);
    }

    /**
     * Concatenated chunk results.
     */
    public record ChunkedResult<T>(List<T> items, int chunks, List<Diagnostic> diagnostics) {

        public ChunkedResult {
            items = List.copyOf(items);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
