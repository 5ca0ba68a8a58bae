package space.ketterling.hydro.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.HydroException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves every page of an offset-paginated, rate-limited endpoint.
 *
 * <p>
 * Paging starts at offset 0. When the body carries a result count, more pages
 * remain while {@code requestedOffset + limit < count}; otherwise a
 * page shorter than the requested size ends the fetch. A 429 is retried on the
 * same page without limit, waiting {@code Retry-After} when given and an
 * exponential backoff otherwise. Any other failure stops the fetch and keeps
 * what was already read.
 * </p>
 */
public class PaginatedFetcher {
    private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

    private final Duration pageDelay;
    private final Duration backoffInitial;
    private final Duration backoffMax;
    private final Sleeper sleeper;

    public PaginatedFetcher(Duration pageDelay, Duration backoffInitial, Duration backoffMax, Sleeper sleeper) {
        this.pageDelay = pageDelay;
        this.backoffInitial = backoffInitial;
        this.backoffMax = backoffMax;
        this.sleeper = sleeper;
    }

    /**
     * Fetches all pages for one request.
     *
     * @param unit     label used in logs and diagnostics (usually the URL stem)
     * @param layout   where rows and metadata live in each body
     * @param pageSize rows requested per page
     */
    public PagedResult fetchAll(String unit, PageLayout layout, int pageSize, PageRequester requester) {
        List<JsonNode> rows = new ArrayList<>();
        List<Diagnostic> diags = new ArrayList<>();
        int offset = 0;
        int pages = 0;
        int retries = 0;
        Duration backoff = backoffInitial;

        while (true) {
            PageRequester.Page page;
            try {
                page = requester.request(offset, pageSize);
            } catch (HydroException e) {
                log.warn("{} page at offset {} failed: {}", unit, offset, e.getMessage());
                diags.add(Diagnostic.of(e, unit + "@" + offset));
                break;
            }

            if (page.status() == 429) {
                Duration wait = page.retryAfter() != null ? page.retryAfter() : backoff;
                log.warn("{} rate limited at offset {}; sleeping {} and retrying", unit, offset, wait);
                retries++;
                if (!pause(wait)) {
                    diags.add(Diagnostic.fetch(unit + "@" + offset, "interrupted during backoff"));
                    break;
                }
                backoff = min(backoff.multipliedBy(2), backoffMax);
                continue;
            }

            if (page.status() < 200 || page.status() >= 300) {
                log.warn("{} HTTP {} at offset {}; keeping {} rows", unit, page.status(), offset, rows.size());
                diags.add(Diagnostic.fetch(unit + "@" + offset, "HTTP " + page.status()));
                break;
            }

            JsonNode results = page.body() == null ? null : page.body().at(layout.resultsPointer());
            int got;
            if (results == null || results.isMissingNode() || results.isNull()) {
                // an empty body means nothing (more) in range
                got = 0;
            } else if (!results.isArray()) {
                diags.add(Diagnostic.parse(unit + "@" + offset, "results is not an array"));
                break;
            } else {
                got = results.size();
                results.forEach(rows::add);
            }
            pages++;

            if (got == 0) {
                break;
            }

            Integer next = nextOffset(page.body(), layout, offset, pageSize, got);
            if (next == null) {
                break;
            }
            offset = next;

            if (!pause(pageDelay)) {
                diags.add(Diagnostic.fetch(unit + "@" + offset, "interrupted between pages"));
                break;
            }
        }

        log.info("{}: {} rows over {} page(s), {} rate-limit retries", unit, rows.size(), pages, retries);
        return new PagedResult(rows, pages, retries, diags);
    }

    /**
     * Returns the next request offset, or null when this was the last page.
     */
    static Integer nextOffset(JsonNode body, PageLayout layout, int requestOffset, int pageSize, int got) {
        if (layout.hasMetadata() && body != null) {
            JsonNode meta = body.at(layout.metadataPointer());
            if (meta.path("count").isInt()) {
                int count = meta.get("count").asInt();
                int limit = meta.path("limit").asInt(pageSize);
                if (limit <= 0) {
                    limit = pageSize;
                }
                // counted from our own offset; upstreams disagree on 0- or 1-based
                return requestOffset + limit < count ? requestOffset + limit : null;
            }
        }
        return got < pageSize ? null : requestOffset + pageSize;
    }

    /**
     * Sleeps; returns false (with the interrupt flag restored) when interrupted.
     */
    private boolean pause(Duration d) {
        try {
            sleeper.sleep(d);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
