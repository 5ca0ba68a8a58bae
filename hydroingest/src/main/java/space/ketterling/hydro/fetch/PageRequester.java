package space.ketterling.hydro.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Issues one page request. Transport and body-parse failures are thrown as
 * {@link space.ketterling.hydro.error.HydroException}s; HTTP failures come
 * back in the response.
 */
@FunctionalInterface
public interface PageRequester {
    Page request(int offset, int limit);

    /**
     * One page response. {@code body} is null when the status is not 2xx.
     */
    record Page(int status, JsonNode body, Duration retryAfter) {
    }
}
