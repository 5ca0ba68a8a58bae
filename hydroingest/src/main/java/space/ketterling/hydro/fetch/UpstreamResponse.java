package space.ketterling.hydro.fetch;

import java.time.Duration;
import java.util.Optional;

/**
 * Status, body and the parsed {@code Retry-After} of one upstream response.
 */
public record UpstreamResponse(int status, String body, Duration retryAfter, long elapsedMs) {

    public boolean ok() {
        return status >= 200 && status < 300;
    }

    public boolean rateLimited() {
        return status == 429;
    }

    public Optional<Duration> retryAfterOpt() {
        return Optional.ofNullable(retryAfter);
    }
}
