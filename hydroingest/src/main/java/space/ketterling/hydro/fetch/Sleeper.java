package space.ketterling.hydro.fetch;

import java.time.Duration;

/**
 * Blocks the calling task. Injected so backoff can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> {
        if (!d.isZero() && !d.isNegative()) {
            Thread.sleep(d.toMillis());
        }
    };

    void sleep(Duration d) throws InterruptedException;
}
