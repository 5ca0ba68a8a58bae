package space.ketterling.hydro.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that only remembers what it was asked to wait.
 */
public class RecordingSleeper implements Sleeper {
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public synchronized void sleep(Duration d) {
        sleeps.add(d);
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
