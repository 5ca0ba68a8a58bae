package space.ketterling.hydro.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling call counts per upstream source (USGS, NOAA, USACE, ...).
 *
 * <p>
 * Counts are kept in one-minute buckets over the last 60 minutes. Rate-limit
 * answers (HTTP 429) are counted separately from other failures because they
 * are retried rather than skipped.
 * </p>
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, SourceBuckets> SOURCES = new ConcurrentHashMap<>();

    private ExternalApiMetrics() {
    }

    /**
     * Records one call outcome for a named upstream source.
     */
    public static void record(String source, boolean success, boolean rateLimited) {
        if (source == null || source.isBlank())
            return;
        SOURCES.computeIfAbsent(source, k -> new SourceBuckets()).record(success, rateLimited,
                System.currentTimeMillis() / 60000L);
    }

    /**
     * Snapshot per source, sorted by source name.
     */
    public static Map<String, SourceSnapshot> snapshot() {
        long nowMin = System.currentTimeMillis() / 60000L;
        Map<String, SourceSnapshot> out = new TreeMap<>();
        for (var e : SOURCES.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(nowMin));
        }
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /** Clears all counters. */
    public static void reset() {
        SOURCES.clear();
    }

    /**
     * Summary for one source over the rolling window.
     */
    public record SourceSnapshot(long calls, long failures, long rateLimited, double failurePct, String status) {
    }

    private static final class SourceBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] limited = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(boolean success, boolean rateLimited, long nowMin) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
                limited[idx] = 0L;
            }
            total[idx]++;
            if (rateLimited) {
                limited[idx]++;
            } else if (!success) {
                fail[idx]++;
            }
        }

        private synchronized SourceSnapshot snapshot(long nowMin) {
            long totalSum = 0L;
            long failSum = 0L;
            long limitedSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || (nowMin - minute[i]) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
                limitedSum += limited[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0 || limitedSum > 0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new SourceSnapshot(totalSum, failSum, limitedSum, failurePct, status);
        }
    }
}
