package space.ketterling.hydro.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ExternalApiMetricsTest {

    @Test
    void statusFollowsFailureShare() {
        for (int i = 0; i < 10; i++) {
            ExternalApiMetrics.record("metrics-test-ok", true, false);
        }
        ExternalApiMetrics.record("metrics-test-down", false, false);
        ExternalApiMetrics.record("metrics-test-down", true, false);
        ExternalApiMetrics.record("metrics-test-limited", true, false);
        ExternalApiMetrics.record("metrics-test-limited", false, true);

        var snap = ExternalApiMetrics.snapshot();
        assertEquals("ok", snap.get("metrics-test-ok").status());
        assertEquals(10, snap.get("metrics-test-ok").calls());

        assertEquals("down", snap.get("metrics-test-down").status());
        assertEquals(50.0, snap.get("metrics-test-down").failurePct());

        ExternalApiMetrics.SourceSnapshot limited = snap.get("metrics-test-limited");
        assertEquals("degraded", limited.status());
        assertEquals(1, limited.rateLimited());
        assertEquals(0, limited.failures());
    }

    @Test
    void blankSourcesAreIgnored() {
        ExternalApiMetrics.record(" ", false, false);
        ExternalApiMetrics.record(null, false, false);
        assertFalse(ExternalApiMetrics.snapshot().containsKey(" "));
    }
}
