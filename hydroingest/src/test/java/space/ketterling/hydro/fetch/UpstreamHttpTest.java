package space.ketterling.hydro.fetch;

import io.javalin.Javalin;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import space.ketterling.hydro.error.FetchException;
import space.ketterling.hydro.metrics.ExternalApiMetrics;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * {@link UpstreamHttp} against a local Javalin server.
 */
class UpstreamHttpTest {

    private static Javalin server;
    private static String base;
    private final UpstreamHttp http = new UpstreamHttp(Duration.ofSeconds(5));

    @BeforeAll
    static void startServer() {
        server = Javalin.create()
                .get("/ok", ctx -> ctx.result("hello"))
                .get("/limited", ctx -> ctx.status(429).header("Retry-After", "7").result("slow down"))
                .get("/broken", ctx -> ctx.status(500).result("boom"))
                .post("/form", ctx -> ctx.result(ctx.formParam("lst") + "|" + ctx.formParam("yr")))
                .start(0);
        base = "http://localhost:" + server.port();
    }

    @AfterAll
    static void stopServer() {
        server.stop();
    }

    @Test
    void returnsBodyOnSuccess() {
        assertEquals("hello", http.getText("TEST-OK", base + "/ok"));
    }

    @Test
    void rateLimitedResponseIsReturnedWithRetryAfter() {
        UpstreamResponse r = http.get("TEST-429", base + "/limited", Map.of());
        assertTrue(r.rateLimited());
        assertEquals(Duration.ofSeconds(7), r.retryAfter());
        assertEquals(1, ExternalApiMetrics.snapshot().get("TEST-429").rateLimited());
    }

    @Test
    void non2xxBecomesFetchExceptionForTextHelpers() {
        FetchException e = assertThrows(FetchException.class, () -> http.getText("TEST-500", base + "/broken"));
        assertEquals(500, e.status());
        assertEquals(1, ExternalApiMetrics.snapshot().get("TEST-500").failures());
    }

    @Test
    void postsFormFields() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("lst", "CAN GH");
        form.put("yr", "2024");
        assertEquals("CAN GH|2024", http.postFormText("TEST-FORM", base + "/form", form));
    }

    @Test
    void unreachableHostThrowsFetchException() {
        assertThrows(FetchException.class, () -> http.getText("TEST-DOWN", "http://localhost:1/nothing"));
    }

    @Test
    void formBodyIsUrlEncoded() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("a b", "c&d");
        form.put("x", "1");
        assertEquals("a+b=c%26d&x=1", UpstreamHttp.formBody(form));
    }

    @Test
    void retryAfterAcceptsSecondsAndHttpDates() {
        assertEquals(Duration.ofSeconds(30), UpstreamHttp.parseRetryAfter(" 30 "));
        assertNull(UpstreamHttp.parseRetryAfter("-4"));
        assertNull(UpstreamHttp.parseRetryAfter(null));
        assertNull(UpstreamHttp.parseRetryAfter("soon"));

        String past = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.of(2001, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        assertEquals(Duration.ZERO, UpstreamHttp.parseRetryAfter(past));

        String future = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC).plusMinutes(2));
        Duration d = UpstreamHttp.parseRetryAfter(future);
        assertTrue(d.compareTo(Duration.ofSeconds(60)) > 0 && d.compareTo(Duration.ofSeconds(121)) <= 0, d.toString());
    }
}
