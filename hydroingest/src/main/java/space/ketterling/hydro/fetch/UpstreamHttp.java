/*
* Copyright 2025 Taylor Ketterling
* Shared upstream HTTP access for hydroingest connectors.
* Utilizes Java HttpClient and records call outcomes in ExternalApiMetrics.
*/

package space.ketterling.hydro.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.error.FetchException;
import space.ketterling.hydro.metrics.ExternalApiMetrics;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin wrapper over {@link HttpClient} used by every connector.
 *
 * <p>
 * {@link #send} returns any HTTP status to the caller so pagination can
 * decide about 429s. The {@code *Text} helpers throw {@link FetchException}
 * for anything that is not 2xx.
 * </p>
 */
public class UpstreamHttp {
    private static final Logger log = LoggerFactory.getLogger(UpstreamHttp.class);

    private final HttpClient http;
    private final Duration timeout;

    public UpstreamHttp(Duration timeout) {
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Performs a request and records the outcome for {@code source}. Only
     * transport failures throw; HTTP errors come back as a response.
     */
    public UpstreamResponse send(String source, HttpRequest req) {
        log.debug("{} request -> {} {}", source, req.method(), req.uri());
        long t0 = System.currentTimeMillis();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            long ms = System.currentTimeMillis() - t0;
            int code = resp.statusCode();
            ExternalApiMetrics.record(source, code >= 200 && code < 300, code == 429);
            Duration retryAfter = parseRetryAfter(resp.headers().firstValue("Retry-After").orElse(null));
            log.debug("{} response {} in {} ms for {}", source, code, ms, req.uri());
            return new UpstreamResponse(code, resp.body(), retryAfter, ms);
        } catch (IOException e) {
            ExternalApiMetrics.record(source, false, false);
            throw new FetchException(source + " request failed for " + req.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(source + " request interrupted for " + req.uri(), e);
        }
    }

    public UpstreamResponse get(String source, String url, Map<String, String> headers) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .GET();
        headers.forEach(b::header);
        return send(source, b.build());
    }

    /**
     * GET returning the body; non-2xx responses become a {@link FetchException}.
     */
    public String getText(String source, String url) {
        return requireOk(source, url, get(source, url, Map.of()));
    }

    /**
     * Form-encoded POST returning the body.
     */
    public String postFormText(String source, String url, Map<String, String> form) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(form)))
                .build();
        return requireOk(source, url, send(source, req));
    }

    /**
     * POST without a body.
     */
    public String postEmptyText(String source, String url) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return requireOk(source, url, send(source, req));
    }

    public static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    static String formBody(Map<String, String> form) {
        StringJoiner sj = new StringJoiner("&");
        form.forEach((k, v) -> sj.add(enc(k) + "=" + enc(v)));
        return sj.toString();
    }

    /**
     * Reads {@code Retry-After} as delta-seconds or an HTTP date. Returns null
     * when absent or unreadable.
     */
    static Duration parseRetryAfter(String ra) {
        if (ra == null || ra.isBlank())
            return null;
        String s = ra.trim();
        try {
            long secs = Long.parseLong(s);
            return secs < 0 ? null : Duration.ofSeconds(secs);
        } catch (NumberFormatException nfe) {
            // HTTP-date form
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration d = Duration.between(ZonedDateTime.now(at.getZone()), at);
            return d.isNegative() ? Duration.ZERO : d;
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unreadable Retry-After '{}'", ra);
            return null;
        }
    }

    private static String requireOk(String source, String url, UpstreamResponse resp) {
        if (!resp.ok()) {
            throw new FetchException(source + " request failed: " + resp.status() + " url=" + url, resp.status());
        }
        return resp.body();
    }
}
