/*
* Copyright 2025 Taylor Ketterling
* API Server for hydroingest.
* utalizes Javalin for HTTP server and exposes stored series, ingest runs and upstream health.
* uses Jackson for JSON processing and HikariCP for database connection pooling.
*/

package space.ketterling.hydro.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.report.ReportService;

/**
 * Read-only HTTP interface over stored measurements and the ingest log.
 *
 * <p>
 * Route groups live in {@code ApiRoutes*} classes and register themselves
 * against the shared {@link Javalin} instance.
 * </p>
 */
public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final int port;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final ReportService reports;
    private Javalin app;

    public ApiServer(int port, ObjectMapper om, HikariDataSource ds, ReportService reports) {
        this.port = port;
        this.om = om;
        this.ds = ds;
        this.reports = reports;
    }

    public void start() {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> ctx.status(400).json(om.createObjectNode()
                .put("error", "bad_request")
                .put("message", e.getMessage() == null ? "Invalid request" : e.getMessage())));

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesSeries.register(this);
        ApiRoutesIngest.register(this);
        ApiRoutesMetrics.register(this);

        app.start(port);
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return app == null ? port : app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    HikariDataSource ds() {
        return ds;
    }

    ReportService reports() {
        return reports;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------

    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Number n)
            obj.put(key, n.doubleValue());
        else
            obj.put(key, value.toString());
    }
}
