package space.ketterling.hydro.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import space.ketterling.hydro.metrics.ExternalApiMetrics;
import space.ketterling.hydro.model.DatasetCategory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * Routes that return row counts and upstream health.
 */
final class ApiRoutesMetrics {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetrics() {
    }

    /**
     * Registers metric endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        HikariDataSource ds = api.ds();

        // quick proof ingest is landing data
        app.get("/api/metrics/summary", ctx -> {
            ObjectNode out = om.createObjectNode();
            try (Connection c = ds.getConnection()) {
                for (DatasetCategory cat : DatasetCategory.values()) {
                    // table names come from the enum, never from the request
                    String sql = "SELECT COUNT(*) AS n, COUNT(DISTINCT (location, dataset)) AS series, "
                            + "MAX(ingested_at) AS latest FROM " + cat.table();
                    try (PreparedStatement ps = c.prepareStatement(sql);
                            ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            ObjectNode row = out.putObject(cat.table());
                            row.put("rows", rs.getLong("n"));
                            row.put("series", rs.getLong("series"));
                            api.putNullable(row, "latest_ingest", rs.getObject("latest"));
                        }
                    }
                }
            }
            ctx.json(out);
        });

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = out.putArray("services");

            var snapshots = ExternalApiMetrics.snapshot();
            for (var e : snapshots.entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("calls_last_hour", snap.calls());
                row.put("failures_last_hour", snap.failures());
                row.put("rate_limited_last_hour", snap.rateLimited());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                services.add(row);
            }

            ctx.json(out);
        });
    }
}
