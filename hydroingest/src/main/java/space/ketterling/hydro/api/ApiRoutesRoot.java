package space.ketterling.hydro.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.hydro.db.MeasurementRepo;
import space.ketterling.hydro.error.StorageException;
import space.ketterling.hydro.model.DatasetCategory;

import java.time.Instant;
import java.util.Locale;

/**
 * Service index and a health check that also reports how fresh each category
 * table is.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("service", "hydroingest");
            out.put("status", "ok");
            ArrayNode cats = out.putArray("categories");
            for (DatasetCategory c : DatasetCategory.values()) {
                cats.add(c.name().toLowerCase(Locale.ROOT));
            }
            out.putArray("endpoints")
                    .add("GET /health")
                    .add("GET /api/series?category=gauge&location=Hazen&dataset=Gauge%20Height&start=2024-08-01&end=2024-08-31&split=false")
                    .add("GET /api/ingest/runs?job=usgs&limit=50")
                    .add("GET /api/ingest/events?runId=<uuid>&kind=fetch")
                    .add("GET /api/metrics/summary")
                    .add("GET /api/metrics/external");
            ctx.json(out);
        });

        app.get("/health", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("time", Instant.now().toString());
            ObjectNode tables = out.putObject("last_ingested");
            boolean dbOk = true;
            if (api.ds() == null) {
                dbOk = false;
                out.put("db_error", "no datasource configured");
            } else {
                MeasurementRepo repo = new MeasurementRepo(api.ds());
                try {
                    for (DatasetCategory c : DatasetCategory.values()) {
                        api.putNullable(tables, c.table(), repo.lastIngestedAt(c).orElse(null));
                    }
                } catch (StorageException e) {
                    dbOk = false;
                    out.put("db_error", e.getMessage());
                }
            }
            out.put("status", dbOk ? "ok" : "degraded");
            out.put("db", dbOk ? "ok" : "fail");
            ctx.status(dbOk ? 200 : 503).json(out);
        });
    }
}
