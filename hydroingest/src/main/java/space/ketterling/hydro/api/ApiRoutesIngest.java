package space.ketterling.hydro.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.hydro.db.IngestLogRepo;
import space.ketterling.hydro.error.ErrorKind;

import java.util.Locale;
import java.util.UUID;

/**
 * Pull runs and the diagnostics each one recorded.
 */
final class ApiRoutesIngest {
    private ApiRoutesIngest() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        IngestLogRepo runs = new IngestLogRepo(api.ds());

        app.get("/api/ingest/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 50, 1, 200);
            ArrayNode arr = om.createArrayNode();
            for (IngestLogRepo.RunRow r : runs.recentRuns(ctx.queryParam("job"), limit)) {
                ObjectNode row = arr.addObject();
                row.put("run_id", r.runId().toString());
                row.put("job_name", r.jobName());
                api.putNullable(row, "started_at", r.startedAt());
                api.putNullable(row, "finished_at", r.finishedAt());
                row.put("status", r.status());
                row.put("notes", r.notes());
            }
            ctx.json(arr);
        });

        app.get("/api/ingest/events", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 200, 1, 1000);
            UUID runId = parseRunId(ctx.queryParam("runId"));
            ErrorKind kind = parseKind(ctx.queryParam("kind"));

            ArrayNode arr = om.createArrayNode();
            for (IngestLogRepo.EventRow e : runs.events(runId, kind, limit)) {
                ObjectNode row = arr.addObject();
                row.put("event_id", e.eventId());
                row.put("run_id", e.runId().toString());
                row.put("source", e.source());
                row.put("kind", e.kind().name());
                row.put("unit", e.unit());
                row.put("message", e.message());
                api.putNullable(row, "created_at", e.createdAt());
            }
            ctx.json(arr);
        });
    }

    static UUID parseRunId(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("runId is not a UUID: " + raw, e);
        }
    }

    static ErrorKind parseKind(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        try {
            return ErrorKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown diagnostic kind: " + raw, e);
        }
    }
}
