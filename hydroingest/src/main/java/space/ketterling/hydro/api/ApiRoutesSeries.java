package space.ketterling.hydro.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.report.JsonSeriesExporter;
import space.ketterling.hydro.report.SeriesDiagnostics;
import space.ketterling.hydro.report.SeriesReport;
import space.ketterling.hydro.report.SeriesStats;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Chart data for one (location, dataset), with window fallback.
 *
 * <p>
 * {@code location} may list several comma-separated locations; they are
 * reported together under {@code label} (default: the first location).
 * </p>
 */
final class ApiRoutesSeries {
    private ApiRoutesSeries() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/series", ctx -> {
            DatasetCategory category = parseCategory(ctx.queryParam("category"));
            String locationParam = ctx.queryParam("location");
            String dataset = ctx.queryParam("dataset");
            if (locationParam == null || locationParam.isBlank() || dataset == null || dataset.isBlank()) {
                ctx.status(400).json(om.createObjectNode().put("error", "location and dataset are required"));
                return;
            }
            List<String> locations = new ArrayList<>();
            for (String s : locationParam.split(",")) {
                if (!s.isBlank()) {
                    locations.add(s.trim());
                }
            }
            if (locations.isEmpty()) {
                ctx.status(400).json(om.createObjectNode().put("error", "location lists no names"));
                return;
            }
            String label = ctx.queryParam("label");
            if (label == null || label.isBlank()) {
                label = locations.get(0);
            }
            FetchWindow requested = parseWindow(ctx.queryParam("start"), ctx.queryParam("end"));
            boolean split = "true".equalsIgnoreCase(ctx.queryParam("split"));

            SeriesReport r = api.reports().report(category, label, locations, dataset.trim(), requested, split);
            ctx.json(reportNode(om, r));
        });
    }

    static ObjectNode reportNode(ObjectMapper om, SeriesReport r) {
        ObjectNode out = om.createObjectNode();
        out.put("location", r.key().location());
        out.put("dataset", r.key().dataset());
        out.put("tier", r.tier().name());
        out.put("start", r.window().start().toString());
        out.put("end", r.window().end().toString());

        ArrayNode series = out.putArray("series");
        for (Series s : r.series()) {
            series.add(JsonSeriesExporter.seriesNode(om, s));
        }

        SeriesStats st = r.stats();
        ObjectNode stats = out.putObject("stats");
        stats.put("count", st.count());
        putDouble(stats, "mean", st.mean());
        putDouble(stats, "std", st.stdDev());
        putDouble(stats, "median", st.median());
        putDouble(stats, "min", st.min());
        putDouble(stats, "max", st.max());
        putDouble(stats, "range", st.range());

        if (r.diagnostics() != null) {
            SeriesDiagnostics d = r.diagnostics();
            ObjectNode diag = out.putObject("diagnostics");
            diag.put("total_rows", d.totalRows());
            ArrayNode locs = diag.putArray("locations");
            for (SeriesDiagnostics.LocationSpan span : d.locations()) {
                ObjectNode row = locs.addObject();
                row.put("location", span.location());
                row.put("rows", span.rows());
                row.put("non_null_rows", span.nonNullRows());
                if (span.first() == null) {
                    row.putNull("first");
                    row.putNull("last");
                } else {
                    row.put("first", span.first().toString());
                    row.put("last", span.last().toString());
                }
            }
        }
        return out;
    }

    /**
     * Accepts the table name ({@code noaa_weather}) or the enum name
     * ({@code WEATHER}).
     */
    static DatasetCategory parseCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("category is required");
        }
        String s = raw.trim();
        for (DatasetCategory c : DatasetCategory.values()) {
            if (c.table().equalsIgnoreCase(s) || c.name().equalsIgnoreCase(s)) {
                return c;
            }
        }
        throw new IllegalArgumentException("unknown category '" + raw + "'");
    }

    /**
     * Null when neither bound is given. A missing start means the start of the
     * end day, a missing end means now. Plain dates cover whole UTC days.
     */
    static FetchWindow parseWindow(String start, String end) {
        boolean hasStart = start != null && !start.isBlank();
        boolean hasEnd = end != null && !end.isBlank();
        if (!hasStart && !hasEnd) {
            return null;
        }
        Instant s = hasStart ? parseBound(start, false) : null;
        Instant e = hasEnd ? parseBound(end, true) : null;
        if (s == null) {
            s = e.atZone(ZoneOffset.UTC).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (e == null) {
            e = Instant.now();
        }
        if (e.isBefore(s)) {
            throw new IllegalArgumentException("end is before start");
        }
        return new FetchWindow(s, e);
    }

    private static Instant parseBound(String raw, boolean endOfDay) {
        String s = raw.trim();
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            // fall through to a plain date
        }
        try {
            LocalDate d = LocalDate.parse(s);
            return endOfDay
                    ? d.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusSeconds(1)
                    : d.atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("cannot read date '" + raw + "'");
        }
    }

    private static void putDouble(ObjectNode node, String key, Double v) {
        if (v == null) {
            node.putNull(key);
        } else {
            node.put(key, v);
        }
    }
}
