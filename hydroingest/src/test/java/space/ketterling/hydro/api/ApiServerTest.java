package space.ketterling.hydro.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import space.ketterling.hydro.db.InMemoryMeasurementStore;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.report.ReportService;
import space.ketterling.hydro.report.WindowSelector;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Series endpoint end to end over an in-memory store.
 */
class ApiServerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");
    private static final ObjectMapper OM = new ObjectMapper();
    private static final HttpClient HTTP = HttpClient.newHttpClient();

    private static ApiServer server;

    @BeforeAll
    static void start() {
        InMemoryMeasurementStore store = new InMemoryMeasurementStore();
        store.upsert(DatasetCategory.GAUGE,
                new CanonicalPoint("Hazen", "Gauge Height", Instant.parse("2024-08-01T00:00:00Z"), 5.5));
        store.upsert(DatasetCategory.GAUGE,
                new CanonicalPoint("Hazen", "Gauge Height", Instant.parse("2024-08-01T00:15:00Z"), 5.6));
        ReportService reports = new ReportService(store,
                new WindowSelector(store, Clock.fixed(NOW, ZoneOffset.UTC), 30));
        server = new ApiServer(0, OM, null, reports);
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop();
    }

    private static HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + pathAndQuery))
                .GET().build();
        return HTTP.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void staleSeriesFallsBackToLatestData() throws Exception {
        HttpResponse<String> resp = get("/api/series?category=gauge&location=Hazen&dataset=Gauge%20Height");

        assertEquals(200, resp.statusCode());
        JsonNode body = OM.readTree(resp.body());
        assertEquals("LATEST_ANCHORED", body.get("tier").asText());
        assertEquals("2024-08-01T00:15:00Z", body.get("end").asText());
        assertEquals(2, body.get("series").get(0).get("points").size());
        assertEquals(5.55, body.get("stats").get("mean").asDouble());
    }

    @Test
    void emptySeriesCarriesDiagnostics() throws Exception {
        HttpResponse<String> resp = get("/api/series?category=gauge&location=Medora&dataset=Discharge");

        JsonNode body = OM.readTree(resp.body());
        assertEquals("NONE", body.get("tier").asText());
        assertEquals(0, body.get("diagnostics").get("total_rows").asInt());
        assertTrue(body.get("stats").get("mean").isNull());
    }

    @Test
    void unknownCategoryIsBadRequest() throws Exception {
        HttpResponse<String> resp = get("/api/series?category=rivers&location=Hazen&dataset=x");

        assertEquals(400, resp.statusCode());
        assertEquals("bad_request", OM.readTree(resp.body()).get("error").asText());
    }

    @Test
    void missingDatasetIsBadRequest() throws Exception {
        assertEquals(400, get("/api/series?category=gauge&location=Hazen").statusCode());
    }

    @Test
    void locationOfOnlySeparatorsIsBadRequest() throws Exception {
        assertEquals(400, get("/api/series?category=gauge&location=,&dataset=Discharge").statusCode());
        assertEquals(400, get("/api/series?category=gauge&location=%20,%20,&dataset=Discharge").statusCode());
    }

    @Test
    void indexListsCategories() throws Exception {
        JsonNode body = OM.readTree(get("/").body());
        assertEquals("hydroingest", body.get("service").asText());
        assertEquals(DatasetCategory.values().length, body.get("categories").size());
        assertEquals("gauge", body.get("categories").get(0).asText());
    }

    @Test
    void healthIsDegradedWithoutDatabase() throws Exception {
        HttpResponse<String> resp = get("/health");

        assertEquals(503, resp.statusCode());
        assertEquals("degraded", OM.readTree(resp.body()).get("status").asText());
    }

    @Test
    void malformedIngestFiltersAreBadRequest() throws Exception {
        assertEquals(400, get("/api/ingest/events?runId=not-a-uuid").statusCode());
        assertEquals(400, get("/api/ingest/events?kind=explosion").statusCode());
    }
}
