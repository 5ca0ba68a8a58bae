package space.ketterling.hydro.noaa;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.fetch.ChunkedRangeFetcher;
import space.ketterling.hydro.fetch.PaginatedFetcher;
import space.ketterling.hydro.fetch.RecordingSleeper;
import space.ketterling.hydro.fetch.UpstreamHttp;
import space.ketterling.hydro.ingest.ProcessResult;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.PullTarget;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * {@link NoaaConnector} against a local stand-in for the CDO v2 data endpoint.
 */
class NoaaConnectorTest {

    private static final String TOKEN = "test-token";
    private static final FetchWindow JAN = FetchWindow.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));

    private final ObjectMapper om = new ObjectMapper();
    private final AtomicInteger rateLimited = new AtomicInteger();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private Javalin server;
    private NoaaConnector connector;

    private static SourceCatalog.Noaa catalog() {
        Map<String, String> locations = new LinkedHashMap<>();
        locations.put("Bismarck", "Bismarck, ND");
        locations.put("Hazen/Mercer", "Bismarck, ND");
        locations.put("Minot", "Minot, ND");
        Map<String, String> datatypes = new LinkedHashMap<>();
        datatypes.put("Max Temperature", "TMAX");
        datatypes.put("Precipitation", "PRCP");
        return new SourceCatalog.Noaa(Map.of("Bismarck, ND", "GHCND:USW00024011"), locations, datatypes,
                List.of("Max Temperature"));
    }

    private String page(int offset, int... values) {
        StringBuilder sb = new StringBuilder("{\"metadata\":{\"resultset\":{\"offset\":")
                .append(offset + 1).append(",\"count\":3,\"limit\":2}},\"results\":[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("{\"date\":\"2024-01-0").append(offset + i + 1).append("T00:00:00\",\"datatype\":\"TMAX\",")
                    .append("\"station\":\"GHCND:USW00024011\",\"value\":").append(values[i]).append('}');
        }
        return sb.append("]}").toString();
    }

    @BeforeEach
    void setUp() {
        server = Javalin.create().get("/cdo-web/api/v2/data", ctx -> {
            if (!TOKEN.equals(ctx.header("token"))) {
                ctx.status(400).result("{\"status\":\"400\",\"message\":\"Token parameter is required.\"}");
                return;
            }
            if ("PRCP".equals(ctx.queryParam("datatypeid"))) {
                ctx.result("{}");
                return;
            }
            String offset = ctx.queryParam("offset");
            if ("1".equals(offset)) {
                ctx.result(page(0, 25, 30));
            } else if (rateLimited.getAndIncrement() == 0) {
                ctx.status(429).header("Retry-After", "0").result("");
            } else {
                ctx.result(page(2, 35));
            }
        }).start(0);

        NoaaClient client = new NoaaClient(new UpstreamHttp(Duration.ofSeconds(5)), om,
                "http://localhost:" + server.port() + "/cdo-web/api/v2", TOKEN);
        connector = new NoaaConnector(client, catalog(),
                new PaginatedFetcher(Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(60), sleeper),
                new ChunkedRangeFetcher(365, Duration.ZERO, sleeper), 2, 10.0, true, Duration.ofMillis(200),
                sleeper);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void stationRowsFanOutToEveryMappedLocation() {
        RawPayload p = connector.fetch(PullTarget.of("Bismarck, ND"), JAN);

        assertEquals(6, p.records().size());
        assertFalse(p.partial());
        // one 429 and its retry
        assertEquals(2, rateLimited.get());
        assertTrue(sleeper.sleeps().contains(Duration.ZERO));
        assertTrue(sleeper.sleeps().contains(Duration.ofMillis(200)));
    }

    @Test
    void scaledDatasetsAreDivided() {
        ProcessResult r = connector.process(connector.fetch(PullTarget.of("Bismarck, ND"), JAN), PullCutoff.none());

        assertEquals(2, r.series().size());
        Series hazen = r.series().stream().filter(s -> s.location().equals("Hazen/Mercer")).findFirst().orElseThrow();
        assertEquals(List.of(2.5, 3.0, 3.5), hazen.points().stream().map(CanonicalPoint::value).toList());
    }

    @Test
    void unknownStationFails() {
        assertTrue(connector.fetch(PullTarget.of("Fargo, ND"), JAN).failed());
    }

    @Test
    void seriesForCoversLocationsAndDatatypes() {
        List<SeriesKey> keys = connector.seriesFor(PullTarget.of("Bismarck, ND"));

        assertEquals(4, keys.size());
        assertTrue(keys.contains(new SeriesKey("Hazen/Mercer", "Precipitation")));
        assertEquals(List.of("Minot"), connector.locationsFor("Minot, ND"));
    }

    @Test
    void dataUrlEncodesStation() {
        NoaaClient client = new NoaaClient(new UpstreamHttp(Duration.ofSeconds(1)), om, "https://x/api/v2", TOKEN);
        String url = client.dataUrl("GHCND:USW00024011", "TMAX", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31),
                1000, 0);

        assertTrue(url.startsWith("https://x/api/v2/data?datasetid=GHCND&stationid=GHCND%3AUSW00024011"));
        assertTrue(url.contains("&startdate=2024-01-01&enddate=2024-12-31"));
        assertTrue(url.endsWith("&limit=1000&offset=1"));
    }
}
