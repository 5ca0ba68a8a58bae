/*
* Copyright 2025 Taylor Ketterling
* NOAA Client for hydroingest.
* Utilizes Java HttpClient for making requests to NOAA Climate Data Online (CDO) API V2
* and Jackson for JSON processing.
*/

package space.ketterling.hydro.noaa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.fetch.PageRequester;
import space.ketterling.hydro.fetch.UpstreamHttp;
import space.ketterling.hydro.fetch.UpstreamResponse;

import java.time.LocalDate;
import java.util.Map;

import static space.ketterling.hydro.fetch.UpstreamHttp.enc;

/**
 * HTTP client for NOAA Climate Data Online (CDO) API.
 *
 * <p>
 * Returns pages as-is, including 429 responses, so that
 * {@link space.ketterling.hydro.fetch.PaginatedFetcher} owns the backoff.
 * </p>
 */
public final class NoaaClient {
    static final String SOURCE = "NOAA";

    private final UpstreamHttp http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final String token;

    public NoaaClient(UpstreamHttp http, ObjectMapper om, String baseUrl, String token) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl;
        this.token = token;
    }

    /**
     * Fetches one page of daily GHCND data for a station and datatype.
     */
    public PageRequester.Page data(String stationId, String datatypeId, LocalDate start, LocalDate end, int limit,
            int offset) {
        String url = dataUrl(stationId, datatypeId, start, end, limit, offset);
        UpstreamResponse resp = http.get(SOURCE, url, Map.of("token", token, "Accept", "application/json"));
        if (!resp.ok()) {
            return new PageRequester.Page(resp.status(), null, resp.retryAfter());
        }
        return new PageRequester.Page(resp.status(), readBody(resp.body(), url), null);
    }

    String dataUrl(String stationId, String datatypeId, LocalDate start, LocalDate end, int limit, int offset) {
        return baseUrl + "/data"
                + "?datasetid=GHCND"
                + "&stationid=" + enc(stationId)
                + "&datatypeid=" + enc(datatypeId)
                + "&startdate=" + start
                + "&enddate=" + end
                + "&units=standard"
                + "&includemetadata=true"
                + "&limit=" + limit
                + "&offset=" + (offset + 1); // CDO offsets are 1-based
    }

    private JsonNode readBody(String body, String url) {
        if (body == null || body.isBlank()) {
            // CDO answers "{}" or nothing when the range has no data
            return om.createObjectNode();
        }
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("NOAA returned unreadable JSON for " + url, e);
        }
    }
}
