package space.ketterling.hydro.danr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.fetch.UpstreamHttp;

/**
 * SD DANR water-quality map API. One GET per station returns every sample.
 */
public final class DanrClient {
    static final String SOURCE = "DANR";

    private final UpstreamHttp http;
    private final ObjectMapper om;
    private final String baseUrl;

    public DanrClient(UpstreamHttp http, ObjectMapper om, String baseUrl) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl;
    }

    public JsonNode station(String stationId) {
        String body = http.getText(SOURCE, baseUrl + "/" + UpstreamHttp.enc(stationId));
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("DANR returned unreadable JSON for " + stationId, e);
        }
    }
}
