package space.ketterling.hydro.acis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.fetch.UpstreamHttp;

import java.time.LocalDate;
import java.util.Collection;

/**
 * RCC-ACIS {@code StnData} web service. Request parameters travel as one JSON
 * object in the {@code params} query argument.
 */
public final class AcisClient {
    static final String SOURCE = "ACIS";

    private final UpstreamHttp http;
    private final ObjectMapper om;
    private final String baseUrl;

    public AcisClient(UpstreamHttp http, ObjectMapper om, String baseUrl) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl;
    }

    public JsonNode stnData(String sid, LocalDate start, LocalDate end, Collection<String> elements) {
        String url = baseUrl + "?params=" + UpstreamHttp.enc(params(sid, start, end, elements));
        String body = http.getText(SOURCE, url);
        try {
            return om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("ACIS returned unreadable JSON for " + sid, e);
        }
    }

    String params(String sid, LocalDate start, LocalDate end, Collection<String> elements) {
        ObjectNode p = om.createObjectNode();
        p.put("sid", sid);
        p.put("sdate", start.toString());
        p.put("edate", end.toString());
        p.put("elems", String.join(",", elements));
        return p.toString();
    }
}
