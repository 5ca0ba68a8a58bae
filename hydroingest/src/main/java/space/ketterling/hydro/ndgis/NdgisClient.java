package space.ketterling.hydro.ndgis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.fetch.PageRequester;
import space.ketterling.hydro.fetch.UpstreamHttp;
import space.ketterling.hydro.fetch.UpstreamResponse;

import java.util.Map;

/**
 * North Dakota DEQ surface-water endpoints: the ArcGIS site layer used for
 * discovery, the service that names a station's chemistry export, and the
 * CSV download itself.
 */
public final class NdgisClient {
    static final String SOURCE = "NDGIS";

    private final UpstreamHttp http;
    private final ObjectMapper om;
    private final String sitesUrl;
    private final String serviceUrl;
    private final String downloadUrl;

    public NdgisClient(UpstreamHttp http, ObjectMapper om, String sitesUrl, String serviceUrl, String downloadUrl) {
        this.http = http;
        this.om = om;
        this.sitesUrl = sitesUrl;
        this.serviceUrl = serviceUrl;
        this.downloadUrl = downloadUrl;
    }

    /**
     * One page of the sampling-site layer ({@code Site_ID} only).
     */
    public PageRequester.Page sitesPage(int offset, int limit) {
        String url = sitesUrl
                + "?where=" + UpstreamHttp.enc("1=1")
                + "&outFields=Site_ID"
                + "&returnGeometry=false"
                + "&f=json"
                + "&resultOffset=" + offset
                + "&resultRecordCount=" + limit;
        UpstreamResponse resp = http.get(SOURCE, url, Map.of("Accept", "application/json"));
        if (!resp.ok()) {
            return new PageRequester.Page(resp.status(), null, resp.retryAfter());
        }
        try {
            JsonNode body = om.readTree(resp.body());
            return new PageRequester.Page(resp.status(), body, null);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("NDGIS site layer returned unreadable JSON", e);
        }
    }

    /**
     * Asks the service to prepare an export for a station. Returns the export
     * name, or null when the service answered with nothing.
     */
    public String datasetName(String stationId) {
        String body = http.postEmptyText(SOURCE, serviceUrl + "/" + UpstreamHttp.enc(stationId));
        if (body == null) {
            return null;
        }
        String name = body.replace("\"", "").trim();
        return name.isEmpty() ? null : name;
    }

    public String download(String datasetName) {
        return http.getText(SOURCE, downloadUrl + "/" + UpstreamHttp.enc(datasetName) + ".csv");
    }
}
