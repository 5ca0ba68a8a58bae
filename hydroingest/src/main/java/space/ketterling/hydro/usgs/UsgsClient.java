package space.ketterling.hydro.usgs;

import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.fetch.DateRange;
import space.ketterling.hydro.fetch.UpstreamHttp;

import java.util.StringJoiner;

/**
 * NWIS instantaneous-values service, legacy RDB output.
 */
public final class UsgsClient {
    static final String SOURCE = "USGS";

    private final UpstreamHttp http;
    private final String baseUrl;

    public UsgsClient(UpstreamHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    /**
     * Returns the raw RDB text for one site and day range.
     */
    public String fetchRdb(SourceCatalog.UsgsSite site, DateRange range) {
        return http.getText(SOURCE, rdbUrl(site, range));
    }

    String rdbUrl(SourceCatalog.UsgsSite site, DateRange range) {
        StringJoiner params = new StringJoiner("&");
        for (String code : site.parameters()) {
            params.add("cb_" + code + "=on");
        }
        return baseUrl + "?" + params
                + "&format=rdb"
                + "&site_no=" + UpstreamHttp.enc(site.code())
                + "&legacy=1&period="
                + "&begin_date=" + range.start()
                + "&end_date=" + range.end();
    }
}
