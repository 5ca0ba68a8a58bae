package space.ketterling.hydro.usace;

import space.ketterling.hydro.fetch.UpstreamHttp;

/**
 * Missouri River basin reservoir bulletins, one plain-text page per project.
 */
public final class UsaceClient {
    static final String SOURCE = "USACE";

    private final UpstreamHttp http;
    private final String baseUrl;

    public UsaceClient(UpstreamHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    public String bulletin(String projectCode) {
        return http.getText(SOURCE, baseUrl + "/" + UpstreamHttp.enc(projectCode));
    }
}
