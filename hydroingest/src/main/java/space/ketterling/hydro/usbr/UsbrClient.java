package space.ketterling.hydro.usbr;

import space.ketterling.hydro.fetch.UpstreamHttp;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Great Plains region archive ({@code arcread.pl}). Takes a form POST with the
 * station, parameter code and a begin/end date split into fields.
 */
public final class UsbrClient {
    static final String SOURCE = "USBR";

    private final UpstreamHttp http;
    private final String baseUrl;

    public UsbrClient(UpstreamHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    public String archive(String station, String parameter, LocalDate start, LocalDate end) {
        return http.postFormText(SOURCE, baseUrl, form(station, parameter, start, end));
    }

    static Map<String, String> form(String station, String parameter, LocalDate start, LocalDate end) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("st", station);
        form.put("by", String.valueOf(start.getYear()));
        form.put("bm", String.format("%02d", start.getMonthValue()));
        form.put("bd", String.format("%02d", start.getDayOfMonth()));
        form.put("ey", String.valueOf(end.getYear()));
        form.put("em", String.format("%02d", end.getMonthValue()));
        form.put("ed", String.format("%02d", end.getDayOfMonth()));
        form.put("pa", parameter);
        return form;
    }
}
