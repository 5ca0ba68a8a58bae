package space.ketterling.hydro.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Stations, sites and dataset names for every upstream, loaded once from the
 * {@code catalog.json} classpath resource.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceCatalog(Usgs usgs, Noaa noaa, Usace usace, Usbr usbr, Acis acis, Ndgis ndgis, Danr danr) {

    public static final String DEFAULT_RESOURCE = "catalog.json";

    public static SourceCatalog load(ObjectMapper om) {
        return load(om, DEFAULT_RESOURCE);
    }

    public static SourceCatalog load(ObjectMapper om, String resource) {
        try (InputStream in = SourceCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Catalog resource not found: " + resource);
            }
            return om.readValue(in, SourceCatalog.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + resource, e);
        }
    }

    // ---- USGS gauges ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usgs(List<UsgsSite> sites, Map<String, String> parameterNames) {
    }

    /** One NWIS site and the parameter codes it reports. */
    public record UsgsSite(String location, String code, List<String> parameters) {
    }

    // ---- NOAA GHCND ----

    /**
     * {@code locations} maps each display location to a key of
     * {@code stations}; several locations share one GHCND station.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Noaa(Map<String, String> stations, Map<String, String> locations, Map<String, String> datatypes,
            List<String> scaled) {

        public String stationFor(String location) {
            String mapped = locations.get(location);
            return mapped == null ? null : stations.get(mapped);
        }
    }

    // ---- USACE dams ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usace(List<UsaceProject> projects, List<String> columns) {
    }

    public record UsaceProject(String location, String code) {
    }

    // ---- USBR Shadehill ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usbr(String station, String location, Map<String, String> datasets) {
    }

    // ---- ACIS / CoCoRaHS ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Acis(List<AcisStation> stations, Map<String, String> elements) {
    }

    /** {@code start} is the first day the station reported (ISO date). */
    public record AcisStation(String location, String sid, String start) {
    }

    // ---- ND DEQ water chemistry ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ndgis(List<String> stations, List<String> parameters) {
    }

    // ---- SD DANR water quality ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Danr(List<DanrStation> stations, Map<String, String> fields) {
    }

    public record DanrStation(String id, double latitude, double longitude) {
    }
}
