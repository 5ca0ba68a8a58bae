package space.ketterling.hydro.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * Groups database, API, per-source endpoint and ingest tuning settings. A
 * blank credential (for example {@code noaaToken}) disables only the
 * connector that needs it.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbApiPoolMax,
        int dbIngestPoolMax,

        // Upstream endpoints
        String noaaBaseUrl,
        String noaaToken,
        String usgsBaseUrl,
        String usaceBaseUrl,
        String usbrBaseUrl,
        String acisBaseUrl,
        String ndgisSitesUrl,
        String ndgisServiceUrl,
        String ndgisDownloadUrl,
        String danrBaseUrl,

        // Fetch behaviour
        Duration pageDelay,
        Duration backoffInitial,
        Duration backoffMax,
        Duration httpTimeout,
        int noaaPageSize,
        int noaaChunkDays,
        double noaaValueScale,
        int usgsChunkDays,
        int arcgisPageSize,

        // Ingest / report
        int ingestWorkers,
        int storeAttempts,
        LocalDate backfillStart,
        int reportDefaultDays,
        String exportDir) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read application.properties", e);
        }
        return fromProperties(p);
    }

    /**
     * Builds a configuration from explicit properties. Environment variables
     * and {@code -D} properties still take precedence.
     */
    public static AppConfig fromProperties(Properties p) {
        String dbUrl = requireNonBlank("db.jdbcUrl", envOr(p, "DB_JDBC_URL", "db.jdbcUrl", ""));
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbApiPoolMax = Integer.parseInt(envOr(p, "DB_API_POOL_MAX", "db.api.poolMax", "4"));
        int dbIngestPoolMax = Integer.parseInt(envOr(p, "DB_INGEST_POOL_MAX", "db.ingest.poolMax", "8"));
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));

        String noaaBase = envOr(p, "NOAA_BASE_URL", "noaa.baseUrl", "https://www.ncei.noaa.gov/cdo-web/api/v2");
        String noaaToken = envOr(p, "NOAA_TOKEN", "noaa.token", "");
        String usgsBase = envOr(p, "USGS_BASE_URL", "usgs.baseUrl", "https://waterdata.usgs.gov/nwis/uv");
        String usaceBase = envOr(p, "USACE_BASE_URL", "usace.baseUrl",
                "https://www.nwd-mr.usace.army.mil/rcc/programs/data");
        String usbrBase = envOr(p, "USBR_BASE_URL", "usbr.baseUrl", "https://www.usbr.gov/gp-bin/arcread.pl");
        String acisBase = envOr(p, "ACIS_BASE_URL", "acis.baseUrl", "https://data.rcc-acis.org/StnData");
        String ndgisSites = envOr(p, "NDGIS_SITES_URL", "ndgis.sitesUrl",
                "https://ndgishub.nd.gov/arcgis/rest/services/Applications/DOH_SurfaceWaterSamplingSites/MapServer/0/query");
        String ndgisService = envOr(p, "NDGIS_SERVICE_URL", "ndgis.serviceUrl",
                "https://deq.nd.gov/Webservices_SWDataApp/DownloadStationsData/GetStationsWaterChemData");
        String ndgisDownload = envOr(p, "NDGIS_DOWNLOAD_URL", "ndgis.downloadUrl",
                "https://deq.nd.gov/WQ/3_Watershed_Mgmt/SWDataApp/downloaddata");
        String danrBase = envOr(p, "DANR_BASE_URL", "danr.baseUrl", "https://apps.sd.gov/NR92WQMAP/api/station");

        Duration pageDelay = Duration.parse(envOr(p, "FETCH_PAGE_DELAY", "fetch.pageDelay", "PT0.25S"));
        Duration backoffInitial = Duration.parse(envOr(p, "FETCH_BACKOFF_INITIAL", "fetch.backoffInitial", "PT1S"));
        Duration backoffMax = Duration.parse(envOr(p, "FETCH_BACKOFF_MAX", "fetch.backoffMax", "PT60S"));
        Duration httpTimeout = Duration.parse(envOr(p, "FETCH_HTTP_TIMEOUT", "fetch.httpTimeout", "PT60S"));
        int noaaPageSize = Integer.parseInt(envOr(p, "NOAA_PAGE_SIZE", "noaa.pageSize", "1000"));
        int noaaChunkDays = Integer.parseInt(envOr(p, "NOAA_CHUNK_DAYS", "noaa.chunkDays", "365"));
        double noaaScale = Double.parseDouble(envOr(p, "NOAA_VALUE_SCALE", "noaa.valueScale", "10"));
        int usgsChunkDays = Integer.parseInt(envOr(p, "USGS_CHUNK_DAYS", "usgs.chunkDays", "60"));
        int arcgisPageSize = Integer.parseInt(envOr(p, "NDGIS_PAGE_SIZE", "ndgis.pageSize", "2000"));

        int workers = Integer.parseInt(envOr(p, "INGEST_WORKERS", "ingest.workers", "4"));
        int storeAttempts = Integer.parseInt(envOr(p, "INGEST_STORE_ATTEMPTS", "ingest.storeAttempts", "3"));
        LocalDate backfillStart = LocalDate.parse(envOr(p, "INGEST_BACKFILL_START", "ingest.backfillStart",
                "2019-01-01"));
        int reportDays = Integer.parseInt(envOr(p, "REPORT_DEFAULT_DAYS", "report.defaultDays", "30"));
        String exportDir = envOr(p, "EXPORT_DIR", "export.dir", "./export");

        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbApiPoolMax,
                dbIngestPoolMax,

                noaaBase,
                noaaToken,
                usgsBase,
                usaceBase,
                usbrBase,
                acisBase,
                ndgisSites,
                ndgisService,
                ndgisDownload,
                danrBase,

                pageDelay,
                backoffInitial,
                backoffMax,
                httpTimeout,
                noaaPageSize,
                noaaChunkDays,
                noaaScale,
                usgsChunkDays,
                arcgisPageSize,

                Math.max(1, workers),
                Math.max(1, storeAttempts),
                backfillStart,
                reportDays,
                exportDir);
    }

    public boolean hasNoaaToken() {
        return noaaToken != null && !noaaToken.isBlank();
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    private static String requireNonBlank(String key, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + key + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
