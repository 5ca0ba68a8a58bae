package space.ketterling.hydro;

import com.fasterxml.jackson.databind.ObjectMapper;
import space.ketterling.hydro.acis.AcisClient;
import space.ketterling.hydro.acis.AcisConnector;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.config.AppConfig;
import space.ketterling.hydro.danr.DanrClient;
import space.ketterling.hydro.danr.DanrConnector;
import space.ketterling.hydro.fetch.ChunkedRangeFetcher;
import space.ketterling.hydro.fetch.PaginatedFetcher;
import space.ketterling.hydro.fetch.Sleeper;
import space.ketterling.hydro.fetch.UpstreamHttp;
import space.ketterling.hydro.ingest.SourceConnector;
import space.ketterling.hydro.ndgis.NdgisClient;
import space.ketterling.hydro.ndgis.NdgisConnector;
import space.ketterling.hydro.noaa.NoaaClient;
import space.ketterling.hydro.noaa.NoaaConnector;
import space.ketterling.hydro.usace.UsaceClient;
import space.ketterling.hydro.usace.UsaceConnector;
import space.ketterling.hydro.usbr.UsbrClient;
import space.ketterling.hydro.usbr.UsbrConnector;
import space.ketterling.hydro.usgs.UsgsClient;
import space.ketterling.hydro.usgs.UsgsConnector;

import java.time.Duration;
import java.util.List;

/**
 * Wires every upstream connector from configuration and the catalog.
 */
public final class Connectors {

    private Connectors() {
    }

    public static List<SourceConnector> all(AppConfig cfg, SourceCatalog catalog, ObjectMapper om, Sleeper sleeper) {
        UpstreamHttp http = new UpstreamHttp(cfg.httpTimeout());
        PaginatedFetcher pager = new PaginatedFetcher(cfg.pageDelay(), cfg.backoffInitial(), cfg.backoffMax(),
                sleeper);

        NoaaConnector noaa = new NoaaConnector(
                new NoaaClient(http, om, cfg.noaaBaseUrl(), cfg.noaaToken()),
                catalog.noaa(), pager,
                new ChunkedRangeFetcher(cfg.noaaChunkDays(), cfg.pageDelay(), sleeper),
                cfg.noaaPageSize(), cfg.noaaValueScale(), cfg.hasNoaaToken(), cfg.pageDelay(), sleeper);

        UsgsConnector usgs = new UsgsConnector(
                new UsgsClient(http, cfg.usgsBaseUrl()),
                catalog.usgs(),
                new ChunkedRangeFetcher(cfg.usgsChunkDays(), Duration.ZERO, sleeper));

        return List.of(
                usgs,
                noaa,
                new UsaceConnector(new UsaceClient(http, cfg.usaceBaseUrl()), catalog.usace()),
                new UsbrConnector(new UsbrClient(http, cfg.usbrBaseUrl()), catalog.usbr()),
                new AcisConnector(new AcisClient(http, om, cfg.acisBaseUrl()), catalog.acis()),
                new NdgisConnector(
                        new NdgisClient(http, om, cfg.ndgisSitesUrl(), cfg.ndgisServiceUrl(), cfg.ndgisDownloadUrl()),
                        catalog.ndgis(), pager, cfg.arcgisPageSize()),
                new DanrConnector(new DanrClient(http, om, cfg.danrBaseUrl()), catalog.danr()));
    }
}
