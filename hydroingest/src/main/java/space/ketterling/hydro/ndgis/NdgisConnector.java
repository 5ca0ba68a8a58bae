package space.ketterling.hydro.ndgis;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.HydroException;
import space.ketterling.hydro.fetch.PageLayout;
import space.ketterling.hydro.fetch.PagedResult;
import space.ketterling.hydro.fetch.PaginatedFetcher;
import space.ketterling.hydro.ingest.ConnectorSupport;
import space.ketterling.hydro.ingest.ProcessResult;
import space.ketterling.hydro.ingest.SourceConnector;
import space.ketterling.hydro.ingest.ValueConventions;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.PullTarget;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.RawRecord;
import space.ketterling.hydro.model.SeriesKey;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * North Dakota DEQ water chemistry.
 *
 * <p>
 * Stations come from the catalog; when it lists none they are discovered from
 * the ArcGIS sampling-site layer on first use. Each station is a two-step
 * fetch: a POST that names the export, then the CSV download. The export
 * always holds the full history.
 * </p>
 */
public class NdgisConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(NdgisConnector.class);

    private final NdgisClient client;
    private final SourceCatalog.Ndgis catalog;
    private final PaginatedFetcher pager;
    private final int pageSize;

    private volatile List<String> discovered;

    public NdgisConnector(NdgisClient client, SourceCatalog.Ndgis catalog, PaginatedFetcher pager, int pageSize) {
        this.client = client;
        this.catalog = catalog;
        this.pager = pager;
        this.pageSize = pageSize;
    }

    @Override
    public String name() {
        return NdgisClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.WATER_QUALITY;
    }

    @Override
    public List<PullTarget> targets() {
        List<String> ids = catalog.stations() == null || catalog.stations().isEmpty()
                ? discoverStations()
                : catalog.stations();
        List<PullTarget> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            out.add(PullTarget.of(id));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        List<SeriesKey> keys = new ArrayList<>();
        for (String p : catalog.parameters()) {
            keys.add(new SeriesKey(target.location(), p));
        }
        return keys;
    }

    /**
     * Site IDs from the ArcGIS layer, deduplicated in first-seen order. Cached
     * after the first successful call.
     */
    synchronized List<String> discoverStations() {
        if (discovered != null) {
            return discovered;
        }
        PagedResult result = pager.fetchAll("NDGIS sites", PageLayout.ARCGIS, pageSize, client::sitesPage);
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode feature : result.rows()) {
            JsonNode id = feature.path("attributes").path("Site_ID");
            if (!id.isMissingNode() && !id.isNull() && !id.asText().isBlank()) {
                ids.add(id.asText().trim());
            }
        }
        if (result.partial()) {
            log.warn("NDGIS site discovery incomplete ({} ids): {}", ids.size(), result.diagnostics());
            return List.copyOf(ids);
        }
        log.info("NDGIS discovered {} stations", ids.size());
        discovered = List.copyOf(ids);
        return discovered;
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        String station = target.location();
        try {
            String name = client.datasetName(station);
            if (name == null) {
                return new RawPayload(name(), target, List.of(),
                        List.of(Diagnostic.fetch(station, "no export available")));
            }
            List<RawRecord> records = NdgisCsvParser.parse(client.download(name), station, catalog.parameters());
            return RawPayload.of(name(), target, records);
        } catch (HydroException e) {
            log.warn("NDGIS {} fetch failed: {}", station, e.getMessage());
            return new RawPayload(name(), target, List.of(), List.of(Diagnostic.of(e, station)));
        }
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        return ConnectorSupport.process(payload, cutoff, r -> ValueConventions.ndgis(r.rawValue()));
    }
}
