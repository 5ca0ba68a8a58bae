package space.ketterling.hydro.noaa;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.fetch.ChunkedRangeFetcher;
import space.ketterling.hydro.fetch.PageLayout;
import space.ketterling.hydro.fetch.PagedResult;
import space.ketterling.hydro.fetch.PaginatedFetcher;
import space.ketterling.hydro.fetch.Sleeper;
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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * NOAA GHCND daily summaries.
 *
 * <p>
 * One target per GHCND station. Each station's rows are fanned out to every
 * display location mapped onto it, so a single request serves e.g. both
 * "Bismarck" and "Hazen/Mercer". Long ranges are cut into yearly chunks and
 * each chunk is paged through with {@link PaginatedFetcher}.
 * </p>
 */
public class NoaaConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(NoaaConnector.class);

    private final NoaaClient client;
    private final SourceCatalog.Noaa catalog;
    private final PaginatedFetcher pager;
    private final ChunkedRangeFetcher chunker;
    private final int pageSize;
    private final double valueScale;
    private final boolean enabled;
    private final Duration datatypeDelay;
    private final Sleeper sleeper;

    public NoaaConnector(NoaaClient client, SourceCatalog.Noaa catalog, PaginatedFetcher pager,
            ChunkedRangeFetcher chunker, int pageSize, double valueScale, boolean enabled, Duration datatypeDelay,
            Sleeper sleeper) {
        this.client = client;
        this.catalog = catalog;
        this.pager = pager;
        this.chunker = chunker;
        this.pageSize = pageSize;
        this.valueScale = valueScale;
        this.enabled = enabled;
        this.datatypeDelay = datatypeDelay;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return NoaaClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.WEATHER;
    }

    /** NOAA requires a token; without one the connector is skipped. */
    @Override
    public boolean enabled() {
        return enabled;
    }

    @Override
    public List<PullTarget> targets() {
        List<PullTarget> out = new ArrayList<>();
        for (String station : catalog.stations().keySet()) {
            out.add(PullTarget.of(station));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        List<SeriesKey> keys = new ArrayList<>();
        for (String location : locationsFor(target.location())) {
            for (String dataset : catalog.datatypes().keySet()) {
                keys.add(new SeriesKey(location, dataset));
            }
        }
        return keys;
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        String stationId = catalog.stations().get(target.location());
        if (stationId == null) {
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.fetch(target.toString(), "unknown NOAA station")));
        }
        List<String> locations = locationsFor(target.location());
        List<RawRecord> records = new ArrayList<>();
        List<Diagnostic> diags = new ArrayList<>();

        boolean first = true;
        for (Map.Entry<String, String> dt : catalog.datatypes().entrySet()) {
            if (!first && !pause()) {
                diags.add(Diagnostic.fetch(stationId, "interrupted between datatypes"));
                break;
            }
            first = false;

            String dataset = dt.getKey();
            String datatypeId = dt.getValue();
            String unit = stationId + "/" + datatypeId;

            ChunkedRangeFetcher.ChunkedResult<JsonNode> rows = chunker.fetch(unit, window.startDate(),
                    window.endDate(), chunk -> {
                        PagedResult paged = pager.fetchAll(unit + "@" + chunk, PageLayout.NOAA_CDO, pageSize,
                                (offset, limit) -> client.data(stationId, datatypeId, chunk.start(), chunk.end(),
                                        limit, offset));
                        diags.addAll(paged.diagnostics());
                        return paged.rows();
                    });
            diags.addAll(rows.diagnostics());

            for (JsonNode row : rows.items()) {
                String date = row.path("date").asText(null);
                JsonNode value = row.get("value");
                String raw = value == null || value.isNull() ? null : value.asText();
                for (String location : locations) {
                    records.add(new RawRecord(location, dataset, date, raw));
                }
            }
            log.debug("NOAA {} {}: {} rows", stationId, datatypeId, rows.items().size());
        }

        return new RawPayload(name(), target, records, diags);
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        Set<String> scaled = Set.copyOf(catalog.scaled());
        return ConnectorSupport.process(payload, cutoff, r -> scaled.contains(r.dataset())
                ? ValueConventions.noaa(r.rawValue(), valueScale)
                : ValueConventions.noaa(r.rawValue(), 1.0));
    }

    List<String> locationsFor(String stationKey) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, String> e : catalog.locations().entrySet()) {
            if (e.getValue().equals(stationKey)) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    private boolean pause() {
        try {
            sleeper.sleep(datatypeDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
