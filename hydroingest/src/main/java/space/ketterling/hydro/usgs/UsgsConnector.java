package space.ketterling.hydro.usgs;

import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.fetch.ChunkedRangeFetcher;
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
import java.util.Optional;

/**
 * USGS river gauges. NWIS truncates long ranges, so every site is fetched in
 * fixed-size day chunks.
 */
public class UsgsConnector implements SourceConnector {

    private final UsgsClient client;
    private final SourceCatalog.Usgs catalog;
    private final ChunkedRangeFetcher chunker;

    public UsgsConnector(UsgsClient client, SourceCatalog.Usgs catalog, ChunkedRangeFetcher chunker) {
        this.client = client;
        this.catalog = catalog;
        this.chunker = chunker;
    }

    @Override
    public String name() {
        return UsgsClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.GAUGE;
    }

    @Override
    public List<PullTarget> targets() {
        List<PullTarget> out = new ArrayList<>();
        for (SourceCatalog.UsgsSite s : catalog.sites()) {
            out.add(PullTarget.of(s.location()));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        List<SeriesKey> keys = new ArrayList<>();
        site(target.location()).ifPresent(s -> {
            for (String code : s.parameters()) {
                String dataset = catalog.parameterNames().get(code);
                if (dataset != null) {
                    keys.add(new SeriesKey(s.location(), dataset));
                }
            }
        });
        return keys;
    }

    /** NWIS reads begin_date in the site's local time, not UTC. */
    @Override
    public Duration refetchOverlap() {
        return Duration.ofDays(1);
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        Optional<SourceCatalog.UsgsSite> site = site(target.location());
        if (site.isEmpty()) {
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.fetch(target.toString(), "unknown USGS site")));
        }
        SourceCatalog.UsgsSite s = site.get();
        ChunkedRangeFetcher.ChunkedResult<RawRecord> result = chunker.fetch(
                "USGS " + s.code(), window.startDate(), window.endDate(),
                chunk -> UsgsRdbParser.parse(client.fetchRdb(s, chunk), s.location(), catalog.parameterNames()));
        return new RawPayload(name(), target, result.items(), result.diagnostics());
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        return ConnectorSupport.process(payload, cutoff, r -> ValueConventions.usgs(r.dataset(), r.rawValue()));
    }

    private Optional<SourceCatalog.UsgsSite> site(String location) {
        return catalog.sites().stream().filter(s -> s.location().equals(location)).findFirst();
    }
}
