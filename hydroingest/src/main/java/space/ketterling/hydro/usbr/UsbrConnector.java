package space.ketterling.hydro.usbr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.HydroException;
import space.ketterling.hydro.ingest.ConnectorSupport;
import space.ketterling.hydro.ingest.ProcessResult;
import space.ketterling.hydro.ingest.SourceConnector;
import space.ketterling.hydro.ingest.ValueConventions;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.PullTarget;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.SeriesKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shadehill reservoir daily archive. One target per parameter so a failed
 * parameter does not cost the others.
 */
public class UsbrConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(UsbrConnector.class);

    private final UsbrClient client;
    private final SourceCatalog.Usbr catalog;

    public UsbrConnector(UsbrClient client, SourceCatalog.Usbr catalog) {
        this.client = client;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return UsbrClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.RESERVOIR;
    }

    @Override
    public List<PullTarget> targets() {
        List<PullTarget> out = new ArrayList<>();
        for (String dataset : catalog.datasets().values()) {
            out.add(PullTarget.of(catalog.location(), dataset));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        return target.datasetOpt()
                .map(ds -> List.of(new SeriesKey(target.location(), ds)))
                .orElse(List.of());
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        String dataset = target.dataset();
        String code = codeFor(dataset);
        if (code == null) {
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.fetch(target.toString(), "unknown USBR parameter")));
        }
        String unit = catalog.station() + "/" + code;
        try {
            String text = client.archive(catalog.station(), code, window.startDate(), window.endDate());
            return RawPayload.of(name(), target, UsbrArchiveParser.parse(text, target.location(), dataset));
        } catch (HydroException e) {
            log.warn("USBR {} fetch failed: {}", unit, e.getMessage());
            return new RawPayload(name(), target, List.of(), List.of(Diagnostic.of(e, unit)));
        }
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        return ConnectorSupport.process(payload, cutoff, r -> ValueConventions.usbr(r.rawValue()));
    }

    private String codeFor(String dataset) {
        if (dataset == null) {
            return null;
        }
        for (Map.Entry<String, String> e : catalog.datasets().entrySet()) {
            if (e.getValue().equals(dataset)) {
                return e.getKey();
            }
        }
        return null;
    }
}
