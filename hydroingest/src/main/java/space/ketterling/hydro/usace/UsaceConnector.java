package space.ketterling.hydro.usace;

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
import space.ketterling.hydro.model.RawRecord;
import space.ketterling.hydro.model.SeriesKey;

import java.util.ArrayList;
import java.util.List;

/**
 * USACE mainstem dams. The bulletin always covers the most recent days and
 * takes no date range, so the window is ignored on fetch; the cutoff and the
 * pipeline's window clip do the filtering.
 */
public class UsaceConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(UsaceConnector.class);

    private final UsaceClient client;
    private final SourceCatalog.Usace catalog;

    public UsaceConnector(UsaceClient client, SourceCatalog.Usace catalog) {
        this.client = client;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return UsaceClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.DAM;
    }

    @Override
    public List<PullTarget> targets() {
        List<PullTarget> out = new ArrayList<>();
        for (SourceCatalog.UsaceProject p : catalog.projects()) {
            out.add(PullTarget.of(p.location()));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        List<SeriesKey> keys = new ArrayList<>();
        for (String column : catalog.columns()) {
            keys.add(new SeriesKey(target.location(), column));
        }
        return keys;
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        String code = catalog.projects().stream()
                .filter(p -> p.location().equals(target.location()))
                .map(SourceCatalog.UsaceProject::code)
                .findFirst().orElse(null);
        if (code == null) {
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.fetch(target.toString(), "unknown USACE project")));
        }
        try {
            String text = client.bulletin(code);
            List<RawRecord> records = UsaceBulletinParser.parse(text, target.location(), catalog.columns());
            if (records.isEmpty() && text != null && !text.isBlank()) {
                log.warn("USACE {} bulletin had no data lines", code);
                return new RawPayload(name(), target, List.of(),
                        List.of(Diagnostic.parse(code, "bulletin contained no data lines")));
            }
            return RawPayload.of(name(), target, records);
        } catch (HydroException e) {
            log.warn("USACE {} fetch failed: {}", code, e.getMessage());
            return new RawPayload(name(), target, List.of(), List.of(Diagnostic.of(e, code)));
        }
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        return ConnectorSupport.process(payload, cutoff, r -> ValueConventions.usace(r.rawValue()));
    }
}
