package space.ketterling.hydro.danr;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.Map;

/**
 * South Dakota DANR water quality. Each sample in a station's
 * {@code parameters[]} carries a {@code sampleDate} and one field per
 * measured constituent.
 */
public class DanrConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(DanrConnector.class);

    private final DanrClient client;
    private final SourceCatalog.Danr catalog;

    public DanrConnector(DanrClient client, SourceCatalog.Danr catalog) {
        this.client = client;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return DanrClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.WATER_QUALITY;
    }

    @Override
    public List<PullTarget> targets() {
        List<PullTarget> out = new ArrayList<>();
        for (SourceCatalog.DanrStation s : catalog.stations()) {
            out.add(PullTarget.of(s.id()));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        List<SeriesKey> keys = new ArrayList<>();
        for (String dataset : catalog.fields().values()) {
            keys.add(new SeriesKey(target.location(), dataset));
        }
        return keys;
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        String id = target.location();
        try {
            return parse(client.station(id), target);
        } catch (HydroException e) {
            log.warn("DANR {} fetch failed: {}", id, e.getMessage());
            return new RawPayload(name(), target, List.of(), List.of(Diagnostic.of(e, id)));
        }
    }

    RawPayload parse(JsonNode body, PullTarget target) {
        JsonNode samples = body.path("parameters");
        if (!samples.isArray()) {
            if (samples.isMissingNode() || samples.isNull()) {
                return RawPayload.of(name(), target, List.of());
            }
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.parse(target.location(), "parameters is not an array")));
        }
        List<RawRecord> records = new ArrayList<>();
        for (JsonNode sample : samples) {
            String date = sample.path("sampleDate").asText(null);
            if (date == null || date.isBlank()) {
                continue;
            }
            for (Map.Entry<String, String> field : catalog.fields().entrySet()) {
                JsonNode v = sample.get(field.getKey());
                if (v == null) {
                    continue;
                }
                String raw = v.isNull() ? null : v.asText();
                records.add(new RawRecord(target.location(), field.getValue(), date, raw));
            }
        }
        return RawPayload.of(name(), target, records);
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        return ConnectorSupport.process(payload, cutoff, r -> ValueConventions.danr(r.rawValue()));
    }
}
