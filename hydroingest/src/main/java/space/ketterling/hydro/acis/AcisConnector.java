package space.ketterling.hydro.acis;

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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CoCoRaHS observer stations through ACIS. One request per station returns
 * rows of {@code [date, elem1, elem2, ...]} in element order.
 */
public class AcisConnector implements SourceConnector {
    private static final Logger log = LoggerFactory.getLogger(AcisConnector.class);

    private final AcisClient client;
    private final SourceCatalog.Acis catalog;

    public AcisConnector(AcisClient client, SourceCatalog.Acis catalog) {
        this.client = client;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return AcisClient.SOURCE;
    }

    @Override
    public DatasetCategory category() {
        return DatasetCategory.PRECIPITATION;
    }

    @Override
    public List<PullTarget> targets() {
        List<PullTarget> out = new ArrayList<>();
        for (SourceCatalog.AcisStation s : catalog.stations()) {
            out.add(PullTarget.of(s.location()));
        }
        return out;
    }

    @Override
    public List<SeriesKey> seriesFor(PullTarget target) {
        List<SeriesKey> keys = new ArrayList<>();
        for (String dataset : catalog.elements().keySet()) {
            keys.add(new SeriesKey(target.location(), dataset));
        }
        return keys;
    }

    @Override
    public RawPayload fetch(PullTarget target, FetchWindow window) {
        Optional<SourceCatalog.AcisStation> station = catalog.stations().stream()
                .filter(s -> s.location().equals(target.location()))
                .findFirst();
        if (station.isEmpty()) {
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.fetch(target.toString(), "unknown ACIS station")));
        }
        SourceCatalog.AcisStation s = station.get();

        LocalDate start = window.startDate();
        if (s.start() != null) {
            LocalDate first = LocalDate.parse(s.start());
            if (first.isAfter(start)) {
                start = first;
            }
        }
        if (start.isAfter(window.endDate())) {
            log.info("ACIS {} starts after the requested window, nothing to fetch", s.sid());
            return RawPayload.of(name(), target, List.of());
        }

        try {
            JsonNode body = client.stnData(s.sid(), start, window.endDate(), catalog.elements().values());
            return parse(body, target, s.sid());
        } catch (HydroException e) {
            log.warn("ACIS {} fetch failed: {}", s.sid(), e.getMessage());
            return new RawPayload(name(), target, List.of(), List.of(Diagnostic.of(e, s.sid())));
        }
    }

    RawPayload parse(JsonNode body, PullTarget target, String sid) {
        if (body.hasNonNull("error")) {
            return new RawPayload(name(), target, List.of(),
                    List.of(Diagnostic.fetch(sid, "ACIS error: " + body.get("error").asText())));
        }
        List<String> datasets = new ArrayList<>(catalog.elements().keySet());
        List<RawRecord> records = new ArrayList<>();
        for (JsonNode row : body.path("data")) {
            if (!row.isArray() || row.size() == 0) {
                continue;
            }
            String date = row.get(0).asText();
            for (int i = 0; i < datasets.size(); i++) {
                JsonNode cell = row.get(i + 1);
                String raw = cell == null || cell.isNull() ? null : cell.asText();
                records.add(new RawRecord(target.location(), datasets.get(i), date, raw));
            }
        }
        return RawPayload.of(name(), target, records);
    }

    @Override
    public ProcessResult process(RawPayload payload, PullCutoff cutoff) {
        return ConnectorSupport.process(payload, cutoff, r -> ValueConventions.acis(r.rawValue()));
    }
}
