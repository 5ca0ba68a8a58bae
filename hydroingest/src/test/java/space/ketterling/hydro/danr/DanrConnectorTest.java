package space.ketterling.hydro.danr;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.error.ErrorKind;
import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.ingest.ProcessResult;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.PullTarget;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.Series;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DanrConnectorTest {

    private static final ObjectMapper OM = new ObjectMapper();
    private static final PullTarget STATION = PullTarget.of("460721");
    private static final FetchWindow ANY = FetchWindow.of(LocalDate.of(2019, 1, 1), LocalDate.of(2019, 12, 31));

    private final DanrClient client = mock(DanrClient.class);
    private final DanrConnector connector = new DanrConnector(client, catalog());

    private static SourceCatalog.Danr catalog() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("ph", "pH");
        fields.put("totalPhosphorus", "Total Phosphorus");
        return new SourceCatalog.Danr(List.of(new SourceCatalog.DanrStation("460721", 45.7, -102.2)), fields);
    }

    @Test
    void samplesBecomeOneRecordPerField() throws Exception {
        when(client.station("460721")).thenReturn(OM.readTree("{\"parameters\":["
                + "{\"sampleDate\":\"2019-05-14T10:30:00\",\"ph\":\"8.1\",\"totalPhosphorus\":\"<0.02\"},"
                + "{\"sampleDate\":\"2019-06-11T09:00:00\",\"ph\":null},"
                + "{\"ph\":\"7.7\"}]}"));

        RawPayload p = connector.fetch(STATION, ANY);
        ProcessResult r = connector.process(p, PullCutoff.none());

        assertEquals(3, p.records().size());
        Series ph = r.series().stream().filter(s -> s.dataset().equals("pH")).findFirst().orElseThrow();
        assertEquals(8.1, ph.points().get(0).value());
        assertNull(ph.points().get(1).value());
        Series tp = r.series().stream().filter(s -> s.dataset().equals("Total Phosphorus")).findFirst().orElseThrow();
        assertNull(tp.points().get(0).value());
    }

    @Test
    void missingParametersIsNoData() throws Exception {
        when(client.station("460721")).thenReturn(OM.readTree("{}"));

        RawPayload p = connector.fetch(STATION, ANY);

        assertTrue(p.isEmpty());
        assertTrue(p.diagnostics().isEmpty());
    }

    @Test
    void wrongShapeIsParseDiagnostic() throws Exception {
        when(client.station("460721")).thenReturn(OM.readTree("{\"parameters\":\"none\"}"));

        assertEquals(ErrorKind.PARSE, connector.fetch(STATION, ANY).diagnostics().get(0).kind());
    }

    @Test
    void unreadableBodyIsContained() {
        when(client.station("460721")).thenThrow(new PayloadParseException("DANR returned unreadable JSON"));

        RawPayload p = connector.fetch(STATION, ANY);

        assertTrue(p.failed());
        assertEquals(ErrorKind.PARSE, p.diagnostics().get(0).kind());
    }
}
