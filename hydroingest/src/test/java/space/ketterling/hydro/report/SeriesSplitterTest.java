package space.ketterling.hydro.report;

import org.junit.jupiter.api.Test;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SeriesSplitterTest {

    private static final SeriesKey KEY = new SeriesKey("Medora", "Discharge");
    private static final Instant T0 = Instant.parse("2024-08-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(900);
    private static final Instant T2 = T0.plusSeconds(1800);

    private static CanonicalPoint p(String location, Instant t, Double v) {
        return new CanonicalPoint(location, "Discharge", t, v);
    }

    private static List<Double> values(Series s) {
        return s.points().stream().map(CanonicalPoint::value).toList();
    }

    @Test
    void splitAssignsOccurrenceIndexPerTimestamp() {
        List<CanonicalPoint> rows = List.of(
                p("Medora", T0, 1.0),
                p("Medora", T0, 10.0),
                p("Medora", T1, 2.0),
                p("Medora", T2, 3.0),
                p("Medora", T2, 30.0),
                p("Medora", T2, 300.0));

        List<Series> parts = SeriesSplitter.split(KEY, rows);

        assertEquals(3, parts.size());
        assertEquals(List.of(1.0, 2.0, 3.0), values(parts.get(0)));
        assertEquals(List.of(10.0, 30.0), values(parts.get(1)));
        assertEquals(List.of(300.0), values(parts.get(2)));
    }

    @Test
    void splitWithoutDuplicatesIsOneSeries() {
        List<Series> parts = SeriesSplitter.split(KEY, List.of(p("Medora", T1, 2.0), p("Medora", T0, 1.0)));
        assertEquals(1, parts.size());
        assertEquals(List.of(1.0, 2.0), values(parts.get(0)));
    }

    @Test
    void splitIgnoresNullRowsWhenCountingOccurrences() {
        List<Series> parts = SeriesSplitter.split(KEY, List.of(p("Medora", T0, null), p("Medora", T0, 4.0)));
        assertEquals(1, parts.size());
        assertEquals(List.of(4.0), values(parts.get(0)));
    }

    @Test
    void collapseKeepsLastAndRelabelsOtherLocations() {
        List<CanonicalPoint> rows = List.of(
                p("Medora", T0, 1.0),
                p("Medora (alt)", T0, 2.0),
                p("Medora (alt)", T1, 5.0));

        Series s = SeriesSplitter.collapse(KEY, rows);

        assertEquals("Medora", s.location());
        assertEquals(List.of(2.0, 5.0), values(s));
        assertEquals("Medora", s.points().get(1).location());
    }

    @Test
    void collapseOfNothingIsEmptySeriesForKey() {
        Series s = SeriesSplitter.collapse(KEY, List.of());
        assertEquals(KEY, s.key());
        assertEquals(0, s.size());
    }
}
