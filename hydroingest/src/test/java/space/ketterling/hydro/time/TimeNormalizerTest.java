package space.ketterling.hydro.time;

import org.junit.jupiter.api.Test;
import space.ketterling.hydro.error.ErrorKind;
import space.ketterling.hydro.error.NormalizationException;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.RawRecord;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;
import space.ketterling.hydro.model.ValueReading;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeNormalizerTest {

    private static final Instant AUG_1 = Instant.parse("2024-08-01T00:00:00Z");

    @Test
    void detectsEachEncodingFromOneSample() {
        assertEquals(TimestampEncoding.EPOCH_SECONDS, TimeNormalizer.detect("1722470400"));
        assertEquals(TimestampEncoding.EPOCH_MILLIS, TimeNormalizer.detect("1722470400000"));
        assertEquals(TimestampEncoding.ISO_TEXT, TimeNormalizer.detect("2024-08-01T00:00:00"));
        assertEquals(TimestampEncoding.ISO_TEXT, TimeNormalizer.detect("2024-08-01"));
        assertEquals(TimestampEncoding.CUSTOM_TEXT, TimeNormalizer.detect("2024/08/01"));
        assertEquals(TimestampEncoding.CUSTOM_TEXT, TimeNormalizer.detect("2024-08-01 00:00:00"));
    }

    @Test
    void blankSampleCannotBeDetected() {
        assertThrows(NormalizationException.class, () -> TimeNormalizer.detect("  "));
    }

    @Test
    void batchDetectionSkipsBlankTimestamps() {
        List<RawRecord> rows = List.of(
                new RawRecord("Hazen", "Discharge", "", "1"),
                new RawRecord("Hazen", "Discharge", "1722470400", "2"));
        assertEquals(TimestampEncoding.EPOCH_SECONDS, TimeNormalizer.detect(rows));
    }

    @Test
    void everyEncodingRoundTripsWithinOneSecond() {
        Instant t = Instant.parse("2024-08-01T13:45:30.250Z");
        for (TimestampEncoding enc : TimestampEncoding.values()) {
            Instant back = TimeNormalizer.parse(TimeNormalizer.format(t, enc), enc);
            assertTrue(Duration.between(back, t).abs().compareTo(Duration.ofSeconds(1)) < 0,
                    enc + " came back as " + back);
        }
    }

    @Test
    void textValuesWithoutZoneAreUtcAndOffsetsAreHonoured() {
        assertEquals(AUG_1, TimeNormalizer.parse("2024-08-01 00:00:00", TimestampEncoding.CUSTOM_TEXT));
        assertEquals(AUG_1, TimeNormalizer.parse("2024/08/01", TimestampEncoding.CUSTOM_TEXT));
        assertEquals(AUG_1, TimeNormalizer.parse("2024-07-31T19:00-05:00", TimestampEncoding.ISO_TEXT));
        assertEquals(Instant.parse("2024-08-01T10:30:00Z"),
                TimeNormalizer.parse("8/1/2024 10:30:00 AM", TimestampEncoding.CUSTOM_TEXT));
    }

    @Test
    void unreadableRowIsDroppedWithDiagnosticAndOthersSurvive() {
        List<RawRecord> rows = List.of(
                new RawRecord("Hazen", "Gauge Height", "2024-08-01 00:00", "5.2"),
                new RawRecord("Hazen", "Gauge Height", "yesterday-ish", "5.3"),
                new RawRecord("Hazen", "Gauge Height", "2024-08-01 01:00", "5.4"));

        NormalizedBatch batch = TimeNormalizer.normalize(rows, r -> ValueReading.of(Double.parseDouble(r.rawValue())));

        assertEquals(TimestampEncoding.CUSTOM_TEXT, batch.encoding());
        assertEquals(2, batch.points().size());
        assertEquals(1, batch.diagnostics().size());
        assertEquals(ErrorKind.NORMALIZATION, batch.diagnostics().get(0).kind());
    }

    @Test
    void droppedValueWithReasonBecomesParseDiagnostic() {
        List<RawRecord> rows = List.of(new RawRecord("Hazen", "Discharge", "2024-08-01", "abc"));
        NormalizedBatch batch = TimeNormalizer.normalize(rows, r -> ValueReading.drop("bad value"));
        assertTrue(batch.points().isEmpty());
        assertEquals(ErrorKind.PARSE, batch.diagnostics().get(0).kind());
    }

    @Test
    void collapseKeepsLastRowAtDuplicateInstant() {
        List<CanonicalPoint> rows = List.of(
                new CanonicalPoint("Hazen", "Gauge Height", AUG_1, 5.2),
                new CanonicalPoint("Hazen", "Gauge Height", AUG_1, 5.5));

        Series s = TimeNormalizer.collapse(new SeriesKey("Hazen", "Gauge Height"), rows);

        assertEquals(1, s.size());
        assertEquals(5.5, s.points().get(0).value());
    }

    @Test
    void deduplicateKeepsExplicitNullsButCollapseDropsThem() {
        List<CanonicalPoint> rows = List.of(
                new CanonicalPoint("Bismarck", "pH", AUG_1.plusSeconds(60), 7.9),
                new CanonicalPoint("Bismarck", "pH", AUG_1, null));

        List<Series> ingest = TimeNormalizer.deduplicate(rows);
        assertEquals(2, ingest.get(0).size());
        assertNull(ingest.get(0).points().get(0).value());
        assertEquals(AUG_1, ingest.get(0).points().get(0).timestamp());

        List<Series> report = TimeNormalizer.collapse(rows);
        assertEquals(1, report.get(0).size());
    }

    @Test
    void outputIsAscendingPerSeries() {
        List<CanonicalPoint> rows = List.of(
                new CanonicalPoint("A", "x", AUG_1.plusSeconds(120), 3.0),
                new CanonicalPoint("B", "x", AUG_1, 9.0),
                new CanonicalPoint("A", "x", AUG_1, 1.0),
                new CanonicalPoint("A", "x", AUG_1.plusSeconds(60), 2.0));

        List<Series> out = TimeNormalizer.deduplicate(rows);

        assertEquals(2, out.size());
        Series a = out.get(0);
        assertEquals("A", a.location());
        assertEquals(List.of(1.0, 2.0, 3.0), a.points().stream().map(CanonicalPoint::value).toList());
    }
}
