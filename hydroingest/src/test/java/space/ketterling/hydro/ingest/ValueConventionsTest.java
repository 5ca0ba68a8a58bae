package space.ketterling.hydro.ingest;

import org.junit.jupiter.api.Test;
import space.ketterling.hydro.model.ValueReading;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueConventionsTest {

    private static void assertMissing(ValueReading r) {
        assertTrue(r.keep(), "expected a kept row");
        assertNull(r.value());
    }

    private static void assertDropped(ValueReading r) {
        assertFalse(r.keep(), "expected a dropped row");
    }

    @Test
    void usgsIceAndQualifiers() {
        assertEquals(0.0, ValueConventions.usgs("Discharge", "Ice").value());
        assertMissing(ValueConventions.usgs("Gauge Height", "Ice"));
        assertMissing(ValueConventions.usgs("Discharge", "Eqp"));
        assertMissing(ValueConventions.usgs("Discharge", "Zfl"));
        assertEquals(1234.0, ValueConventions.usgs("Discharge", "1,234").value());
        assertDropped(ValueConventions.usgs("Discharge", ""));
        ValueReading junk = ValueConventions.usgs("Discharge", "abc");
        assertDropped(junk);
        assertNotNull(junk.reason());
    }

    @Test
    void noaaScalesValues() {
        assertEquals(2.5, ValueConventions.noaa("25", 10.0).value());
        assertEquals(25.0, ValueConventions.noaa("25", 0.0).value());
        assertDropped(ValueConventions.noaa(null, 10.0));
    }

    @Test
    void usaceMissingMarkersDrop() {
        assertDropped(ValueConventions.usace("M"));
        assertDropped(ValueConventions.usace("--"));
        assertNull(ValueConventions.usace("n/a").reason());
        assertEquals(1837.4, ValueConventions.usace(" 1837.4 ").value());
    }

    @Test
    void usbrSentinelIsMissing() {
        assertMissing(ValueConventions.usbr("998877.00"));
        assertMissing(ValueConventions.usbr("MISSING"));
        assertEquals(2271.8, ValueConventions.usbr("2271.80").value());
    }

    @Test
    void acisFlagsDrop() {
        assertDropped(ValueConventions.acis("T"));
        assertDropped(ValueConventions.acis("M"));
        assertDropped(ValueConventions.acis("0.12A"));
        assertEquals(0.12, ValueConventions.acis("0.12").value());
    }

    @Test
    void ndgisNonDetectIsMissing() {
        assertMissing(ValueConventions.ndgis("*NON-DETECT"));
        assertDropped(ValueConventions.ndgis(" "));
        assertEquals(7.9, ValueConventions.ndgis("7.9").value());
    }

    @Test
    void danrBelowLimitIsMissing() {
        assertMissing(ValueConventions.danr("non-detect"));
        assertMissing(ValueConventions.danr("<0.02"));
        assertMissing(ValueConventions.danr(null));
        assertDropped(ValueConventions.danr("pending"));
        assertEquals(0.35, ValueConventions.danr("0.35").value());
    }

    @Test
    void parseRejectsNonFinite() {
        assertNull(ValueConventions.parse("NaN"));
        assertNull(ValueConventions.parse("Infinity"));
        assertEquals(-3.0, ValueConventions.parse("-3"));
    }
}
