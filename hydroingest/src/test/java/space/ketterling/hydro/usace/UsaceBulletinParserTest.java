package space.ketterling.hydro.usace;

import org.junit.jupiter.api.Test;
import space.ketterling.hydro.model.RawRecord;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsaceBulletinParserTest {

    static final List<String> COLUMNS = List.of("Elevation", "Flow Spill", "Flow Out");

    static final String BULLETIN = String.join("\n",
            "                 GARRISON DAM - LAKE SAKAKAWEA",
            "",
            "\"Date\"      Hour   Elev    Spill    Outflow",
            "                 (ft)    (cfs)    (cfs)",
            "---------- ------ ------- -------- --------",
            "2024-08-01  0100  1843.21      0    21000",
            "2024-08-01  02:00 1843.20      M    21100",
            "2024/08/01  2400  1843.18      0    20900",
            "2024-08-01  0300  1843.17",
            "Total flows are provisional");

    @Test
    void readsDataLinesOnly() {
        List<RawRecord> rows = UsaceBulletinParser.parse(BULLETIN, "Garrison", COLUMNS);

        assertEquals(9, rows.size());
        assertEquals(new RawRecord("Garrison", "Elevation", "2024-08-01 01:00", "1843.21"), rows.get(0));
        assertEquals("M", rows.get(4).rawValue());
        assertEquals("Flow Out", rows.get(8).dataset());
    }

    @Test
    void hourTwentyFourRollsToNextDay() {
        List<RawRecord> rows = UsaceBulletinParser.parse(BULLETIN, "Garrison", COLUMNS);
        assertEquals("2024-08-02 00:00", rows.get(6).rawTimestamp());
        assertEquals("2024-01-01 00:00", UsaceBulletinParser.timestamp("2023-12-31", "24:00"));
    }

    @Test
    void hourFormats() {
        assertEquals("2024-08-01 07:00", UsaceBulletinParser.timestamp("2024-08-01", "7:00"));
        assertEquals("2024-08-01 13:30", UsaceBulletinParser.timestamp("2024-08-01", "1330"));
        assertNull(UsaceBulletinParser.timestamp("2024-08-01", "1pm"));
        assertNull(UsaceBulletinParser.timestamp("2024-02-30", "0100"));
    }

    @Test
    void nothingToReadGivesNoRows() {
        assertTrue(UsaceBulletinParser.parse(null, "Garrison", COLUMNS).isEmpty());
        assertTrue(UsaceBulletinParser.parse("<html>maintenance</html>", "Garrison", COLUMNS).isEmpty());
    }
}
