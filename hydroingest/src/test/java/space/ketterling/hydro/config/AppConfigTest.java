package space.ketterling.hydro.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    private static Properties base() {
        Properties p = new Properties();
        p.setProperty("db.jdbcUrl", "jdbc:postgresql://db:5432/hydro");
        return p;
    }

    @Test
    void defaultsApplyWhenOnlyDatabaseIsSet() {
        AppConfig cfg = AppConfig.fromProperties(base());

        assertEquals(8080, cfg.apiPort());
        assertEquals(Duration.ofSeconds(1), cfg.backoffInitial());
        assertEquals(Duration.ofSeconds(60), cfg.backoffMax());
        assertEquals(365, cfg.noaaChunkDays());
        assertEquals(60, cfg.usgsChunkDays());
        assertEquals(LocalDate.of(2019, 1, 1), cfg.backfillStart());
        assertEquals(30, cfg.reportDefaultDays());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = base();
        p.setProperty("fetch.pageDelay", "PT2S");
        p.setProperty("noaa.token", "abc");
        p.setProperty("ingest.workers", "0");
        p.setProperty("noaa.valueScale", "1");

        AppConfig cfg = AppConfig.fromProperties(p);

        assertEquals(Duration.ofSeconds(2), cfg.pageDelay());
        assertTrue(cfg.hasNoaaToken());
        assertEquals(1, cfg.ingestWorkers());
        assertEquals(1.0, cfg.noaaValueScale());
    }

    @Test
    void blankTokenDisablesNoaaOnly() {
        Properties p = base();
        p.setProperty("noaa.token", "   ");
        assertFalse(AppConfig.fromProperties(p).hasNoaaToken());
    }

    @Test
    void databaseUrlIsRequired() {
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(new Properties()));
    }

    @Test
    void malformedDurationIsRejected() {
        Properties p = base();
        p.setProperty("fetch.backoffMax", "a minute");
        assertThrows(java.time.format.DateTimeParseException.class, () -> AppConfig.fromProperties(p));
    }
}
