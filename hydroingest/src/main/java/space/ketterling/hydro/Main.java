/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for hydroingest, an environmental time-series ingestion and serving application.
*
* Initializes configuration, database connections and upstream connectors, then runs one command:
* a batch ingest, a graph export, schema setup, or the read-only API server.
* Scheduling is left to the caller (cron, systemd timer); the program handles a graceful shutdown.
*/

package space.ketterling.hydro;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.hydro.api.ApiServer;
import space.ketterling.hydro.catalog.SourceCatalog;
import space.ketterling.hydro.config.AppConfig;
import space.ketterling.hydro.db.Database;
import space.ketterling.hydro.db.IngestLogRepo;
import space.ketterling.hydro.db.MeasurementRepo;
import space.ketterling.hydro.fetch.Sleeper;
import space.ketterling.hydro.ingest.ConnectorRun;
import space.ketterling.hydro.ingest.IngestPipeline;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.report.ExportSummary;
import space.ketterling.hydro.report.JsonSeriesExporter;
import space.ketterling.hydro.report.ReportService;
import space.ketterling.hydro.report.WindowSelector;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        String command = args.length == 0 ? "serve" : args[0];
        log.info("Starting hydroingest ({})", command);
        AppConfig cfg = AppConfig.load();
        ObjectMapper om = new ObjectMapper();

        switch (command) {
            case "init-db" -> initDb(cfg);
            case "ingest" -> ingest(cfg, om, args.length > 1 ? Integer.parseInt(args[1]) : null);
            case "export" -> export(cfg, om);
            case "serve" -> serve(cfg, om);
            default -> {
                System.err.println("usage: hydroingest [serve | ingest [days] | export | init-db]");
                System.exit(2);
            }
        }
    }

    private static void initDb(AppConfig cfg) throws Exception {
        try (HikariDataSource ds = Database.createIngestDataSource(cfg)) {
            Database.applySchema(ds);
        }
        log.info("Schema applied");
    }

    /**
     * Pulls every enabled source once. Without {@code days} the window starts
     * at the backfill date; stored cutoffs keep re-runs incremental either way.
     */
    private static void ingest(AppConfig cfg, ObjectMapper om, Integer days) {
        SourceCatalog catalog = SourceCatalog.load(om);
        Instant now = Instant.now();
        FetchWindow window = days == null
                ? new FetchWindow(cfg.backfillStart().atStartOfDay(ZoneOffset.UTC).toInstant(), now)
                : FetchWindow.endingAt(now, Duration.ofDays(days));

        try (HikariDataSource ds = Database.createIngestDataSource(cfg)) {
            IngestPipeline pipeline = new IngestPipeline(new MeasurementRepo(ds), new IngestLogRepo(ds),
                    cfg.ingestWorkers(), cfg.storeAttempts());
            MDC.put("job", "ingest");
            try {
                List<ConnectorRun> runs = pipeline.pullAllSources(Connectors.all(cfg, catalog, om, Sleeper.SYSTEM),
                        window);
                for (ConnectorRun run : runs) {
                    if (run.skipped()) {
                        log.info("{}: skipped", run.source());
                    } else {
                        log.info("{}: stored={} partial={} success={}", run.source(), run.storedPoints(),
                                run.partial(), run.success());
                    }
                }
            } finally {
                MDC.remove("job");
            }
        }
    }

    private static void export(AppConfig cfg, ObjectMapper om) {
        try (HikariDataSource ds = Database.createApiDataSource(cfg)) {
            MeasurementRepo store = new MeasurementRepo(ds);
            ReportService reports = new ReportService(store,
                    new WindowSelector(store, Clock.systemUTC(), cfg.reportDefaultDays()));
            MDC.put("job", "export");
            try {
                ExportSummary summary = reports.exportAll(new JsonSeriesExporter(om, Path.of(cfg.exportDir())));
                log.info("Export finished: {} file(s) in {}", summary.files(), cfg.exportDir());
                if (summary.partial()) {
                    log.warn("Export skipped {} series: {}", summary.failed().size(), summary.failed());
                }
            } finally {
                MDC.remove("job");
            }
        }
    }

    private static void serve(AppConfig cfg, ObjectMapper om) {
        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        MeasurementRepo store = new MeasurementRepo(apiDs);
        ReportService reports = new ReportService(store,
                new WindowSelector(store, Clock.systemUTC(), cfg.reportDefaultDays()));

        ApiServer api = new ApiServer(cfg.apiPort(), om, apiDs, reports);
        api.start();
        log.info("API server started on port {}", api.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                apiDs.close();
            } catch (RuntimeException e) {
                log.error("Shutdown error", e);
            }
        }, "shutdown"));
    }
}
