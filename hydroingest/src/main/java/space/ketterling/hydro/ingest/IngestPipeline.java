package space.ketterling.hydro.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.hydro.db.MeasurementStore;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.HydroException;
import space.ketterling.hydro.error.StorageException;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.PullTarget;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs connectors: fetch, process and store, per target.
 *
 * <p>
 * Targets of one connector run on a bounded pool; connectors run side by
 * side in {@link #pullAllSources}. Each stored key is an independent upsert,
 * so an aborted pull leaves storage consistent.
 * </p>
 */
public class IngestPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestPipeline.class);

    /** Cap on diagnostics written to the run log per connector run. */
    private static final int MAX_LOGGED_DIAGNOSTICS = 200;

    private final MeasurementStore store;
    private final IngestRunLog runLog;
    private final int workers;
    private final int storeAttempts;

    public IngestPipeline(MeasurementStore store, IngestRunLog runLog, int workers, int storeAttempts) {
        this.store = store;
        this.runLog = runLog == null ? IngestRunLog.NOOP : runLog;
        this.workers = Math.max(1, workers);
        this.storeAttempts = Math.max(1, storeAttempts);
    }

    // ------------------------------------------------------------------
    // single target
    // ------------------------------------------------------------------

    /**
     * Pulls one target with an explicit cutoff ({@link PullCutoff#none()} for
     * a full re-pull of the window).
     */
    public PullReport pull(SourceConnector connector, PullTarget target, FetchWindow window, PullCutoff cutoff) {
        PipelineState state = PipelineState.IDLE;
        List<Diagnostic> diags = new ArrayList<>();
        FetchWindow effective = cutoff.earliest(connector.seriesFor(target))
                .map(c -> window.narrowStart(c.plusSeconds(1).minus(connector.refetchOverlap())))
                .orElse(window);

        state = advance(connector, target, state, PipelineState.FETCHING);
        RawPayload payload;
        try {
            payload = connector.fetch(target, effective);
        } catch (HydroException e) {
            // connectors should not throw from fetch; treat it as a failed unit anyway
            log.warn("{} fetch for {} threw: {}", connector.name(), target, e.getMessage());
            diags.add(Diagnostic.of(e, target.toString()));
            advance(connector, target, state, PipelineState.DONE);
            return new PullReport(connector.name(), target, PipelineState.DONE, 0, 0, 0, 0, 0, 0, false, diags);
        }

        if (Thread.currentThread().isInterrupted()) {
            diags.addAll(payload.diagnostics());
            advance(connector, target, state, PipelineState.DONE);
            return new PullReport(connector.name(), target, PipelineState.DONE, payload.records().size(), 0, 0, 0,
                    0, 0, true, diags);
        }

        state = advance(connector, target, state, PipelineState.PROCESSING);
        ProcessResult processed = connector.process(payload, cutoff);
        diags.addAll(processed.diagnostics());

        List<Series> inWindow = new ArrayList<>(processed.series().size());
        int outside = 0;
        for (Series s : processed.series()) {
            List<CanonicalPoint> kept = new ArrayList<>(s.size());
            for (CanonicalPoint p : s.points()) {
                if (window.contains(p.timestamp())) {
                    kept.add(p);
                } else {
                    outside++;
                }
            }
            if (!kept.isEmpty()) {
                inWindow.add(new Series(s.location(), s.dataset(), kept));
            }
        }

        state = advance(connector, target, state, PipelineState.STORING);
        StoreOutcome stored = store(connector.category(), inWindow);
        diags.addAll(stored.diagnostics());

        advance(connector, target, state, PipelineState.DONE);
        PullReport report = new PullReport(connector.name(), target, PipelineState.DONE, payload.records().size(),
                processed.pointCount(), processed.excludedByCutoff(), outside, stored.stored(), stored.failedKeys(),
                stored.cancelled(), diags);
        log.info("{} {}: fetched={} normalized={} cutoff-excluded={} stored={} failedKeys={} partial={}",
                connector.name(), target, report.fetchedRecords(), report.normalizedPoints(),
                report.excludedByCutoff(), report.storedPoints(), report.failedKeys(), report.partial());
        return report;
    }

    /**
     * Pulls one target with cutoffs derived from what is already stored.
     */
    public PullReport pullIncremental(SourceConnector connector, PullTarget target, FetchWindow window) {
        return pull(connector, target, window, storedCutoff(connector, target));
    }

    /**
     * Builds per-series cutoffs from the latest stored timestamps.
     */
    public PullCutoff storedCutoff(SourceConnector connector, PullTarget target) {
        Map<SeriesKey, Instant> latest = new HashMap<>();
        for (SeriesKey k : connector.seriesFor(target)) {
            try {
                Optional<Instant> t = store.latestTimestamp(connector.category(), k.location(), k.dataset());
                t.ifPresent(instant -> latest.put(k, instant));
            } catch (StorageException e) {
                log.warn("{} cutoff lookup failed for {}: {}", connector.name(), k, e.getMessage());
            }
        }
        return PullCutoff.perSeries(latest);
    }

    // ------------------------------------------------------------------
    // all targets / all sources
    // ------------------------------------------------------------------

    /**
     * Pulls every target of one connector incrementally on a bounded pool.
     * Interrupting the caller cancels targets that have not started.
     */
    public ConnectorRun pullAll(SourceConnector connector, FetchWindow window) {
        if (!connector.enabled()) {
            log.info("{} disabled (missing credential or config); skipping", connector.name());
            return ConnectorRun.skipped(connector.name());
        }

        String job = "ingest-" + connector.name();
        UUID runId = runLog.startRun(job);
        List<PullTarget> targets = connector.targets();
        log.info("{}: pulling {} target(s) over {}..{}", connector.name(), targets.size(), window.start(),
                window.end());

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, Math.max(1, targets.size())),
                r -> {
                    Thread t = new Thread(r, job + "-worker");
                    t.setDaemon(true);
                    return t;
                });
        List<Future<PullReport>> futures = new ArrayList<>(targets.size());
        List<PullReport> reports = new ArrayList<>(targets.size());
        try {
            for (PullTarget target : targets) {
                futures.add(pool.submit(() -> {
                    MDC.put("job", job);
                    try {
                        if (Thread.currentThread().isInterrupted()) {
                            return cancelledReport(connector, target);
                        }
                        return pullIncremental(connector, target, window);
                    } finally {
                        MDC.remove("job");
                    }
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.error("{} target {} failed unexpectedly", connector.name(), targets.get(i), cause);
                    reports.add(errorReport(connector, targets.get(i), cause));
                } catch (CancellationException e) {
                    reports.add(cancelledReport(connector, targets.get(i)));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            log.warn("{} pull interrupted; {} of {} target(s) finished", connector.name(), reports.size(),
                    targets.size());
            for (int i = reports.size(); i < targets.size(); i++) {
                reports.add(cancelledReport(connector, targets.get(i)));
            }
        } finally {
            pool.shutdown();
        }

        ConnectorRun run = new ConnectorRun(connector.name(), runId, false, reports);
        recordRun(connector, run);
        return run;
    }

    /**
     * Runs every connector concurrently. A failing or disabled connector never
     * stops the others.
     */
    public List<ConnectorRun> pullAllSources(List<SourceConnector> connectors, FetchWindow window) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, connectors.size()), r -> {
            Thread t = new Thread(r, "ingest-source");
            t.setDaemon(true);
            return t;
        });
        List<Future<ConnectorRun>> futures = new ArrayList<>();
        for (SourceConnector c : connectors) {
            futures.add(pool.submit(() -> {
                MDC.put("job", "ingest-" + c.name());
                try {
                    return pullAll(c, window);
                } finally {
                    MDC.remove("job");
                }
            }));
        }
        List<ConnectorRun> runs = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    runs.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("{} connector run failed", connectors.get(i).name(), e.getCause());
                    runs.add(new ConnectorRun(connectors.get(i).name(), null, false, List.of(
                            errorReport(connectors.get(i), PullTarget.of("*"), e.getCause()))));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            log.warn("ingest interrupted after {} of {} connector(s)", runs.size(), connectors.size());
        } finally {
            pool.shutdown();
        }
        return runs;
    }

    // ------------------------------------------------------------------
    // storing
    // ------------------------------------------------------------------

    /**
     * Upserts every point, retrying each key on its own. A key that still
     * fails is recorded and skipped; earlier writes stay.
     */
    public StoreOutcome store(DatasetCategory category, List<Series> series) {
        int stored = 0;
        int failed = 0;
        List<Diagnostic> diags = new ArrayList<>();
        for (Series s : series) {
            for (CanonicalPoint p : s.points()) {
                if (Thread.currentThread().isInterrupted()) {
                    return new StoreOutcome(stored, failed, true, diags);
                }
                StorageException last = null;
                for (int attempt = 1; attempt <= storeAttempts; attempt++) {
                    try {
                        store.upsert(category, p);
                        last = null;
                        break;
                    } catch (StorageException e) {
                        last = e;
                        log.debug("upsert attempt {}/{} failed for {}@{}: {}", attempt, storeAttempts, p.key(),
                                p.timestamp(), e.getMessage());
                    }
                }
                if (last == null) {
                    stored++;
                } else {
                    failed++;
                    diags.add(Diagnostic.storage(p.key() + "@" + p.timestamp(), last.getMessage()));
                }
            }
        }
        if (failed > 0) {
            log.warn("{} key(s) could not be stored after {} attempt(s)", failed, storeAttempts);
        }
        return new StoreOutcome(stored, failed, false, diags);
    }

    /**
     * Result of {@link #store}.
     */
    public record StoreOutcome(int stored, int failedKeys, boolean cancelled, List<Diagnostic> diagnostics) {

        public StoreOutcome {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    private void recordRun(SourceConnector connector, ConnectorRun run) {
        int logged = 0;
        outer: for (PullReport r : run.reports()) {
            for (Diagnostic d : r.diagnostics()) {
                if (++logged > MAX_LOGGED_DIAGNOSTICS) {
                    break outer;
                }
                runLog.logDiagnostic(run.runId(), connector.name(), d);
            }
        }
        long failedTargets = run.reports().stream().filter(PullReport::failed).count();
        String notes = "targets=" + run.reports().size() + " failedTargets=" + failedTargets + " stored="
                + run.storedPoints() + " partial=" + run.partial();
        runLog.finishRun(run.runId(), run.success(), notes);
        log.info("{} run finished: {}", connector.name(), notes);
    }

    private static PipelineState advance(SourceConnector c, PullTarget t, PipelineState from, PipelineState to) {
        log.debug("{} {}: {} -> {}", c.name(), t, from, to);
        return to;
    }

    private static PullReport cancelledReport(SourceConnector c, PullTarget t) {
        return new PullReport(c.name(), t, PipelineState.DONE, 0, 0, 0, 0, 0, 0, true,
                List.of(Diagnostic.fetch(t.toString(), "cancelled before start")));
    }

    private static PullReport errorReport(SourceConnector c, PullTarget t, Throwable cause) {
        String msg = cause == null ? "unknown error" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new PullReport(c.name(), t, PipelineState.DONE, 0, 0, 0, 0, 0, 0, false,
                List.of(Diagnostic.fetch(t.toString(), msg)));
    }
}
