package space.ketterling.hydro.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.hydro.error.Diagnostic;
import space.ketterling.hydro.error.ErrorKind;
import space.ketterling.hydro.error.StorageException;
import space.ketterling.hydro.ingest.IngestRunLog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for ingest run logs and their diagnostics.
 *
 * <p>
 * Write failures are logged at warn level and not thrown.
 * </p>
 */
public class IngestLogRepo implements IngestRunLog {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IngestLogRepo.class);

    /** One row of {@code ingest_run}. */
    public record RunRow(UUID runId, String jobName, Instant startedAt, Instant finishedAt, String status,
            String notes) {
    }

    /** One row of {@code ingest_event}. */
    public record EventRow(long eventId, UUID runId, String source, ErrorKind kind, String unit, String message,
            Instant createdAt) {
    }

    private final HikariDataSource ds;

    public IngestLogRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Starts a new ingest run and returns its unique ID.
     */
    @Override
    public UUID startRun(String jobName) {
        UUID runId = UUID.randomUUID();
        if (ds.isClosed()) {
            log.warn("startRun skipped (datasource closed): {}", jobName);
            return runId;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO ingest_run (run_id, job_name, started_at, status) VALUES (?, ?, now(), 'RUNNING')")) {
            ps.setObject(1, runId);
            ps.setString(2, jobName);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("startRun not recorded for {}: {}", jobName, e.getMessage());
            return runId;
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Records one contained failure against a run.
     */
    @Override
    public void logDiagnostic(UUID runId, String source, Diagnostic d) {
        if (ds.isClosed()) {
            log.warn("logDiagnostic skipped (datasource closed): {} {}", source, d);
            return;
        }
        String sql = "INSERT INTO ingest_event (run_id, source, kind, unit, message, created_at) " +
                "VALUES (?, ?, ?, ?, ?, now())";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, runId);
            ps.setString(2, source);
            ps.setString(3, d.kind().name());
            ps.setString(4, d.unit());
            ps.setString(5, d.message());
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("logDiagnostic not recorded for run {}: {}", runId, e.getMessage());
        }
    }

    /**
     * Marks an ingest run as success or failure with notes.
     */
    @Override
    public void finishRun(UUID runId, boolean success, String notes) {
        if (ds.isClosed()) {
            log.warn("finishRun skipped (datasource closed): {}", runId);
            return;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE ingest_run SET finished_at=now(), status=?, notes=? WHERE run_id=?")) {
            ps.setString(1, success ? "SUCCESS" : "FAILED");
            ps.setString(2, notes);
            ps.setObject(3, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("finishRun not recorded for {}: {}", runId, e.getMessage());
            return;
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Latest runs first, optionally restricted to one job name.
     */
    public List<RunRow> recentRuns(String jobName, int limit) {
        String sql = "SELECT run_id, job_name, started_at, finished_at, status, notes FROM ingest_run " +
                "WHERE (?::text IS NULL OR job_name = ?) ORDER BY started_at DESC LIMIT ?";
        List<RunRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobName);
            ps.setString(2, jobName);
            ps.setInt(3, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RunRow(rs.getObject("run_id", UUID.class), rs.getString("job_name"),
                            instant(rs.getTimestamp("started_at")), instant(rs.getTimestamp("finished_at")),
                            rs.getString("status"), rs.getString("notes")));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("ingest run lookup failed", e);
        }
        return out;
    }

    /**
     * Diagnostics newest first. Both filters are optional.
     */
    public List<EventRow> events(UUID runId, ErrorKind kind, int limit) {
        String sql = "SELECT event_id, run_id, source, kind, unit, message, created_at FROM ingest_event " +
                "WHERE (?::uuid IS NULL OR run_id = ?) AND (?::text IS NULL OR kind = ?) " +
                "ORDER BY created_at DESC, event_id DESC LIMIT ?";
        String kindName = kind == null ? null : kind.name();
        List<EventRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, runId);
            ps.setObject(2, runId);
            ps.setString(3, kindName);
            ps.setString(4, kindName);
            ps.setInt(5, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new EventRow(rs.getLong("event_id"), rs.getObject("run_id", UUID.class),
                            rs.getString("source"), ErrorKind.valueOf(rs.getString("kind")),
                            rs.getString("unit"), rs.getString("message"),
                            instant(rs.getTimestamp("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("ingest event lookup failed", e);
        }
        return out;
    }

    private static Instant instant(Timestamp t) {
        return t == null ? null : t.toInstant();
    }
}
