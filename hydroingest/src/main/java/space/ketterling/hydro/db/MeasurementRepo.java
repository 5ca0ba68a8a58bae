/*
* Copyright 2025 Taylor Ketterling
* Measurement repository for hydroingest.
* Utilizes HikariCP for connection pooling and PostgreSQL upserts keyed by series and timestamp.
*/
package space.ketterling.hydro.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.hydro.error.StorageException;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.SeriesKey;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of {@link MeasurementStore}. One table per
 * {@link DatasetCategory}, all with the same shape (see {@code db/schema.sql}).
 */
public class MeasurementRepo implements MeasurementStore {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(MeasurementRepo.class);

    private final HikariDataSource ds;

    public MeasurementRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    @Override
    public void upsert(DatasetCategory category, CanonicalPoint p) {
        String sql = "INSERT INTO " + category.table() + " (location, dataset, ts, value, ingested_at) " +
                "VALUES (?, ?, ?, ?, now()) " +
                "ON CONFLICT (location, dataset, ts) DO UPDATE SET " +
                "value=EXCLUDED.value, ingested_at=EXCLUDED.ingested_at";

        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, p.location());
            ps.setString(2, p.dataset());
            ps.setTimestamp(3, Timestamp.from(p.timestamp()));
            setDouble(ps, 4, p.value());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("upsert failed for " + category.table() + " " + p.location() + "/"
                    + p.dataset() + "@" + p.timestamp() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<CanonicalPoint> query(DatasetCategory category, String location, String dataset, Instant start,
            Instant end) {
        String sql = "SELECT ts, value FROM " + category.table() +
                " WHERE location=? AND dataset=? AND ts >= ? AND ts <= ? ORDER BY ts";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, location);
            ps.setString(2, dataset);
            ps.setTimestamp(3, Timestamp.from(start));
            ps.setTimestamp(4, Timestamp.from(end));
            return readPoints(ps, location, dataset);
        } catch (SQLException e) {
            throw new StorageException("query failed for " + location + "/" + dataset, e);
        }
    }

    @Override
    public List<CanonicalPoint> queryAll(DatasetCategory category, String location, String dataset) {
        String sql = "SELECT ts, value FROM " + category.table() + " WHERE location=? AND dataset=? ORDER BY ts";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, location);
            ps.setString(2, dataset);
            return readPoints(ps, location, dataset);
        } catch (SQLException e) {
            throw new StorageException("queryAll failed for " + location + "/" + dataset, e);
        }
    }

    @Override
    public Optional<Instant> latestTimestamp(DatasetCategory category, String location, String dataset) {
        return maxTs("SELECT MAX(ts) FROM " + category.table() + " WHERE location=? AND dataset=?", location,
                dataset);
    }

    @Override
    public Optional<Instant> latestNonNullTimestamp(DatasetCategory category, String location, String dataset) {
        return maxTs("SELECT MAX(ts) FROM " + category.table()
                + " WHERE location=? AND dataset=? AND value IS NOT NULL", location, dataset);
    }

    @Override
    public List<SeriesKey> seriesKeys(DatasetCategory category) {
        String sql = "SELECT DISTINCT location, dataset FROM " + category.table() + " ORDER BY location, dataset";
        List<SeriesKey> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SeriesKey(rs.getString(1), rs.getString(2)));
            }
        } catch (SQLException e) {
            throw new StorageException("seriesKeys failed for " + category.table(), e);
        }
        return out;
    }

    /**
     * Most recent write time in a category table; empty while the table is
     * empty.
     */
    public Optional<Instant> lastIngestedAt(DatasetCategory category) {
        String sql = "SELECT MAX(ingested_at) FROM " + category.table();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            Timestamp t = rs.next() ? rs.getTimestamp(1) : null;
            return t == null ? Optional.empty() : Optional.of(t.toInstant());
        } catch (SQLException e) {
            throw new StorageException("freshness lookup failed for " + category.table(), e);
        }
    }

    private Optional<Instant> maxTs(String sql, String location, String dataset) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, location);
            ps.setString(2, dataset);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                Timestamp t = rs.getTimestamp(1);
                return t == null ? Optional.empty() : Optional.of(t.toInstant());
            }
        } catch (SQLException e) {
            throw new StorageException("latest timestamp lookup failed for " + location + "/" + dataset, e);
        }
    }

    private List<CanonicalPoint> readPoints(PreparedStatement ps, String location, String dataset)
            throws SQLException {
        List<CanonicalPoint> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                double v = rs.getDouble(2);
                Double value = rs.wasNull() ? null : v;
                out.add(new CanonicalPoint(location, dataset, rs.getTimestamp(1).toInstant(), value));
            }
        }
        log.debug("read {} rows for {}/{}", out.size(), location, dataset);
        return out;
    }

    /**
     * Writes a nullable double to a prepared statement.
     */
    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null || v.isNaN())
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }
}
