package space.ketterling.hydro.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.hydro.config.AppConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {

    private Database() {
    }

    /**
     * Pool for HTTP query handlers.
     */
    public static HikariDataSource createApiDataSource(AppConfig cfg) {
        return createDataSource(cfg, "api", cfg.dbApiPoolMax());
    }

    /**
     * Pool for ingest workers; sized to cover one connection per worker plus
     * the run log.
     */
    public static HikariDataSource createIngestDataSource(AppConfig cfg) {
        return createDataSource(cfg, "ingest", Math.max(cfg.dbIngestPoolMax(), cfg.ingestWorkers() + 1));
    }

    private static HikariDataSource createDataSource(AppConfig cfg, String role, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("hydroingest-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }

    /**
     * Runs {@code db/schema.sql} from the classpath. Every statement is
     * idempotent.
     */
    public static void applySchema(HikariDataSource ds) throws IOException, SQLException {
        String sql;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream("db/schema.sql")) {
            if (in == null) {
                throw new IOException("db/schema.sql not found on classpath");
            }
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String stmt : sql.split(";")) {
                String trimmed = stripComments(stmt).trim();
                if (!trimmed.isEmpty()) {
                    st.execute(trimmed);
                }
            }
        }
    }

    private static String stripComments(String stmt) {
        StringBuilder sb = new StringBuilder();
        for (String line : stmt.split("\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
