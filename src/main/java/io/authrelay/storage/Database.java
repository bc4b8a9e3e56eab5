package io.authrelay.storage;

import io.authrelay.config.AuthRelayConfig;
import io.authrelay.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Database {
    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    private static final List<Migration> MIGRATIONS = List.of(
            new Migration("001_chain_state", "Chain registry and per-chain contract state", List.of(
                    """
                    CREATE TABLE IF NOT EXISTS chains (
                        chain_id TEXT PRIMARY KEY,
                        address_prefix TEXT NOT NULL,
                        role TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """,
                    """
                    CREATE TABLE IF NOT EXISTS contract_state (
                        chain_id TEXT NOT NULL,
                        state_key TEXT NOT NULL,
                        state_value TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(chain_id, state_key)
                    )
                    """)),
            new Migration("002_contract_state_updated_index", "Index contract state by chain and update time", List.of(
                    "CREATE INDEX IF NOT EXISTS idx_contract_state_updated ON contract_state(chain_id, updated_at_ms)"))
    );

    private static final Map<String, String> PRAGMAS = pragmas();

    private final AuthRelayConfig config;
    private final String jdbcUrl;

    public Database(AuthRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile();
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data directories under " + config.rootDir(), e);
        }
        try (Connection conn = openConnection()) {
            configure(conn);
            migrate(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite database " + config.dbFile(), e);
        }
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private static Map<String, String> pragmas() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("journal_mode=WAL", "wal");
        out.put("synchronous=NORMAL", "1");
        out.put("foreign_keys=ON", "1");
        return out;
    }

    // fails when SQLite silently kept another value
    private static void configure(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> pragma : PRAGMAS.entrySet()) {
                st.execute("PRAGMA " + pragma.getKey());
                String name = pragma.getKey().substring(0, pragma.getKey().indexOf('='));
                String actual;
                try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
                    actual = rs.next() ? rs.getString(1) : null;
                }
                if (!pragma.getValue().equalsIgnoreCase(actual)) {
                    throw new IllegalStateException("PRAGMA " + name + " is " + actual + ", wanted " + pragma.getValue());
                }
            }
        }
    }

    private static void migrate(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
        for (Migration migration : MIGRATIONS) {
            if (applied(conn, migration.version())) {
                continue;
            }
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement();
                 PreparedStatement insert = conn.prepareStatement(
                         "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                for (String sql : migration.statements()) {
                    st.execute(sql);
                }
                insert.setString(1, migration.version());
                insert.setString(2, migration.description());
                insert.setString(3, migration.checksum());
                insert.setLong(4, Instant.now().toEpochMilli());
                insert.executeUpdate();
                conn.commit();
                LOG.debug("Applied schema migration {}", migration.version());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    private static boolean applied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT success FROM schema_migrations WHERE version=?")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        }
    }

    public void registerChain(String chainId, String addressPrefix, String role) {
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO chains(chain_id,address_prefix,role,created_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, chainId);
            ps.setString(2, addressPrefix);
            ps.setString(3, role);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register chain: " + chainId, e);
        }
    }

    public List<ChainRow> listChains() {
        List<ChainRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT chain_id,address_prefix,role,created_at_ms FROM chains ORDER BY created_at_ms, chain_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new ChainRow(
                        rs.getString("chain_id"),
                        rs.getString("address_prefix"),
                        rs.getString("role"),
                        rs.getLong("created_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list chains", e);
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            return Hashing.sha256Hex(version + "|" + description + "|" + String.join(";", statements)).substring(0, 16);
        }
    }

    public record ChainRow(String chainId, String addressPrefix, String role, long createdAtMs) {
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
