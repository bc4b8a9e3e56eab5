package io.authrelay.storage;

import io.authrelay.host.StateBackend;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

public final class SqliteStateBackend implements StateBackend {
    private final Database database;
    private final String chainId;
    private final TreeMap<String, String> cache = new TreeMap<>();

    public SqliteStateBackend(Database database, String chainId) {
        this.database = database;
        this.chainId = chainId;
        loadAll();
    }

    private void loadAll() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT state_key,state_value FROM contract_state WHERE chain_id=?")) {
            ps.setString(1, chainId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    cache.put(rs.getString("state_key"), rs.getString("state_value"));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load contract state for chain " + chainId, e);
        }
    }

    @Override
    public synchronized Optional<String> load(String key) {
        return Optional.ofNullable(cache.get(key));
    }

    @Override
    public synchronized SortedMap<String, String> scan(String prefix) {
        TreeMap<String, String> out = new TreeMap<>();
        for (Map.Entry<String, String> entry : cache.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            out.put(entry.getKey(), entry.getValue());
        }
        return out;
    }

    @Override
    public synchronized void apply(Map<String, Optional<String>> writes) {
        long now = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement upsert = c.prepareStatement("""
                    INSERT INTO contract_state(chain_id,state_key,state_value,updated_at_ms) VALUES(?,?,?,?)
                    ON CONFLICT(chain_id,state_key) DO UPDATE SET state_value=excluded.state_value, updated_at_ms=excluded.updated_at_ms
                    """);
                 PreparedStatement delete = c.prepareStatement(
                         "DELETE FROM contract_state WHERE chain_id=? AND state_key=?")) {
                for (Map.Entry<String, Optional<String>> write : writes.entrySet()) {
                    if (write.getValue().isPresent()) {
                        upsert.setString(1, chainId);
                        upsert.setString(2, write.getKey());
                        upsert.setString(3, write.getValue().get());
                        upsert.setLong(4, now);
                        upsert.addBatch();
                    } else {
                        delete.setString(1, chainId);
                        delete.setString(2, write.getKey());
                        delete.addBatch();
                    }
                }
                upsert.executeBatch();
                delete.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist contract state for chain " + chainId, e);
        }
        for (Map.Entry<String, Optional<String>> write : writes.entrySet()) {
            if (write.getValue().isPresent()) {
                cache.put(write.getKey(), write.getValue().get());
            } else {
                cache.remove(write.getKey());
            }
        }
    }

    public synchronized int size() {
        return cache.size();
    }
}
