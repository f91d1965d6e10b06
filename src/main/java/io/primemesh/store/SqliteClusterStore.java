package io.primemesh.store;

import io.primemesh.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.util.Optional;

/**
 * Cluster store on a shared SQLite file. Expiry is evaluated against wall-clock
 * time so every process sharing the file agrees on it.
 */
public final class SqliteClusterStore implements ClusterStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteClusterStore.class);

    private final StoreDatabase database;
    private final String namespace;
    private final TimeSource timeSource;

    public SqliteClusterStore(StoreDatabase database, String namespace, TimeSource timeSource) {
        this.database = database;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.timeSource = timeSource;
    }

    /**
     * Round-trips a probe row; throws when the database cannot be used at all.
     */
    public void probe() throws SQLException {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM cluster_kv WHERE store_key=?")) {
            ps.setString(1, StoreKeys.data(namespace, "__probe__"));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
            }
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        String physical = StoreKeys.data(namespace, key);
        long now = timeSource.wallMillis();
        try (Connection c = database.openConnection()) {
            try (PreparedStatement sweep = c.prepareStatement(
                    "DELETE FROM cluster_kv WHERE expires_at_ms IS NOT NULL AND expires_at_ms<=?")) {
                sweep.setLong(1, now);
                sweep.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO cluster_kv(store_key,store_value,expires_at_ms,updated_at_ms) VALUES(?,?,?,?)
                    ON CONFLICT(store_key) DO UPDATE SET
                        store_value=excluded.store_value,
                        expires_at_ms=excluded.expires_at_ms,
                        updated_at_ms=excluded.updated_at_ms
                    """)) {
                ps.setString(1, physical);
                ps.setString(2, value == null ? "" : value);
                if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                    ps.setNull(3, Types.INTEGER);
                } else {
                    ps.setLong(3, now + ttl.toMillis());
                }
                ps.setLong(4, now);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            LOG.warn("Dropping store write key={}", physical, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        String physical = StoreKeys.data(namespace, key);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT store_value FROM cluster_kv
                     WHERE store_key=? AND (expires_at_ms IS NULL OR expires_at_ms>?)
                     """)) {
            ps.setString(1, physical);
            ps.setLong(2, timeSource.wallMillis());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            LOG.warn("Store read failed, treating as miss key={}", physical, e);
            return Optional.empty();
        }
    }

    @Override
    public void delete(String key) {
        String physical = StoreKeys.data(namespace, key);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM cluster_kv WHERE store_key=?")) {
            ps.setString(1, physical);
            ps.executeUpdate();
        } catch (SQLException e) {
            LOG.warn("Dropping store delete key={}", physical, e);
        }
    }

    @Override
    public void enqueue(String queue, String payload, int priority) {
        String physical = StoreKeys.queue(namespace, queue);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO cluster_queue(queue_name,payload,priority,created_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, physical);
            ps.setString(2, payload == null ? "" : payload);
            ps.setInt(3, priority);
            ps.setLong(4, timeSource.wallMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            LOG.warn("Dropping enqueue queue={}", physical, e);
        }
    }

    @Override
    public Optional<String> dequeue(String queue) {
        String physical = StoreKeys.queue(namespace, queue);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement pick = c.prepareStatement("""
                    SELECT id,payload FROM cluster_queue
                    WHERE queue_name=?
                    ORDER BY priority DESC, id ASC
                    LIMIT 1
                    """);
                 PreparedStatement del = c.prepareStatement("DELETE FROM cluster_queue WHERE id=?")) {
                pick.setString(1, physical);
                Optional<String> out = Optional.empty();
                try (ResultSet rs = pick.executeQuery()) {
                    if (rs.next()) {
                        del.setLong(1, rs.getLong("id"));
                        out = Optional.ofNullable(rs.getString("payload"));
                    }
                }
                if (out.isPresent() && del.executeUpdate() == 0) {
                    // Another process took the row between select and delete.
                    out = Optional.empty();
                }
                c.commit();
                return out;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            LOG.warn("Dequeue failed, treating as empty queue={}", physical, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            probe();
            return true;
        } catch (SQLException e) {
            LOG.debug("Store probe failed", e);
            return false;
        }
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public void close() {
        // Connections are per-operation.
    }
}
