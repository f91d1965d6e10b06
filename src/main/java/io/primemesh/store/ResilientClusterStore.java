package io.primemesh.store;

import io.primemesh.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Store facade that prefers the shared SQLite backend and switches permanently
 * to an in-process map when that backend cannot be opened at construction.
 */
public final class ResilientClusterStore implements ClusterStore {
    private static final Logger LOG = LoggerFactory.getLogger(ResilientClusterStore.class);

    private final ClusterStore delegate;
    private final boolean fallback;

    private ResilientClusterStore(ClusterStore delegate, boolean fallback) {
        this.delegate = delegate;
        this.fallback = fallback;
    }

    public static ResilientClusterStore open(Path dbFile, String namespace) {
        return open(dbFile, namespace, TimeSource.SYSTEM);
    }

    public static ResilientClusterStore open(Path dbFile, String namespace, TimeSource timeSource) {
        if (dbFile == null) {
            LOG.info("No shared store database configured, using in-process store namespace={}", namespace);
            return new ResilientClusterStore(new InMemoryClusterStore(namespace, timeSource), true);
        }
        try {
            StoreDatabase database = new StoreDatabase(dbFile);
            database.init();
            SqliteClusterStore sqlite = new SqliteClusterStore(database, namespace, timeSource);
            sqlite.probe();
            LOG.info("Cluster store backed by {}", dbFile);
            return new ResilientClusterStore(sqlite, false);
        } catch (Exception e) {
            LOG.warn("Shared store unavailable at {}, falling back to in-process store: {}", dbFile, e.getMessage());
            return new ResilientClusterStore(new InMemoryClusterStore(namespace, timeSource), true);
        }
    }

    public boolean usingFallback() {
        return fallback;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        delegate.set(key, value, ttl);
    }

    @Override
    public Optional<String> get(String key) {
        return delegate.get(key);
    }

    @Override
    public void delete(String key) {
        delegate.delete(key);
    }

    @Override
    public void enqueue(String queue, String payload, int priority) {
        delegate.enqueue(queue, payload, priority);
    }

    @Override
    public Optional<String> dequeue(String queue) {
        return delegate.dequeue(queue);
    }

    @Override
    public boolean isAvailable() {
        return fallback || delegate.isAvailable();
    }

    @Override
    public String namespace() {
        return delegate.namespace();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
