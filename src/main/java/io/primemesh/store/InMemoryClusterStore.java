package io.primemesh.store;

import io.primemesh.util.TimeSource;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * In-process store used when no shared backend is reachable. Expired entries
 * are hidden on read and swept on every write.
 */
public final class InMemoryClusterStore implements ClusterStore {
    private final String namespace;
    private final TimeSource timeSource;
    private final Map<String, Entry> values = new HashMap<>();
    private final Map<String, PriorityQueue<QueuedItem>> queues = new HashMap<>();
    private long sequence;

    public InMemoryClusterStore(String namespace) {
        this(namespace, TimeSource.SYSTEM);
    }

    public InMemoryClusterStore(String namespace, TimeSource timeSource) {
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.timeSource = timeSource;
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        long now = timeSource.wallMillis();
        sweepExpired(now);
        long expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? Long.MAX_VALUE : now + ttl.toMillis();
        values.put(StoreKeys.data(namespace, key), new Entry(value, expiresAt));
    }

    @Override
    public synchronized Optional<String> get(String key) {
        String physical = StoreKeys.data(namespace, key);
        Entry entry = values.get(physical);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= timeSource.wallMillis()) {
            values.remove(physical);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    @Override
    public synchronized void delete(String key) {
        values.remove(StoreKeys.data(namespace, key));
    }

    @Override
    public synchronized void enqueue(String queue, String payload, int priority) {
        sweepExpired(timeSource.wallMillis());
        queues.computeIfAbsent(StoreKeys.queue(namespace, queue), ignored -> new PriorityQueue<>())
                .add(new QueuedItem(payload, priority, sequence++, timeSource.wallMillis()));
    }

    @Override
    public synchronized Optional<String> dequeue(String queue) {
        String physical = StoreKeys.queue(namespace, queue);
        PriorityQueue<QueuedItem> items = queues.get(physical);
        if (items == null || items.isEmpty()) {
            return Optional.empty();
        }
        QueuedItem head = items.poll();
        if (items.isEmpty()) {
            queues.remove(physical);
        }
        return Optional.of(head.payload());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public synchronized void close() {
        values.clear();
        queues.clear();
    }

    synchronized int size() {
        return values.size();
    }

    synchronized int queueCount() {
        return queues.size();
    }

    private void sweepExpired(long nowMs) {
        Iterator<Entry> it = values.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiresAtMs() <= nowMs) {
                it.remove();
            }
        }
    }

    private record Entry(String value, long expiresAtMs) {
    }

    private record QueuedItem(String payload, int priority, long sequence, long createdAtMs)
            implements Comparable<QueuedItem> {
        @Override
        public int compareTo(QueuedItem other) {
            int byPriority = Integer.compare(other.priority, priority);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
