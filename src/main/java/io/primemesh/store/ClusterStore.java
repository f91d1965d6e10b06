package io.primemesh.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.primemesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Cluster-wide ephemeral key/value cache with TTL plus named priority queues.
 *
 * <p>Implementations never throw on backend trouble: a failed read is reported
 * as absent and a failed write is dropped, both with a logged warning. Expired
 * entries are never returned, whether or not a sweep has run.
 */
public interface ClusterStore extends AutoCloseable {
    Duration DEFAULT_CONTEXT_TTL = Duration.ofHours(1);

    /**
     * Stores {@code value} under {@code key}; a {@code null} or non-positive ttl
     * means the entry never expires.
     */
    void set(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    /**
     * Appends a payload; higher {@code priority} is dequeued first, equal
     * priorities in insertion order.
     */
    void enqueue(String queue, String payload, int priority);

    Optional<String> dequeue(String queue);

    boolean isAvailable();

    String namespace();

    default void storeContext(String clientId, List<?> messages, Duration ttl) {
        String payload = Jsons.toCompactJson(messages == null ? List.of() : messages);
        set(StoreKeys.CONTEXT_PREFIX + clientId, payload, ttl == null ? DEFAULT_CONTEXT_TTL : ttl);
    }

    default Optional<JsonNode> getContext(String clientId) {
        return get(StoreKeys.CONTEXT_PREFIX + clientId).flatMap(ClusterStore::readTree);
    }

    default void setJson(String key, Object value, Duration ttl) {
        set(key, Jsons.toCompactJson(value), ttl);
    }

    default <T> Optional<T> getJson(String key, Class<T> type) {
        Optional<String> raw = get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            LoggerFactory.getLogger(ClusterStore.class)
                    .warn("Discarding unreadable store value key={} type={}", key, type.getSimpleName(), e);
            return Optional.empty();
        }
    }

    @Override
    void close();

    private static Optional<JsonNode> readTree(String raw) {
        try {
            return Optional.of(Jsons.mapper().readTree(raw));
        } catch (JsonProcessingException e) {
            Logger log = LoggerFactory.getLogger(ClusterStore.class);
            log.warn("Discarding unreadable conversation context", e);
            return Optional.empty();
        }
    }
}
