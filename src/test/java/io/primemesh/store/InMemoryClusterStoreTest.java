package io.primemesh.store;

import com.fasterxml.jackson.databind.JsonNode;
import io.primemesh.util.ManualTimeSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class InMemoryClusterStoreTest {

    @Test
    void expiredEntriesAreInvisibleBeforeAnySweep() {
        ManualTimeSource clock = new ManualTimeSource();
        InMemoryClusterStore store = new InMemoryClusterStore("default", clock);

        store.set("session", "v1", Duration.ofSeconds(1));
        store.set("forever", "v2", null);
        Assertions.assertEquals(Optional.of("v1"), store.get("session"));

        clock.advanceMillis(1_000L);
        Assertions.assertTrue(store.get("session").isEmpty());
        Assertions.assertEquals(Optional.of("v2"), store.get("forever"));
    }

    @Test
    void writesSweepExpiredEntries() {
        ManualTimeSource clock = new ManualTimeSource();
        InMemoryClusterStore store = new InMemoryClusterStore("default", clock);
        store.set("a", "1", Duration.ofMillis(10));
        store.set("b", "2", Duration.ofMillis(10));
        clock.advanceMillis(20L);
        store.set("c", "3", Duration.ofMillis(10));
        Assertions.assertEquals(1, store.size());
    }

    @Test
    void dequeuesByPriorityThenInsertionOrder() {
        InMemoryClusterStore store = new InMemoryClusterStore("default", new ManualTimeSource());
        store.enqueue("jobs", "p1", 1);
        store.enqueue("jobs", "p5", 5);
        store.enqueue("jobs", "p3", 3);
        store.enqueue("jobs", "p3-late", 3);

        Assertions.assertEquals(Optional.of("p5"), store.dequeue("jobs"));
        Assertions.assertEquals(Optional.of("p3"), store.dequeue("jobs"));
        Assertions.assertEquals(Optional.of("p3-late"), store.dequeue("jobs"));
        Assertions.assertEquals(1, store.queueCount());
        Assertions.assertEquals(Optional.of("p1"), store.dequeue("jobs"));
        Assertions.assertEquals(0, store.queueCount());
        Assertions.assertTrue(store.dequeue("jobs").isEmpty());
        Assertions.assertTrue(store.dequeue("never-used").isEmpty());
        Assertions.assertEquals(0, store.queueCount());
    }

    @Test
    void sharesConversationContextAndTypedValues() {
        ManualTimeSource clock = new ManualTimeSource();
        InMemoryClusterStore store = new InMemoryClusterStore("default", clock);

        store.storeContext("client-1", List.of(Map.of("role", "user", "content", "hi")), null);
        JsonNode context = store.getContext("client-1").orElseThrow();
        Assertions.assertEquals("user", context.get(0).path("role").asText());

        clock.advanceMillis(ClusterStore.DEFAULT_CONTEXT_TTL.toMillis());
        Assertions.assertTrue(store.getContext("client-1").isEmpty());

        store.setJson("point", new Point(3, 4), null);
        Assertions.assertEquals(Optional.of(new Point(3, 4)), store.getJson("point", Point.class));
        store.set("broken", "{oops", null);
        Assertions.assertTrue(store.getJson("broken", Point.class).isEmpty());

        store.delete("point");
        Assertions.assertTrue(store.get("point").isEmpty());
        Assertions.assertTrue(store.isAvailable());
    }

    @Test
    void rejectsBlankKeys() {
        InMemoryClusterStore store = new InMemoryClusterStore("default");
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.set(" ", "v", null));
    }

    record Point(int x, int y) {
    }
}
