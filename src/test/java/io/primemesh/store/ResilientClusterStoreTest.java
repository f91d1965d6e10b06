package io.primemesh.store;

import io.primemesh.util.ManualTimeSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

final class ResilientClusterStoreTest {

    @Test
    void usesSharedDatabaseWhenItOpens() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-resilient-");
        try {
            ResilientClusterStore store = ResilientClusterStore.open(root.resolve("nested").resolve("store.db"), "default");
            Assertions.assertFalse(store.usingFallback());
            Assertions.assertTrue(store.isAvailable());
            store.set("k", "v", Duration.ofMinutes(1));
            Assertions.assertEquals(Optional.of("v"), store.get("k"));
            Assertions.assertTrue(Files.exists(root.resolve("nested").resolve("store.db")));
            store.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fallsBackToInProcessStoreWhenDatabaseCannotOpen() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-resilient-fallback-");
        try {
            Path blocker = Files.writeString(root.resolve("blocker"), "not a directory");
            ManualTimeSource clock = new ManualTimeSource();
            ResilientClusterStore store = ResilientClusterStore.open(blocker.resolve("store.db"), "default", clock);

            Assertions.assertTrue(store.usingFallback());
            Assertions.assertTrue(store.isAvailable());
            store.set("k", "v", Duration.ofSeconds(1));
            Assertions.assertEquals(Optional.of("v"), store.get("k"));
            clock.advanceMillis(1_000L);
            Assertions.assertTrue(store.get("k").isEmpty());

            store.enqueue("q", "low", 1);
            store.enqueue("q", "high", 9);
            Assertions.assertEquals(Optional.of("high"), store.dequeue("q"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingDatabasePathMeansInProcessStore() {
        ResilientClusterStore store = ResilientClusterStore.open(null, "default");
        Assertions.assertTrue(store.usingFallback());
        Assertions.assertEquals("default", store.namespace());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
