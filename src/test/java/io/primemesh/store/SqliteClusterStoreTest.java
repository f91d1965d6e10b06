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

final class SqliteClusterStoreTest {

    @Test
    void valuesExpireAndAreSharedBetweenInstances() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-sqlite-kv-");
        try {
            ManualTimeSource clock = new ManualTimeSource();
            StoreDatabase database = new StoreDatabase(root.resolve("store.db"));
            database.init();
            SqliteClusterStore first = new SqliteClusterStore(database, "default", clock);
            SqliteClusterStore second = new SqliteClusterStore(new StoreDatabase(root.resolve("store.db")), "default", clock);
            SqliteClusterStore otherNamespace = new SqliteClusterStore(database, "tenant-b", clock);

            first.set("greeting", "hello", Duration.ofSeconds(5));
            first.set("greeting", "hello again", Duration.ofSeconds(5));
            Assertions.assertEquals(Optional.of("hello again"), second.get("greeting"));
            Assertions.assertTrue(otherNamespace.get("greeting").isEmpty());

            clock.advanceMillis(5_000L);
            Assertions.assertTrue(second.get("greeting").isEmpty());

            first.set("sticky", "x", null);
            clock.advanceMillis(86_400_000L);
            Assertions.assertEquals(Optional.of("x"), first.get("sticky"));
            first.delete("sticky");
            Assertions.assertTrue(first.get("sticky").isEmpty());
            Assertions.assertTrue(first.isAvailable());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queueIsPriorityOrderedAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-sqlite-queue-");
        try {
            ManualTimeSource clock = new ManualTimeSource();
            StoreDatabase database = new StoreDatabase(root.resolve("store.db"));
            database.init();
            SqliteClusterStore producer = new SqliteClusterStore(database, "default", clock);
            SqliteClusterStore consumer = new SqliteClusterStore(database, "default", clock);

            producer.enqueue("tasks", "one", 1);
            producer.enqueue("tasks", "five", 5);
            producer.enqueue("tasks", "three", 3);

            Assertions.assertEquals(Optional.of("five"), consumer.dequeue("tasks"));
            Assertions.assertEquals(Optional.of("three"), consumer.dequeue("tasks"));
            Assertions.assertEquals(Optional.of("one"), producer.dequeue("tasks"));
            Assertions.assertTrue(consumer.dequeue("tasks").isEmpty());
        } finally {
            deleteRecursively(root);
        }
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
