package io.primemesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.primemesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ClusterAuditLogTest {

    @Test
    void rowsAreChainedSignedAndMasked() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-audit-");
        try {
            ClusterAuditLog audit = new ClusterAuditLog(root.resolve("audit").resolve("cluster.jsonl"), "Ops", "s3cret");
            audit.log(ClusterAuditLog.AuditEvent.of("leader_elected", "a", 1,
                    Map.of("identity_key", "raw-key", "identity_key_hash", "abc123")));
            audit.log(ClusterAuditLog.AuditEvent.of("node_removed", "a", 1, Map.of("removed_node_id", "b")));

            List<String> lines = Files.readAllLines(audit.file(), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            JsonNode second = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("", first.path("prev_hash").asText());
            Assertions.assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
            Assertions.assertEquals("Ops", first.path("namespace").asText());
            Assertions.assertEquals("leader_elected", first.path("action").asText());
            Assertions.assertEquals(1L, first.path("term").asLong());
            Assertions.assertEquals("***", first.path("details").path("identity_key").asText());
            Assertions.assertEquals("abc123", first.path("details").path("identity_key_hash").asText());
            Assertions.assertFalse(lines.get(0).contains("raw-key"));
            Assertions.assertFalse(first.path("signature").asText().isBlank());
            Assertions.assertEquals(second.path("hash").asText(), audit.currentHash());

            ClusterAuditLog.IntegrityOutcome outcome = audit.verify();
            Assertions.assertTrue(outcome.ok(), outcome.error());
            Assertions.assertEquals(2, outcome.checkedRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenedLogContinuesTheChain() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-audit-reopen-");
        try {
            Path file = root.resolve("cluster.jsonl");
            ClusterAuditLog first = new ClusterAuditLog(file, "default", "");
            first.log(ClusterAuditLog.AuditEvent.of("node_registered", "a", 0, null));
            String tail = first.currentHash();

            ClusterAuditLog reopened = new ClusterAuditLog(file, "default", "");
            Assertions.assertEquals(tail, reopened.currentHash());
            reopened.log(ClusterAuditLog.AuditEvent.of("leader_elected", "a", 1, Map.of()));

            ClusterAuditLog.IntegrityOutcome outcome = reopened.verify();
            Assertions.assertTrue(outcome.ok(), outcome.error());
            Assertions.assertEquals(2, outcome.checkedRows());
            JsonNode row = Jsons.mapper().readTree(Files.readAllLines(file, StandardCharsets.UTF_8).get(0));
            Assertions.assertFalse(row.has("signature"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void detectsEditedRows() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-audit-tamper-");
        try {
            Path file = root.resolve("cluster.jsonl");
            ClusterAuditLog audit = new ClusterAuditLog(file, "default", "s3cret");
            audit.log(ClusterAuditLog.AuditEvent.of("leader_elected", "a", 1, Map.of()));
            audit.log(ClusterAuditLog.AuditEvent.of("leader_elected", "b", 2, Map.of()));

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, content.replace("\"node_id\":\"b\"", "\"node_id\":\"c\""), StandardCharsets.UTF_8);

            ClusterAuditLog.IntegrityOutcome outcome = audit.verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertEquals(2, outcome.checkedRows());
            Assertions.assertTrue(outcome.error().contains("hash mismatch"), outcome.error());

            ClusterAuditLog wrongSecret = new ClusterAuditLog(root.resolve("other.jsonl"), "default", "s3cret");
            wrongSecret.log(ClusterAuditLog.AuditEvent.of("leader_elected", "a", 1, Map.of()));
            ClusterAuditLog.IntegrityOutcome signatureOutcome =
                    new ClusterAuditLog(root.resolve("other.jsonl"), "default", "different").verify();
            Assertions.assertFalse(signatureOutcome.ok());
            Assertions.assertTrue(signatureOutcome.error().contains("signature mismatch"), signatureOutcome.error());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void detectsRemovedRows() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-audit-truncate-");
        try {
            Path file = root.resolve("cluster.jsonl");
            ClusterAuditLog audit = new ClusterAuditLog(file, "default", "");
            for (int term = 1; term <= 3; term++) {
                audit.log(ClusterAuditLog.AuditEvent.of("leader_elected", "a", term, Map.of()));
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Files.write(file, List.of(lines.get(0), lines.get(2)), StandardCharsets.UTF_8);

            ClusterAuditLog.IntegrityOutcome outcome = audit.verify();
            Assertions.assertFalse(outcome.ok());
            Assertions.assertTrue(outcome.error().contains("broken chain"), outcome.error());
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
