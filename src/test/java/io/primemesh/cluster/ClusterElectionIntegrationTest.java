package io.primemesh.cluster;

import io.primemesh.config.ClusterConfig;
import io.primemesh.config.SeedPeer;
import io.primemesh.model.NodeState;
import io.primemesh.observability.ClusterAuditLog;
import io.primemesh.transport.HttpElectionTransport;
import io.primemesh.util.TimeSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class ClusterElectionIntegrationTest {

    @Test
    void twoNodesOverHttpElectExactlyOneAgreedLeader() throws Exception {
        Path root = Files.createTempDirectory("primemesh-test-election-");
        ClusterOrchestrator a = null;
        ClusterOrchestrator b = null;
        try {
            a = new ClusterOrchestrator(fastConfig("node-a").build(), new HttpElectionTransport(Duration.ofSeconds(1)),
                    TimeSource.SYSTEM, new ClusterAuditLog(root.resolve("a-audit.jsonl"), "default", null));
            b = new ClusterOrchestrator(fastConfig("node-b").seed(new SeedPeer("node-a", "127.0.0.1", a.port())).build(),
                    new HttpElectionTransport(Duration.ofSeconds(1)), TimeSource.SYSTEM, null);
            a.registerNode("node-b", "127.0.0.1", b.port(), NodeState.FOLLOWER);

            a.start();
            b.start();

            ClusterOrchestrator first = a;
            ClusterOrchestrator second = b;
            boolean agreed = waitFor(Duration.ofSeconds(10), () -> {
                String leaderA = first.leaderId();
                String leaderB = second.leaderId();
                int leaders = (first.isSelfLeader() ? 1 : 0) + (second.isSelfLeader() ? 1 : 0);
                return leaders == 1 && leaderA != null && leaderA.equals(leaderB);
            });
            Assertions.assertTrue(agreed, "nodes did not agree on one leader: a=" + a.getClusterStatus()
                    + " b=" + b.getClusterStatus());
            Assertions.assertEquals(a.currentTerm(), b.currentTerm());

            ClusterOrchestrator leader = a.isSelfLeader() ? a : b;
            ClusterOrchestrator follower = leader == a ? b : a;
            String leaderId = leader.nodeId();
            leader.stop();
            Assertions.assertEquals(NodeState.DISCONNECTED, leader.state());

            Assertions.assertTrue(follower.removeNode(leaderId));
            Assertions.assertTrue(waitFor(Duration.ofSeconds(5), follower::isSelfLeader));
            Assertions.assertEquals(1, follower.nodeCount());

            a.stop();
            b.stop();
            ClusterAuditLog.IntegrityOutcome integrity =
                    new ClusterAuditLog(root.resolve("a-audit.jsonl"), "default", null).verify();
            Assertions.assertTrue(integrity.ok(), integrity.error());
            Assertions.assertTrue(integrity.checkedRows() > 0);
        } finally {
            if (a != null) {
                a.close();
            }
            if (b != null) {
                b.close();
            }
            deleteRecursively(root);
        }
    }

    private static ClusterConfig.Builder fastConfig(String nodeId) {
        return ClusterConfig.builder()
                .nodeId(nodeId)
                .bindAddress("127.0.0.1")
                .port(0)
                .heartbeatInterval(Duration.ofMillis(100))
                .electionTimeout(Duration.ofMillis(400))
                .electionJitter(Duration.ofMillis(300))
                .healthCheckInterval(Duration.ofMillis(100))
                .tickInterval(Duration.ofMillis(20))
                .inboundPollTimeout(Duration.ofMillis(20))
                .replyTimeout(Duration.ofSeconds(1))
                .requestTimeout(Duration.ofSeconds(1))
                .stopTimeout(Duration.ofSeconds(2));
    }

    private static boolean waitFor(Duration timeout, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(25L);
        }
        return condition.getAsBoolean();
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
