package io.primemesh.cli;

import io.primemesh.cluster.ClusterOrchestrator;
import io.primemesh.config.ClusterConfig;
import io.primemesh.config.SeedPeer;
import io.primemesh.identity.IdentityManager;
import io.primemesh.identity.ResourceSample;
import io.primemesh.identity.ResourceSampler;
import io.primemesh.model.ClusterMessage;
import io.primemesh.observability.ClusterAuditLog;
import io.primemesh.observability.PrometheusFormatter;
import io.primemesh.store.ResilientClusterStore;
import io.primemesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(
        name = "primemesh",
        mixinStandardHelpOptions = true,
        description = "PrimeMesh cluster coordination node",
        subcommands = {
                PrimeMeshCommand.ServeCommand.class,
                PrimeMeshCommand.StatusCommand.class,
                PrimeMeshCommand.SendCommand.class,
                PrimeMeshCommand.AuditVerifyCommand.class
        }
)
public final class PrimeMeshCommand implements Runnable {

    @Option(names = {"--settings"}, description = "JSON cluster settings file")
    Path settings;

    @Option(names = {"--namespace"}, description = "Cluster namespace (store key scope)")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | status | send | audit-verify");
    }

    ClusterConfig.Builder configBuilder() {
        ClusterConfig.Builder builder = settings == null ? ClusterConfig.builder() : ClusterConfig.fromSettingsFile(settings);
        if (namespace != null && !namespace.isBlank()) {
            builder.namespace(namespace);
        }
        return builder;
    }

    @Command(name = "serve", description = "Run a cluster node until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        PrimeMeshCommand parent;

        @Option(names = {"--node-id"}, description = "Node id (random UUID when omitted)")
        String nodeId;

        @Option(names = {"--bind"}, description = "Bind address")
        String bindAddress;

        @Option(names = {"--port"}, description = "Bind port (0 = ephemeral)")
        Integer port;

        @Option(names = {"--advertise"}, description = "Address peers use to reach this node")
        String advertiseAddress;

        @Option(names = {"--seed"}, description = "Seed peer as nodeId@host:port (repeatable)")
        List<String> seeds;

        @Option(names = {"--heartbeat-seconds"}, description = "Heartbeat interval in seconds")
        Long heartbeatSeconds;

        @Option(names = {"--election-timeout-seconds"}, description = "Election timeout in seconds")
        Long electionTimeoutSeconds;

        @Option(names = {"--identity-key"}, description = "Shared cluster identity key")
        String identityKey;

        @Option(names = {"--store-db"}, description = "Shared SQLite store file")
        Path storeDb;

        @Option(names = {"--audit-file"}, description = "Audit trail JSONL file")
        Path auditFile;

        @Option(names = {"--sample-seconds"}, defaultValue = "15", description = "Resource sampling interval in seconds")
        long sampleSeconds;

        @Override
        public Integer call() throws Exception {
            ClusterConfig.Builder builder = parent.configBuilder();
            if (nodeId != null) {
                builder.nodeId(nodeId);
            }
            if (bindAddress != null) {
                builder.bindAddress(bindAddress);
            }
            if (port != null) {
                builder.port(port);
            }
            if (advertiseAddress != null) {
                builder.advertiseAddress(advertiseAddress);
            }
            if (seeds != null) {
                for (String seed : seeds) {
                    builder.seed(SeedPeer.parse(seed));
                }
            }
            if (heartbeatSeconds != null) {
                builder.heartbeatInterval(Duration.ofSeconds(heartbeatSeconds));
            }
            if (electionTimeoutSeconds != null) {
                builder.electionTimeout(Duration.ofSeconds(electionTimeoutSeconds));
            }
            if (identityKey != null) {
                builder.identityKey(identityKey);
            }
            if (storeDb != null) {
                builder.storeDbFile(storeDb);
            }
            if (auditFile != null) {
                builder.auditFile(auditFile);
            }
            ClusterConfig config = builder.build();

            ResilientClusterStore store = ResilientClusterStore.open(config.storeDbFile(), config.namespace());
            ClusterOrchestrator orchestrator = new ClusterOrchestrator(config);
            IdentityManager identity = new IdentityManager(orchestrator, store);
            identity.initializeIdentity(config.identityKey());
            orchestrator.registerStatusRoute("/cluster/identity", identity::getClusterIdentity);
            orchestrator.registerTextRoute("/metrics", "text/plain; version=0.0.4; charset=utf-8",
                    () -> PrometheusFormatter.format(orchestrator.stats(), identity.nodeLoads()));

            ResourceSampler sampler = new ResourceSampler();
            ScheduledExecutorService sampling = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "primemesh-sampler");
                t.setDaemon(true);
                return t;
            });
            sampling.scheduleWithFixedDelay(() -> {
                ResourceSample sample = sampler.sample();
                identity.updateResourceUsage(orchestrator.nodeId(), sample.cpuPercent(), sample.memoryPercent());
            }, 0L, Math.max(1L, sampleSeconds), TimeUnit.SECONDS);

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                sampling.shutdownNow();
                orchestrator.stop();
                store.close();
                stopped.countDown();
            }, "primemesh-shutdown"));

            orchestrator.start();
            System.out.println("PrimeMesh node " + orchestrator.nodeId() + " listening on "
                    + config.advertiseAddress() + ":" + orchestrator.port()
                    + (store.usingFallback() ? " (in-process store)" : " (store " + config.storeDbFile() + ")"));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "status", description = "Fetch a status document from a running node")
    static final class StatusCommand implements Callable<Integer> {
        @Option(names = {"--target"}, defaultValue = "http://127.0.0.1:8766", description = "Node base URL")
        String target;

        @Option(names = {"--path"}, defaultValue = "/cluster/status", description = "Status path")
        String path;

        @Override
        public Integer call() throws Exception {
            HttpRequest request = HttpRequest.newBuilder(URI.create(trimSlash(target) + path))
                    .timeout(Duration.ofSeconds(10))
                    .GET()
                    .build();
            return printResponse(request);
        }
    }

    @Command(name = "send", description = "Post a raw cluster message to a node")
    static final class SendCommand implements Callable<Integer> {
        @Option(names = {"--target"}, defaultValue = "http://127.0.0.1:8766", description = "Node base URL")
        String target;

        @Option(names = {"--type"}, required = true, description = "heartbeat | vote_request | leader_announcement")
        String type;

        @Option(names = {"--from"}, required = true, description = "Sender node id")
        String from;

        @Option(names = {"--term"}, description = "Election term")
        Long term;

        @Override
        public Integer call() throws Exception {
            ClusterMessage message = switch (type) {
                case "heartbeat" -> ClusterMessage.heartbeat(from, term, null, null);
                case "vote_request" -> ClusterMessage.voteRequest(from, term == null ? 0L : term, null, null);
                case "leader_announcement" -> ClusterMessage.leaderAnnouncement(from, term == null ? 0L : term, null, null);
                default -> new ClusterMessage(type, from, null, null, term, null, null);
            };
            HttpRequest request = HttpRequest.newBuilder(URI.create(trimSlash(target) + "/cluster/message"))
                    .timeout(Duration.ofSeconds(10))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(message), StandardCharsets.UTF_8))
                    .build();
            return printResponse(request);
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of an audit trail")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PrimeMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "Audit trail JSONL file")
        Path file;

        @Option(names = {"--secret"}, description = "Signing secret (the cluster identity key)")
        String secret;

        @Override
        public Integer call() {
            ClusterConfig config = parent.configBuilder().build();
            ClusterAuditLog.IntegrityOutcome outcome = new ClusterAuditLog(file, config.namespace(), secret).verify();
            System.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : 2;
        }
    }

    private static int printResponse(HttpRequest request) throws IOException, InterruptedException {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        System.out.println(response.body());
        return response.statusCode() / 100 == 2 ? 0 : 1;
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
