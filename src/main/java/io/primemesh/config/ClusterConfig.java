package io.primemesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.primemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class ClusterConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 8766;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_ELECTION_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_INBOUND_POLL_TIMEOUT = Duration.ofMillis(100);
    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    private final String nodeId;
    private final String namespace;
    private final String bindAddress;
    private final int port;
    private final String advertiseAddress;
    private final Duration heartbeatInterval;
    private final Duration electionTimeout;
    private final Duration electionJitter;
    private final Duration healthCheckInterval;
    private final Duration tickInterval;
    private final Duration inboundPollTimeout;
    private final Duration replyTimeout;
    private final Duration requestTimeout;
    private final Duration stopTimeout;
    private final Duration evictAfter;
    private final String identityKey;
    private final List<SeedPeer> seeds;
    private final Path storeDbFile;
    private final Path auditFile;

    private ClusterConfig(Builder b) {
        this.nodeId = b.nodeId == null || b.nodeId.isBlank() ? UUID.randomUUID().toString() : b.nodeId.trim();
        this.namespace = sanitizeNamespace(b.namespace);
        this.bindAddress = b.bindAddress == null || b.bindAddress.isBlank() ? DEFAULT_BIND_ADDRESS : b.bindAddress.trim();
        this.port = b.port;
        this.advertiseAddress = resolveAdvertiseAddress(b.advertiseAddress, bindAddress);
        this.heartbeatInterval = positive(b.heartbeatInterval, "heartbeat interval");
        this.electionTimeout = positive(b.electionTimeout, "election timeout");
        this.electionJitter = b.electionJitter == null ? heartbeatInterval : nonNegative(b.electionJitter, "election jitter");
        this.healthCheckInterval = positive(b.healthCheckInterval, "health check interval");
        this.tickInterval = positive(b.tickInterval, "tick interval");
        this.inboundPollTimeout = nonNegative(b.inboundPollTimeout, "inbound poll timeout");
        this.replyTimeout = positive(b.replyTimeout, "reply timeout");
        this.requestTimeout = positive(b.requestTimeout, "request timeout");
        this.stopTimeout = positive(b.stopTimeout, "stop timeout");
        this.evictAfter = b.evictAfter == null ? Duration.ZERO : nonNegative(b.evictAfter, "evict-after window");
        this.identityKey = b.identityKey == null || b.identityKey.isBlank() ? null : b.identityKey;
        this.seeds = List.copyOf(b.seeds);
        this.storeDbFile = b.storeDbFile == null ? null : b.storeDbFile.toAbsolutePath().normalize();
        this.auditFile = b.auditFile == null ? null : b.auditFile.toAbsolutePath().normalize();

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid bind port: " + port);
        }
        if (electionTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("Election timeout (" + electionTimeout.toMillis()
                    + "ms) must exceed heartbeat interval (" + heartbeatInterval.toMillis() + "ms)");
        }
        if (!evictAfter.isZero() && evictAfter.compareTo(electionTimeout) <= 0) {
            throw new IllegalArgumentException("Evict-after window must exceed the election timeout");
        }
        for (SeedPeer seed : seeds) {
            if (seed.nodeId().equals(nodeId)) {
                throw new IllegalArgumentException("Seed peer reuses the local node id: " + seed);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClusterConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a JSON settings file into a builder so command-line flags can still
     * override individual values.
     */
    public static Builder fromSettingsFile(Path settingsFile) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(Files.readString(settingsFile));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read cluster settings: " + settingsFile, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Cluster settings must be a JSON object: " + settingsFile);
        }
        Builder b = builder();
        if (root.hasNonNull("nodeId")) {
            b.nodeId(root.get("nodeId").asText());
        }
        if (root.hasNonNull("namespace")) {
            b.namespace(root.get("namespace").asText());
        }
        if (root.hasNonNull("bindAddress")) {
            b.bindAddress(root.get("bindAddress").asText());
        }
        if (root.hasNonNull("port")) {
            b.port(root.get("port").asInt());
        }
        if (root.hasNonNull("advertiseAddress")) {
            b.advertiseAddress(root.get("advertiseAddress").asText());
        }
        if (root.hasNonNull("heartbeatIntervalSeconds")) {
            b.heartbeatInterval(seconds(root.get("heartbeatIntervalSeconds").asDouble()));
        }
        if (root.hasNonNull("electionTimeoutSeconds")) {
            b.electionTimeout(seconds(root.get("electionTimeoutSeconds").asDouble()));
        }
        if (root.hasNonNull("electionJitterMs")) {
            b.electionJitter(Duration.ofMillis(root.get("electionJitterMs").asLong()));
        }
        if (root.hasNonNull("healthCheckIntervalSeconds")) {
            b.healthCheckInterval(seconds(root.get("healthCheckIntervalSeconds").asDouble()));
        }
        if (root.hasNonNull("evictAfterSeconds")) {
            b.evictAfter(seconds(root.get("evictAfterSeconds").asDouble()));
        }
        if (root.hasNonNull("identityKey")) {
            b.identityKey(root.get("identityKey").asText());
        }
        if (root.hasNonNull("storeDbFile")) {
            b.storeDbFile(Paths.get(root.get("storeDbFile").asText()));
        }
        if (root.hasNonNull("auditFile")) {
            b.auditFile(Paths.get(root.get("auditFile").asText()));
        }
        JsonNode seeds = root.path("seeds");
        if (seeds.isArray()) {
            for (JsonNode seed : seeds) {
                b.seed(SeedPeer.parse(seed.asText()));
            }
        }
        return b;
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000.0d));
    }

    private static Duration positive(Duration value, String label) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException("The " + label + " must be positive");
        }
        return value;
    }

    private static Duration nonNegative(Duration value, String label) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException("The " + label + " must not be negative");
        }
        return value;
    }

    private static String resolveAdvertiseAddress(String raw, String bindAddress) {
        if (raw != null && !raw.isBlank()) {
            return raw.trim();
        }
        if ("0.0.0.0".equals(bindAddress) || "::".equals(bindAddress)) {
            return "127.0.0.1";
        }
        return bindAddress;
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return DEFAULT_NAMESPACE;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        return value;
    }

    public String nodeId() {
        return nodeId;
    }

    public String namespace() {
        return namespace;
    }

    public String bindAddress() {
        return bindAddress;
    }

    public int port() {
        return port;
    }

    public String advertiseAddress() {
        return advertiseAddress;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration electionTimeout() {
        return electionTimeout;
    }

    public Duration electionJitter() {
        return electionJitter;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Duration inboundPollTimeout() {
        return inboundPollTimeout;
    }

    public Duration replyTimeout() {
        return replyTimeout;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    public Duration evictAfter() {
        return evictAfter;
    }

    public String identityKey() {
        return identityKey;
    }

    public List<SeedPeer> seeds() {
        return seeds;
    }

    public Path storeDbFile() {
        return storeDbFile;
    }

    public Path auditFile() {
        return auditFile;
    }

    public static final class Builder {
        private String nodeId;
        private String namespace = DEFAULT_NAMESPACE;
        private String bindAddress = DEFAULT_BIND_ADDRESS;
        private int port = DEFAULT_PORT;
        private String advertiseAddress;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration electionTimeout = DEFAULT_ELECTION_TIMEOUT;
        private Duration electionJitter;
        private Duration healthCheckInterval = DEFAULT_HEALTH_CHECK_INTERVAL;
        private Duration tickInterval = DEFAULT_TICK_INTERVAL;
        private Duration inboundPollTimeout = DEFAULT_INBOUND_POLL_TIMEOUT;
        private Duration replyTimeout = DEFAULT_REPLY_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
        private Duration evictAfter = Duration.ZERO;
        private String identityKey;
        private final List<SeedPeer> seeds = new ArrayList<>();
        private Path storeDbFile;
        private Path auditFile;

        private Builder() {
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder bindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder advertiseAddress(String advertiseAddress) {
            this.advertiseAddress = advertiseAddress;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder electionTimeout(Duration electionTimeout) {
            this.electionTimeout = electionTimeout;
            return this;
        }

        public Builder electionJitter(Duration electionJitter) {
            this.electionJitter = electionJitter;
            return this;
        }

        public Builder healthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        public Builder tickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder inboundPollTimeout(Duration inboundPollTimeout) {
            this.inboundPollTimeout = inboundPollTimeout;
            return this;
        }

        public Builder replyTimeout(Duration replyTimeout) {
            this.replyTimeout = replyTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder evictAfter(Duration evictAfter) {
            this.evictAfter = evictAfter;
            return this;
        }

        public Builder identityKey(String identityKey) {
            this.identityKey = identityKey;
            return this;
        }

        public Builder seed(SeedPeer seed) {
            this.seeds.add(seed);
            return this;
        }

        public Builder seeds(List<SeedPeer> seeds) {
            this.seeds.clear();
            if (seeds != null) {
                this.seeds.addAll(seeds);
            }
            return this;
        }

        public Builder storeDbFile(Path storeDbFile) {
            this.storeDbFile = storeDbFile;
            return this;
        }

        public Builder auditFile(Path auditFile) {
            this.auditFile = auditFile;
            return this;
        }

        public ClusterConfig build() {
            return new ClusterConfig(this);
        }
    }
}
