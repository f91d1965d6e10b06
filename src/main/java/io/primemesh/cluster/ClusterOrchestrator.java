package io.primemesh.cluster;

import io.primemesh.config.ClusterConfig;
import io.primemesh.config.SeedPeer;
import io.primemesh.model.ClusterMessage;
import io.primemesh.model.ClusterNode;
import io.primemesh.model.HealthStatus;
import io.primemesh.model.MessageReply;
import io.primemesh.model.NodeState;
import io.primemesh.observability.ClusterAuditLog;
import io.primemesh.observability.ClusterAuditLog.AuditEvent;
import io.primemesh.observability.PrometheusFormatter;
import io.primemesh.transport.ClusterEndpoint;
import io.primemesh.transport.ElectionTransport;
import io.primemesh.transport.HttpElectionTransport;
import io.primemesh.util.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Membership, failure detection and term-based leader election for one node.
 *
 * <p>All state lives behind {@code stateLock}. The control loop thread, the
 * HTTP endpoint and outbound reply callbacks all mutate it through that lock;
 * network sends, audit writes and listener callbacks are collected while the
 * lock is held and performed after it is released.
 *
 * <p>Inbound messages received over HTTP are queued and answered by the control
 * loop, so message handling is serialized with ticks. {@link #handleMessage}
 * may also be called directly.
 */
public final class ClusterOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ClusterOrchestrator.class);
    private static final int MAX_DRAIN_BATCH = 64;

    private final ClusterConfig config;
    private final String nodeId;
    private final TimeSource timeSource;
    private final ElectionTransport transport;
    private final ClusterAuditLog auditLog;
    private final ClusterEndpoint endpoint;
    private final boolean degraded;
    private final int advertisedPort;
    private final ControlLoop loop;

    private final Object stateLock = new Object();
    private final Map<String, ClusterNode> nodes = new LinkedHashMap<>();
    private final Set<String> votesReceived = new HashSet<>();
    private final BlockingQueue<InboundMessage> inbound = new LinkedBlockingQueue<>();
    private final List<LeaderChangeListener> listeners = new CopyOnWriteArrayList<>();

    private long currentTerm;
    private NodeState state = NodeState.FOLLOWER;
    private String leaderId;
    private String votedFor;
    private long lastVotedTerm = -1L;
    private long electionDeadlineMs;
    private long lastHeartbeatSentMs = Long.MIN_VALUE;
    private long lastHealthCheckMs;
    private boolean running;
    private boolean stopped;

    private final AtomicLong messagesHandled = new AtomicLong();
    private final AtomicLong transportErrors = new AtomicLong();
    private final AtomicLong electionsStarted = new AtomicLong();
    private final AtomicLong leaderChanges = new AtomicLong();

    public ClusterOrchestrator(ClusterConfig config) {
        this(
                config,
                new HttpElectionTransport(config.requestTimeout()),
                TimeSource.SYSTEM,
                config.auditFile() == null
                        ? null
                        : new ClusterAuditLog(config.auditFile(), config.namespace(), config.identityKey())
        );
    }

    public ClusterOrchestrator(ClusterConfig config, ElectionTransport transport, TimeSource timeSource, ClusterAuditLog auditLog) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.auditLog = auditLog;
        this.nodeId = config.nodeId();

        ClusterEndpoint bound = null;
        try {
            bound = ClusterEndpoint.bind(config.bindAddress(), config.port(), config.replyTimeout(), this::submitInbound);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cluster endpoint could not bind {}:{}, running degraded (single-node only): {}",
                    config.bindAddress(), config.port(), e.getMessage());
        }
        this.endpoint = bound;
        this.degraded = bound == null;
        this.advertisedPort = bound == null ? config.port() : bound.boundPort();
        this.loop = new ControlLoop("primemesh-control-" + nodeId, config.tickInterval(), this::runLoopIteration);

        long nowMono = timeSource.monotonicMillis();
        long nowWall = timeSource.wallMillis();
        synchronized (stateLock) {
            nodes.put(nodeId, ClusterNode.joined(nodeId, config.advertiseAddress(), advertisedPort,
                    NodeState.FOLLOWER, nowWall, nowMono));
            for (SeedPeer seed : config.seeds()) {
                nodes.put(seed.nodeId(), ClusterNode.joined(seed.nodeId(), seed.host(), seed.port(),
                        NodeState.FOLLOWER, nowWall, nowMono));
            }
            lastHealthCheckMs = nowMono;
            resetElectionDeadlineLocked(nowMono);
        }
        if (endpoint != null) {
            endpoint.registerJson("/cluster/status", this::getClusterStatus);
            endpoint.registerJson("/health", () -> Map.of("status", "ok", "node_id", nodeId, "state", state()));
            endpoint.registerText("/metrics", "text/plain; version=0.0.4; charset=utf-8",
                    () -> PrometheusFormatter.format(stats()));
        }
        LOG.info("Cluster orchestrator created node={} endpoint={}:{} seeds={} degraded={}",
                nodeId, config.advertiseAddress(), advertisedPort, config.seeds().size(), degraded);
    }

    // ==================== Lifecycle ====================

    public void start() {
        Effects fx = new Effects();
        synchronized (stateLock) {
            if (stopped) {
                throw new IllegalStateException("Cluster orchestrator " + nodeId + " was stopped and cannot be restarted");
            }
            if (running) {
                LOG.warn("Cluster orchestrator {} already running", nodeId);
                return;
            }
            running = true;
            long now = timeSource.monotonicMillis();
            lastHealthCheckMs = now;
            resetElectionDeadlineLocked(now);
            if (nodes.size() == 1 && state != NodeState.LEADER) {
                LOG.info("{} is the only member, promoting itself", nodeId);
                startElectionLocked(fx);
            }
        }
        fx.flush();
        loop.start();
        LOG.info("Cluster orchestrator started node={} state={} term={}", nodeId, state(), currentTerm());
    }

    /**
     * Stops the control loop (bounded wait), releases the endpoint and transport
     * and marks this node {@link NodeState#DISCONNECTED}. Idempotent.
     */
    public void stop() {
        synchronized (stateLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            running = false;
        }
        LOG.info("Stopping cluster orchestrator node={}", nodeId);
        loop.stop(config.stopTimeout());
        InboundMessage pending;
        while ((pending = inbound.poll()) != null) {
            pending.reply().complete(MessageReply.busy());
        }
        if (endpoint != null) {
            endpoint.close();
        }
        transport.close();

        Effects fx = new Effects();
        synchronized (stateLock) {
            state = NodeState.DISCONNECTED;
            if (nodeId.equals(leaderId)) {
                setLeaderLocked(null, fx);
            }
            syncSelfLocked();
            fx.audit("node_stopped", Map.of());
        }
        fx.flush();
    }

    @Override
    public void close() {
        stop();
    }

    // ==================== Membership ====================

    /**
     * Adds or replaces a member record. The record starts healthy with a fresh
     * heartbeat.
     */
    public void registerNode(String id, String address, int port, NodeState initialState) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("node id must not be blank");
        }
        Effects fx = new Effects();
        synchronized (stateLock) {
            registerLocked(id.trim(), address, port, initialState);
            fx.audit("node_registered", Map.of("registered_node_id", id.trim(), "address", String.valueOf(address), "port", port));
        }
        fx.flush();
    }

    /**
     * Removes a member. Removing the current leader clears it, reverts this node
     * to follower and starts an election. Unknown ids and the local node id are
     * ignored.
     *
     * @return true when a record was removed
     */
    public boolean removeNode(String id) {
        Effects fx = new Effects();
        boolean removed;
        synchronized (stateLock) {
            removed = removeLocked(id, fx);
        }
        fx.flush();
        return removed;
    }

    public Optional<ClusterNode> getLeader() {
        synchronized (stateLock) {
            return leaderId == null ? Optional.empty() : Optional.ofNullable(nodes.get(leaderId));
        }
    }

    public boolean isSelfLeader() {
        synchronized (stateLock) {
            return state == NodeState.LEADER && nodeId.equals(leaderId);
        }
    }

    public void addLeaderChangeListener(LeaderChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Exposes an extra JSON document on the node's HTTP surface. Ignored when
     * the endpoint is not bound.
     */
    public void registerStatusRoute(String path, Supplier<Object> body) {
        if (endpoint == null) {
            LOG.debug("Endpoint not bound, skipping status route {}", path);
            return;
        }
        endpoint.registerJson(path, body);
    }

    public void registerTextRoute(String path, String contentType, Supplier<String> body) {
        if (endpoint == null) {
            LOG.debug("Endpoint not bound, skipping text route {}", path);
            return;
        }
        endpoint.registerText(path, contentType, body);
    }

    // ==================== Accessors ====================

    public String nodeId() {
        return nodeId;
    }

    public int port() {
        return advertisedPort;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public long currentTerm() {
        synchronized (stateLock) {
            return currentTerm;
        }
    }

    public NodeState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public String leaderId() {
        synchronized (stateLock) {
            return leaderId;
        }
    }

    public String votedFor() {
        synchronized (stateLock) {
            return votedFor;
        }
    }

    public List<ClusterNode> nodes() {
        synchronized (stateLock) {
            return List.copyOf(nodes.values());
        }
    }

    public Optional<ClusterNode> node(String id) {
        synchronized (stateLock) {
            return Optional.ofNullable(nodes.get(id));
        }
    }

    public int nodeCount() {
        synchronized (stateLock) {
            return nodes.size();
        }
    }

    public ClusterStatus getClusterStatus() {
        synchronized (stateLock) {
            return new ClusterStatus(
                    nodeId,
                    state,
                    currentTerm,
                    leaderId,
                    state == NodeState.LEADER && nodeId.equals(leaderId),
                    nodes.size(),
                    new LinkedHashMap<>(nodes)
            );
        }
    }

    public OrchestratorStats stats() {
        synchronized (stateLock) {
            int healthy = 0;
            for (ClusterNode node : nodes.values()) {
                if (node.isHealthy()) {
                    healthy++;
                }
            }
            return new OrchestratorStats(
                    nodeId,
                    state.wireName(),
                    currentTerm,
                    state == NodeState.LEADER && nodeId.equals(leaderId),
                    healthy,
                    nodes.size() - healthy,
                    messagesHandled.get(),
                    transportErrors.get(),
                    electionsStarted.get(),
                    leaderChanges.get(),
                    degraded
            );
        }
    }

    // ==================== Inbound messages ====================

    /**
     * Applies one cluster message to local state and returns the reply sent
     * back to its sender.
     */
    public MessageReply handleMessage(ClusterMessage message) {
        if (message == null) {
            return MessageReply.invalidMessage();
        }
        Effects fx = new Effects();
        MessageReply reply;
        synchronized (stateLock) {
            if (stopped) {
                return MessageReply.busy();
            }
            messagesHandled.incrementAndGet();
            reply = switch (message.messageType()) {
                case HEARTBEAT -> onHeartbeatLocked(message, fx);
                case VOTE_REQUEST -> onVoteRequestLocked(message, fx);
                case LEADER_ANNOUNCEMENT -> onLeaderAnnouncementLocked(message, fx);
                case UNKNOWN -> {
                    LOG.debug("{} ignoring message of unknown type {}", nodeId, message.type());
                    yield MessageReply.unknownMessageType();
                }
            };
        }
        fx.flush();
        return reply;
    }

    CompletableFuture<MessageReply> submitInbound(ClusterMessage message) {
        CompletableFuture<MessageReply> reply = new CompletableFuture<>();
        synchronized (stateLock) {
            if (stopped) {
                reply.complete(MessageReply.busy());
                return reply;
            }
            inbound.add(new InboundMessage(message, reply));
        }
        return reply;
    }

    private MessageReply onHeartbeatLocked(ClusterMessage message, Effects fx) {
        String sender = message.nodeId();
        if (sender == null || sender.isBlank()) {
            return MessageReply.invalidMessage();
        }
        long now = timeSource.monotonicMillis();
        discoverLocked(sender, message.address(), message.port(), fx);
        ClusterNode record = nodes.get(sender);
        if (record != null) {
            nodes.put(sender, record.withHeartbeat(timeSource.wallMillis(), now));
        }
        if (sender.equals(nodeId)) {
            return MessageReply.ok();
        }
        Long term = message.term();
        if (term == null) {
            if (sender.equals(leaderId)) {
                resetElectionDeadlineLocked(now);
            }
            return MessageReply.ok();
        }
        if (term > currentTerm) {
            LOG.info("{} discovered higher term {} from leader {} (my term={})", nodeId, term, sender, currentTerm);
            followLeaderLocked(sender, term, fx);
        } else if (term == currentTerm) {
            if (state == NodeState.LEADER) {
                // Two leaders in one term: the smaller node id keeps leadership.
                if (sender.compareTo(nodeId) < 0) {
                    LOG.warn("{} found competing leader {} in term {}, stepping down", nodeId, sender, term);
                    followLeaderLocked(sender, term, fx);
                }
            } else {
                followLeaderLocked(sender, term, fx);
            }
        }
        return MessageReply.ok();
    }

    private MessageReply onVoteRequestLocked(ClusterMessage message, Effects fx) {
        String candidate = message.candidateId();
        Long term = message.term();
        if (candidate == null || candidate.isBlank() || term == null) {
            return MessageReply.vote(false);
        }
        discoverLocked(candidate, message.address(), message.port(), fx);
        long now = timeSource.monotonicMillis();
        if (term > currentTerm) {
            LOG.info("{} granting vote to {} for higher term {} (my term={})", nodeId, candidate, term, currentTerm);
            currentTerm = term;
            state = NodeState.FOLLOWER;
            setLeaderLocked(null, fx);
            castVoteLocked(candidate, term);
            resetElectionDeadlineLocked(now);
            syncSelfLocked();
            fx.audit("vote_granted", Map.of("candidate_id", candidate));
            return MessageReply.vote(true);
        }
        if (term == currentTerm && votedFor == null && lastVotedTerm < term) {
            LOG.info("{} granting vote to {} for term {}", nodeId, candidate, term);
            castVoteLocked(candidate, term);
            resetElectionDeadlineLocked(now);
            syncSelfLocked();
            fx.audit("vote_granted", Map.of("candidate_id", candidate));
            return MessageReply.vote(true);
        }
        LOG.debug("{} denying vote to {} (term={}, my term={}, votedFor={})", nodeId, candidate, term, currentTerm, votedFor);
        return MessageReply.vote(false);
    }

    private MessageReply onLeaderAnnouncementLocked(ClusterMessage message, Effects fx) {
        String announced = message.leaderId();
        Long term = message.term();
        if (announced == null || announced.isBlank() || term == null) {
            return MessageReply.invalidMessage();
        }
        discoverLocked(announced, message.address(), message.port(), fx);
        if (term < currentTerm) {
            LOG.debug("{} ignoring stale leader announcement from {} (term={} < {})", nodeId, announced, term, currentTerm);
            return MessageReply.ok();
        }
        if (announced.equals(nodeId)) {
            return MessageReply.ok();
        }
        LOG.info("{} accepting leader {} for term {}", nodeId, announced, term);
        followLeaderLocked(announced, term, fx);
        return MessageReply.ok();
    }

    // ==================== Control loop ====================

    private void runLoopIteration() {
        tick();
        drainInbound(config.inboundPollTimeout().toMillis());
    }

    /**
     * One pass of periodic work: sole-member promotion, heartbeat emission,
     * health sweep and election timeout.
     */
    void tick() {
        Effects fx = new Effects();
        synchronized (stateLock) {
            if (stopped) {
                return;
            }
            long now = timeSource.monotonicMillis();
            if (nodes.size() == 1 && state != NodeState.LEADER) {
                startElectionLocked(fx);
            }
            if (lastHeartbeatSentMs == Long.MIN_VALUE
                    || now - lastHeartbeatSentMs >= config.heartbeatInterval().toMillis()) {
                lastHeartbeatSentMs = now;
                refreshSelfLocked(now);
                if (state == NodeState.LEADER) {
                    broadcastHeartbeatLocked(fx);
                }
            }
            if (now - lastHealthCheckMs >= config.healthCheckInterval().toMillis()) {
                lastHealthCheckMs = now;
                checkHealthLocked(now, fx);
            }
            if (state != NodeState.LEADER && now >= electionDeadlineMs) {
                LOG.info("{} election timeout expired (state={}, term={})", nodeId, state, currentTerm);
                startElectionLocked(fx);
            }
        }
        fx.flush();
    }

    void drainInbound(long pollTimeoutMs) {
        List<InboundMessage> batch = new ArrayList<>();
        try {
            InboundMessage first = inbound.poll(Math.max(0L, pollTimeoutMs), TimeUnit.MILLISECONDS);
            if (first == null) {
                return;
            }
            batch.add(first);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        inbound.drainTo(batch, MAX_DRAIN_BATCH - 1);
        for (InboundMessage item : batch) {
            if (item.reply().isDone()) {
                continue;
            }
            try {
                item.reply().complete(handleMessage(item.message()));
            } catch (RuntimeException e) {
                item.reply().completeExceptionally(e);
            }
        }
    }

    /**
     * Marks stale members unhealthy and reacts to leader loss. A member is stale
     * when its last heartbeat is older than the election timeout.
     */
    void checkHealth() {
        Effects fx = new Effects();
        synchronized (stateLock) {
            if (stopped) {
                return;
            }
            long now = timeSource.monotonicMillis();
            lastHealthCheckMs = now;
            checkHealthLocked(now, fx);
        }
        fx.flush();
    }

    void startElection() {
        Effects fx = new Effects();
        synchronized (stateLock) {
            if (stopped) {
                return;
            }
            startElectionLocked(fx);
        }
        fx.flush();
    }

    private void checkHealthLocked(long now, Effects fx) {
        long timeoutMs = config.electionTimeout().toMillis();
        for (ClusterNode node : List.copyOf(nodes.values())) {
            if (node.isHealthy() && now - node.heartbeatMonotonicMs() > timeoutMs) {
                LOG.warn("{} marking {} unhealthy (no heartbeat for {}ms)", nodeId, node.nodeId(),
                        now - node.heartbeatMonotonicMs());
                nodes.put(node.nodeId(), node.withHealth(HealthStatus.UNHEALTHY));
                fx.audit("node_unhealthy", Map.of("unhealthy_node_id", node.nodeId()));
            }
        }

        if (nodes.size() == 1) {
            if (state != NodeState.LEADER) {
                startElectionLocked(fx);
            } else {
                refreshSelfLocked(now);
            }
            return;
        }

        if (leaderId != null && !leaderId.equals(nodeId)) {
            ClusterNode leader = nodes.get(leaderId);
            if (leader == null || !leader.isHealthy()) {
                LOG.warn("{} lost contact with leader {}, starting election", nodeId, leaderId);
                fx.audit("leader_lost", Map.of("leader_id", leaderId));
                setLeaderLocked(null, fx);
                state = NodeState.FOLLOWER;
                syncSelfLocked();
                startElectionLocked(fx);
            }
        } else if (state == NodeState.LEADER) {
            ClusterNode self = nodes.get(nodeId);
            if (self != null && !self.isHealthy()) {
                LOG.warn("{} anomaly: leader judged itself stale in term {}, reverting to candidate", nodeId, currentTerm);
                fx.audit("leader_self_stale", Map.of());
                setLeaderLocked(null, fx);
                state = NodeState.CANDIDATE;
                refreshSelfLocked(now);
                startElectionLocked(fx);
            }
        }

        if (!config.evictAfter().isZero() && state == NodeState.LEADER) {
            long evictMs = config.evictAfter().toMillis();
            for (ClusterNode node : List.copyOf(nodes.values())) {
                if (!node.nodeId().equals(nodeId) && now - node.heartbeatMonotonicMs() > evictMs) {
                    LOG.warn("{} evicting {} after {}ms without heartbeat", nodeId, node.nodeId(),
                            now - node.heartbeatMonotonicMs());
                    removeLocked(node.nodeId(), fx);
                }
            }
        }
    }

    private void startElectionLocked(Effects fx) {
        if (state == NodeState.LEADER) {
            return;
        }
        long now = timeSource.monotonicMillis();
        if (degraded && nodes.size() > 1) {
            if (state != NodeState.DISCONNECTED) {
                LOG.warn("{} cannot campaign without a bound endpoint, marking disconnected", nodeId);
                state = NodeState.DISCONNECTED;
                syncSelfLocked();
                fx.audit("campaign_refused", Map.of("reason", "endpoint_unbound"));
            }
            resetElectionDeadlineLocked(now);
            return;
        }
        currentTerm++;
        state = NodeState.CANDIDATE;
        castVoteLocked(nodeId, currentTerm);
        votesReceived.clear();
        votesReceived.add(nodeId);
        electionsStarted.incrementAndGet();
        resetElectionDeadlineLocked(now);
        refreshSelfLocked(now);
        syncSelfLocked();
        LOG.info("{} starting election for term {} ({} members)", nodeId, currentTerm, nodes.size());
        fx.audit("election_started", Map.of("members", nodes.size()));

        if (hasQuorumLocked()) {
            becomeLeaderLocked(fx);
            return;
        }
        long term = currentTerm;
        ClusterMessage request = ClusterMessage.voteRequest(nodeId, term, config.advertiseAddress(), advertisedPort);
        for (ClusterNode peer : nodes.values()) {
            if (peer.nodeId().equals(nodeId)) {
                continue;
            }
            String voter = peer.nodeId();
            fx.send(peer, request, (reply, error) -> {
                if (error != null) {
                    transportErrors.incrementAndGet();
                    LOG.debug("{} vote request to {} failed: {}", nodeId, voter, error.getMessage());
                    return;
                }
                recordVote(term, voter, reply != null && reply.granted());
            });
        }
    }

    private void recordVote(long term, String voter, boolean granted) {
        Effects fx = new Effects();
        synchronized (stateLock) {
            if (stopped || state != NodeState.CANDIDATE || term != currentTerm) {
                return;
            }
            if (!granted) {
                LOG.debug("{} vote denied by {} for term {}", nodeId, voter, term);
                return;
            }
            votesReceived.add(voter);
            LOG.debug("{} received vote from {} for term {} ({}/{})", nodeId, voter, term, votesReceived.size(), nodes.size());
            if (hasQuorumLocked()) {
                becomeLeaderLocked(fx);
            }
        }
        fx.flush();
    }

    private boolean hasQuorumLocked() {
        return votesReceived.size() * 2 > nodes.size();
    }

    private void becomeLeaderLocked(Effects fx) {
        state = NodeState.LEADER;
        setLeaderLocked(nodeId, fx);
        markLeaderRecordLocked(nodeId);
        syncSelfLocked();
        LOG.info("{} became leader for term {} with {}/{} votes", nodeId, currentTerm, votesReceived.size(), nodes.size());
        fx.audit("leader_elected", Map.of("votes", votesReceived.size(), "members", nodes.size()));
        ClusterMessage announcement = ClusterMessage.leaderAnnouncement(nodeId, currentTerm, config.advertiseAddress(), advertisedPort);
        for (ClusterNode peer : nodes.values()) {
            if (!peer.nodeId().equals(nodeId)) {
                fx.send(peer, announcement, this::onAnnouncementReply);
            }
        }
        // Heartbeats follow on the next tick.
        lastHeartbeatSentMs = Long.MIN_VALUE;
    }

    private void broadcastHeartbeatLocked(Effects fx) {
        ClusterMessage heartbeat = ClusterMessage.heartbeat(nodeId, currentTerm, config.advertiseAddress(), advertisedPort);
        for (ClusterNode peer : nodes.values()) {
            if (peer.nodeId().equals(nodeId)) {
                continue;
            }
            String peerId = peer.nodeId();
            fx.send(peer, heartbeat, (reply, error) -> {
                if (error != null) {
                    transportErrors.incrementAndGet();
                    LOG.debug("{} heartbeat to {} failed: {}", nodeId, peerId, error.getMessage());
                    return;
                }
                onPeerAlive(peerId);
            });
        }
    }

    private void onAnnouncementReply(MessageReply reply, Throwable error) {
        if (error != null) {
            transportErrors.incrementAndGet();
            LOG.debug("{} leader announcement failed: {}", nodeId, error.getMessage());
        }
    }

    private void onPeerAlive(String peerId) {
        synchronized (stateLock) {
            ClusterNode record = nodes.get(peerId);
            if (record != null && !stopped) {
                nodes.put(peerId, record.withHeartbeat(timeSource.wallMillis(), timeSource.monotonicMillis()));
            }
        }
    }

    // ==================== State helpers ====================

    private void followLeaderLocked(String leader, long term, Effects fx) {
        currentTerm = Math.max(currentTerm, term);
        state = NodeState.FOLLOWER;
        votedFor = null;
        setLeaderLocked(leader, fx);
        markLeaderRecordLocked(leader);
        resetElectionDeadlineLocked(timeSource.monotonicMillis());
        syncSelfLocked();
    }

    private void castVoteLocked(String candidate, long term) {
        votedFor = candidate;
        lastVotedTerm = term;
    }

    private void setLeaderLocked(String newLeaderId, Effects fx) {
        if (Objects.equals(leaderId, newLeaderId)) {
            return;
        }
        fx.leaderChanged(leaderId, newLeaderId);
        leaderId = newLeaderId;
        leaderChanges.incrementAndGet();
    }

    private void markLeaderRecordLocked(String leader) {
        for (ClusterNode node : List.copyOf(nodes.values())) {
            if (node.nodeId().equals(leader)) {
                nodes.put(node.nodeId(), node.withElectionState(NodeState.LEADER, currentTerm, node.votedFor()));
            } else if (node.state() == NodeState.LEADER) {
                nodes.put(node.nodeId(), node.withState(NodeState.FOLLOWER));
            }
        }
    }

    private void syncSelfLocked() {
        ClusterNode self = nodes.get(nodeId);
        if (self != null) {
            nodes.put(nodeId, self.withElectionState(state, currentTerm, votedFor));
        }
    }

    private void refreshSelfLocked(long nowMono) {
        ClusterNode self = nodes.get(nodeId);
        if (self != null) {
            nodes.put(nodeId, self.withHeartbeat(timeSource.wallMillis(), nowMono));
        }
    }

    private void resetElectionDeadlineLocked(long nowMono) {
        long jitterMs = config.electionJitter().toMillis();
        long jitter = jitterMs <= 0 ? 0L : ThreadLocalRandom.current().nextLong(jitterMs + 1);
        electionDeadlineMs = nowMono + config.electionTimeout().toMillis() + jitter;
    }

    private void registerLocked(String id, String address, int port, NodeState initialState) {
        long nowMono = timeSource.monotonicMillis();
        ClusterNode existing = nodes.get(id);
        if (existing != null) {
            // Known member: refresh its endpoint and liveness, keep its election state.
            nodes.put(id, existing.withEndpoint(address, port).withHeartbeat(timeSource.wallMillis(), nowMono));
            if (id.equals(nodeId)) {
                syncSelfLocked();
            }
            LOG.debug("{} refreshed node {} at {}:{}", nodeId, id, address, port);
            return;
        }
        nodes.put(id, ClusterNode.joined(id, address, port, initialState, timeSource.wallMillis(), nowMono));
        LOG.info("{} registered node {} at {}:{} ({} members)", nodeId, id, address, port, nodes.size());
    }

    private void discoverLocked(String sender, String address, Integer port, Effects fx) {
        if (nodes.containsKey(sender) || address == null || address.isBlank() || port == null || port <= 0) {
            return;
        }
        registerLocked(sender, address, port, NodeState.FOLLOWER);
        fx.audit("node_discovered", Map.of("registered_node_id", sender, "address", address, "port", port));
    }

    private boolean removeLocked(String id, Effects fx) {
        if (id == null || !nodes.containsKey(id)) {
            return false;
        }
        if (id.equals(nodeId)) {
            LOG.warn("{} refusing to remove itself from membership", nodeId);
            return false;
        }
        nodes.remove(id);
        LOG.info("{} removed node {} ({} members)", nodeId, id, nodes.size());
        fx.audit("node_removed", Map.of("removed_node_id", id));
        if (id.equals(leaderId)) {
            setLeaderLocked(null, fx);
            state = NodeState.FOLLOWER;
            syncSelfLocked();
            startElectionLocked(fx);
        }
        return true;
    }

    /**
     * Side effects gathered under the state lock and performed once it is
     * released.
     */
    private final class Effects {
        private final List<AuditEvent> audits = new ArrayList<>();
        private final List<Outbound> sends = new ArrayList<>();
        private boolean leaderChanged;
        private String previousLeader;
        private String newLeader;
        private long term;

        void audit(String action, Map<String, Object> details) {
            audits.add(AuditEvent.of(action, nodeId, currentTerm, details));
        }

        void send(ClusterNode target, ClusterMessage message, BiConsumer<MessageReply, Throwable> onReply) {
            sends.add(new Outbound(target, message, onReply));
        }

        void leaderChanged(String from, String to) {
            if (!leaderChanged) {
                previousLeader = from;
                leaderChanged = true;
            }
            newLeader = to;
            term = currentTerm;
        }

        void flush() {
            for (Outbound out : sends) {
                try {
                    transport.send(out.target(), out.message()).whenComplete(out.onReply());
                } catch (RuntimeException e) {
                    transportErrors.incrementAndGet();
                    LOG.warn("{} could not send {} to {}: {}", nodeId, out.message().type(), out.target().nodeId(), e.getMessage());
                }
            }
            if (auditLog != null) {
                for (AuditEvent event : audits) {
                    try {
                        auditLog.log(event);
                    } catch (RuntimeException e) {
                        LOG.warn("Failed to write audit event {}", event.action(), e);
                    }
                }
            }
            if (leaderChanged && !Objects.equals(previousLeader, newLeader)) {
                for (LeaderChangeListener listener : listeners) {
                    try {
                        listener.onLeaderChange(previousLeader, newLeader, term);
                    } catch (RuntimeException e) {
                        LOG.warn("Leader change listener failed", e);
                    }
                }
            }
        }
    }

    private record Outbound(ClusterNode target, ClusterMessage message, BiConsumer<MessageReply, Throwable> onReply) {
    }
}
