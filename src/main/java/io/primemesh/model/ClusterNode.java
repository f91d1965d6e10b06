package io.primemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Membership record for one known participant. Immutable: the orchestrator
 * replaces the record on every heartbeat or election outcome, so a returned
 * instance is always a consistent snapshot.
 *
 * <p>{@code heartbeatMonotonicMs} drives failure detection and is never
 * serialized; {@code lastHeartbeat} is the wall-clock time reported to callers.
 */
public record ClusterNode(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("address") String address,
        @JsonProperty("port") int port,
        @JsonProperty("state") NodeState state,
        @JsonProperty("term") long term,
        @JsonProperty("voted_for") String votedFor,
        @JsonProperty("last_heartbeat") Instant lastHeartbeat,
        @JsonIgnore long heartbeatMonotonicMs,
        @JsonProperty("health_status") HealthStatus healthStatus
) {

    public static ClusterNode joined(String nodeId, String address, int port, NodeState state, long wallMs, long monotonicMs) {
        return new ClusterNode(
                nodeId,
                address,
                port,
                state == null ? NodeState.FOLLOWER : state,
                0L,
                null,
                Instant.ofEpochMilli(wallMs),
                monotonicMs,
                HealthStatus.HEALTHY
        );
    }

    public ClusterNode withHeartbeat(long wallMs, long monotonicMs) {
        return new ClusterNode(nodeId, address, port, state, term, votedFor,
                Instant.ofEpochMilli(wallMs), monotonicMs, HealthStatus.HEALTHY);
    }

    public ClusterNode withEndpoint(String nextAddress, int nextPort) {
        return new ClusterNode(nodeId, nextAddress, nextPort, state, term, votedFor, lastHeartbeat, heartbeatMonotonicMs, healthStatus);
    }

    public ClusterNode withHealth(HealthStatus health) {
        return new ClusterNode(nodeId, address, port, state, term, votedFor, lastHeartbeat, heartbeatMonotonicMs, health);
    }

    public ClusterNode withElectionState(NodeState nextState, long nextTerm, String nextVotedFor) {
        return new ClusterNode(nodeId, address, port, nextState, Math.max(term, nextTerm), nextVotedFor,
                lastHeartbeat, heartbeatMonotonicMs, healthStatus);
    }

    public ClusterNode withState(NodeState nextState) {
        return new ClusterNode(nodeId, address, port, nextState, term, votedFor, lastHeartbeat, heartbeatMonotonicMs, healthStatus);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return healthStatus == HealthStatus.HEALTHY;
    }
}
