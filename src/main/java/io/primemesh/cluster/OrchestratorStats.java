package io.primemesh.cluster;

public record OrchestratorStats(
        String nodeId,
        String state,
        long currentTerm,
        boolean leader,
        int healthyNodes,
        int unhealthyNodes,
        long messagesHandled,
        long transportErrors,
        long electionsStarted,
        long leaderChanges,
        boolean degraded
) {
}
