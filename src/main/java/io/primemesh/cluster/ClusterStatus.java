package io.primemesh.cluster;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.primemesh.model.ClusterNode;
import io.primemesh.model.NodeState;

import java.util.Map;

public record ClusterStatus(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("state") NodeState state,
        @JsonProperty("current_term") long currentTerm,
        @JsonProperty("leader_id") String leaderId,
        @JsonProperty("is_leader") boolean leader,
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("nodes") Map<String, ClusterNode> nodes
) {
}
