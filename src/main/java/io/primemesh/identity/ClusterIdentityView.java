package io.primemesh.identity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ClusterIdentityView(
        @JsonProperty("identity_key_hash") String identityKeyHash,
        @JsonProperty("prime_instance_id") String primeInstanceId,
        @JsonProperty("is_prime") boolean prime,
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("resource_usage") Map<String, ResourceSample> resourceUsage,
        @JsonProperty("node_loads") Map<String, Integer> nodeLoads
) {
}
