package io.primemesh.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceSample(
        @JsonProperty("cpu_percent") double cpuPercent,
        @JsonProperty("memory_percent") double memoryPercent,
        @JsonProperty("updated_at") Instant updatedAt
) {
}
