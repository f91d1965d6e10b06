package io.primemesh.identity;

import java.util.Optional;

/**
 * A member that can receive routed work.
 */
public interface RouteTarget {
    String nodeId();

    int currentLoad();

    Optional<ResourceSample> resourceSample();

    /**
     * Lower is better: in-flight requests plus weighted CPU and memory usage.
     */
    default double routingScore() {
        double score = currentLoad();
        Optional<ResourceSample> sample = resourceSample();
        if (sample.isPresent()) {
            score += sample.get().cpuPercent() * 0.5 + sample.get().memoryPercent() * 0.3;
        }
        return score;
    }
}
