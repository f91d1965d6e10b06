package io.primemesh.cluster;

/**
 * Notified after the locally known leader changes. Either id may be null (no
 * leader). Called outside the orchestrator's state lock.
 */
@FunctionalInterface
public interface LeaderChangeListener {
    void onLeaderChange(String previousLeaderId, String newLeaderId, long term);
}
