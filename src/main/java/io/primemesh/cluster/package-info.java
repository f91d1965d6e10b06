/**
 * Cluster coordination package.
 *
 * <p>{@link io.primemesh.cluster.ClusterOrchestrator} keeps the membership
 * table, detects failed members by heartbeat age and runs term-based leader
 * elections on a single control-loop thread.
 */
package io.primemesh.cluster;
