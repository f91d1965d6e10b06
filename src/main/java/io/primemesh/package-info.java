/**
 * PrimeMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.primemesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.primemesh.cli.PrimeMeshCommand} wires a node together and queries running nodes.</li>
 *   <li>{@code io.primemesh.cluster.ClusterOrchestrator} owns membership, heartbeats and leader election.</li>
 *   <li>{@code io.primemesh.identity.IdentityManager} exposes the prime instance and routes work by load.</li>
 *   <li>{@code io.primemesh.store.ClusterStore} is the shared TTL cache and priority queue.</li>
 * </ul>
 */
package io.primemesh;
