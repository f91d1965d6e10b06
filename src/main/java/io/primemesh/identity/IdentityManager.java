package io.primemesh.identity;

import io.primemesh.cluster.ClusterOrchestrator;
import io.primemesh.model.ClusterNode;
import io.primemesh.store.ClusterStore;
import io.primemesh.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Presents the cluster as one logical instance: holds the shared identity
 * credential, tracks which node is the prime instance and routes work to the
 * least loaded member.
 *
 * <p>The raw identity key never leaves this class; callers only see its
 * SHA-256 digest.
 */
public final class IdentityManager {
    private static final Logger LOG = LoggerFactory.getLogger(IdentityManager.class);
    static final String IDENTITY_KEY = "identity_key";
    static final String RESOURCE_PREFIX = "resources:";
    static final Duration RESOURCE_TTL = Duration.ofSeconds(60);

    private final ClusterOrchestrator orchestrator;
    private final ClusterStore store;
    private final String nodeId;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, ResourceSample> resourceUsage = new LinkedHashMap<>();
    private final Map<String, Integer> nodeLoads = new LinkedHashMap<>();

    private String identityKey;
    private String identityKeyHash;
    private volatile String primeInstanceId;

    public IdentityManager(ClusterOrchestrator orchestrator, ClusterStore store) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.nodeId = orchestrator.nodeId();
        orchestrator.addLeaderChangeListener((previous, next, term) -> {
            if (next != null) {
                primeInstanceId = next;
            }
            if (nodeId.equals(next)) {
                LOG.info("{} is now the prime instance (term {})", nodeId, term);
            } else if (nodeId.equals(previous)) {
                LOG.info("{} handed over prime instance role to {} (term {})", nodeId, next, term);
            } else {
                LOG.debug("Prime instance changed {} -> {} (term {})", previous, next, term);
            }
        });
    }

    /**
     * Adopts {@code existingKey} when given, otherwise the key already shared
     * through the store, otherwise a fresh random key which is then published.
     *
     * @return the key in use; its digest is published through
     *         {@link #getClusterIdentity()}
     */
    public synchronized String initializeIdentity(String existingKey) {
        if (existingKey != null && !existingKey.isBlank()) {
            identityKey = existingKey;
            LOG.info("Using configured cluster identity key");
        } else {
            Optional<String> shared = store.get(IDENTITY_KEY);
            if (shared.isPresent() && !shared.get().isBlank()) {
                identityKey = shared.get();
                LOG.info("Retrieved existing identity key from cluster store");
            } else {
                byte[] bytes = new byte[32];
                random.nextBytes(bytes);
                identityKey = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
                store.set(IDENTITY_KEY, identityKey, null);
                LOG.info("Generated new identity key for cluster");
            }
        }
        identityKeyHash = Hashing.sha256Hex(identityKey);
        return identityKey;
    }

    /**
     * Current leader, or the last leader seen while an election is under way.
     */
    public Optional<String> getPrimeInstance() {
        Optional<String> leader = orchestrator.getLeader().map(ClusterNode::nodeId);
        leader.ifPresent(id -> primeInstanceId = id);
        return Optional.ofNullable(primeInstanceId);
    }

    public boolean isPrimeInstance() {
        return orchestrator.isSelfLeader();
    }

    /**
     * Records a sample locally and publishes it to the store for 60 seconds so
     * other processes can route on it. Samples for non-members are ignored.
     */
    public void updateResourceUsage(String targetNodeId, double cpuPercent, double memoryPercent) {
        if (targetNodeId == null || targetNodeId.isBlank() || orchestrator.node(targetNodeId).isEmpty()) {
            LOG.debug("Ignoring resource sample for unknown node {}", targetNodeId);
            return;
        }
        ResourceSample sample = new ResourceSample(cpuPercent, memoryPercent, Instant.now());
        synchronized (this) {
            resourceUsage.put(targetNodeId, sample);
        }
        store.setJson(RESOURCE_PREFIX + targetNodeId, sample, RESOURCE_TTL);
    }

    /**
     * Member with the lowest routing score, the first one in membership order
     * on ties; the local node id when membership is empty.
     */
    public String getLeastLoadedNode() {
        List<RouteTarget> targets = routeTargets();
        if (targets.isEmpty()) {
            return nodeId;
        }
        RouteTarget best = null;
        double bestScore = Double.POSITIVE_INFINITY;
        for (RouteTarget target : targets) {
            double score = target.routingScore();
            if (score < bestScore) {
                best = target;
                bestScore = score;
            }
        }
        return best == null ? nodeId : best.nodeId();
    }

    /**
     * Counts one in-flight request against {@code targetNodeId}, or against the
     * least loaded member when none is given.
     *
     * @return the node that should handle the request
     */
    public String allocateRequest(String targetNodeId) {
        String target = targetNodeId == null || targetNodeId.isBlank() ? getLeastLoadedNode() : targetNodeId;
        synchronized (this) {
            nodeLoads.merge(target, 1, Integer::sum);
        }
        return target;
    }

    public synchronized void releaseRequest(String targetNodeId) {
        Integer load = targetNodeId == null ? null : nodeLoads.get(targetNodeId);
        if (load != null && load > 0) {
            nodeLoads.put(targetNodeId, load - 1);
        }
    }

    public synchronized int currentLoad(String targetNodeId) {
        return nodeLoads.getOrDefault(targetNodeId, 0);
    }

    public synchronized boolean verifyIdentity(String candidateKey) {
        if (identityKeyHash == null || candidateKey == null) {
            return false;
        }
        return Hashing.digestsEqual(Hashing.sha256Hex(candidateKey), identityKeyHash);
    }

    public synchronized Map<String, Integer> nodeLoads() {
        return Map.copyOf(nodeLoads);
    }

    public ClusterIdentityView getClusterIdentity() {
        String prime = getPrimeInstance().orElse(null);
        boolean isPrime = isPrimeInstance();
        synchronized (this) {
            return new ClusterIdentityView(
                    identityKeyHash,
                    prime,
                    isPrime,
                    nodeId,
                    new LinkedHashMap<>(resourceUsage),
                    new LinkedHashMap<>(nodeLoads)
            );
        }
    }

    private List<RouteTarget> routeTargets() {
        List<ClusterNode> members = orchestrator.nodes();
        List<RouteTarget> targets = new ArrayList<>(members.size());
        for (ClusterNode member : members) {
            String id = member.nodeId();
            int load;
            ResourceSample local;
            synchronized (this) {
                load = nodeLoads.getOrDefault(id, 0);
                local = resourceUsage.get(id);
            }
            Optional<ResourceSample> sample = local != null
                    ? Optional.of(local)
                    : store.getJson(RESOURCE_PREFIX + id, ResourceSample.class);
            targets.add(new MemberTarget(id, load, sample));
        }
        return targets;
    }

    private record MemberTarget(String nodeId, int currentLoad, Optional<ResourceSample> resourceSample)
            implements RouteTarget {
    }
}
