package homelab.orchestrator.service;

import homelab.orchestrator.catalog.CapabilityCatalog;
import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.directory.NodeDirectory;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ClusterStatus;
import homelab.orchestrator.model.NodeCapability;
import homelab.orchestrator.model.NodeDescriptor;
import homelab.orchestrator.model.NodeStatus;
import homelab.orchestrator.probe.ReachabilityProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of cluster nodes and their liveness.
 *
 * Node records are immutable snapshots; a refresh probes every node concurrently
 * outside the lock and then swaps the new snapshots in under it.
 */
public class ClusterNodeRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClusterNodeRegistry.class);

    private final NodeDirectory directory;
    private final CapabilityCatalog catalog;
    private final ReachabilityProbe probe;
    private final OrchestratorConfig config;
    private final ExecutorService probeExecutor;

    private final Object lock = new Object();
    // guarded by lock, insertion order = directory order
    private final Map<String, ClusterNode> nodes = new LinkedHashMap<>();
    private volatile boolean initialized;

    public ClusterNodeRegistry(NodeDirectory directory, CapabilityCatalog catalog, ReachabilityProbe probe,
            OrchestratorConfig config) {
        this.directory = directory;
        this.catalog = catalog;
        this.probe = probe;
        this.config = config;
        AtomicInteger threads = new AtomicInteger();
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "node-probe-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Load nodes from the directory, attach their catalog capabilities and probe them once.
     *
     * @return the registered nodes, or an empty list if the directory could not be read
     */
    public List<ClusterNode> registerNodes() {
        List<NodeDescriptor> descriptors;
        try {
            descriptors = directory.listNodes();
        } catch (Exception e) {
            log.error("Failed to register nodes: {}", e.getMessage(), e);
            return List.of();
        }

        Map<String, ClusterNode> loaded = new LinkedHashMap<>();
        for (NodeDescriptor d : descriptors) {
            loaded.put(d.id(), ClusterNode.builder()
                    .id(d.id())
                    .name(d.name())
                    .type(d.nodeType())
                    .status(NodeStatus.UNKNOWN)
                    .host(d.effectiveHost())
                    .port(d.effectivePort())
                    .capabilities(catalog.capabilitiesOf(d.id()))
                    .supportsWol(d.supportsWol())
                    .descriptor(d)
                    .build());
        }

        synchronized (lock) {
            nodes.clear();
            nodes.putAll(loaded);
        }
        initialized = true;
        log.info("Registered {} cluster nodes", loaded.size());
        reportCatalogDivergence(loaded.keySet());

        return refreshNodeStatus();
    }

    /**
     * Probe every node concurrently. A node that fails to probe is marked offline;
     * the other nodes are unaffected.
     *
     * A probe result is only stored if the node record is still the one that was probed.
     * A record replaced meanwhile (a wake, a re-registration) is newer and is kept.
     */
    public List<ClusterNode> refreshNodeStatus() {
        List<ClusterNode> snapshot = getAllNodes();

        List<CompletableFuture<ClusterNode>> checks = new ArrayList<>();
        for (ClusterNode node : snapshot) {
            checks.add(CompletableFuture.supplyAsync(() -> probeNode(node), probeExecutor)
                    .exceptionally(t -> {
                        log.warn("Probe of node {} failed: {}", node.id(), t.getMessage());
                        return node.toBuilder().status(NodeStatus.OFFLINE).build();
                    }));
        }

        List<ClusterNode> probed = new ArrayList<>(checks.size());
        for (CompletableFuture<ClusterNode> check : checks) {
            probed.add(check.join());
        }

        List<ClusterNode> refreshed = new ArrayList<>(probed.size());
        synchronized (lock) {
            for (int i = 0; i < probed.size(); i++) {
                ClusterNode before = snapshot.get(i);
                ClusterNode current = nodes.get(before.id());
                if (current == null) {
                    continue;
                }
                if (current == before) {
                    nodes.put(before.id(), probed.get(i));
                    refreshed.add(probed.get(i));
                } else {
                    log.debug("Node {} changed while probing, keeping status {}", current.id(),
                            current.status().label());
                    refreshed.add(current);
                }
            }
        }
        log.debug("Refreshed status of {} nodes", refreshed.size());
        return refreshed;
    }

    private ClusterNode probeNode(ClusterNode node) {
        long start = System.currentTimeMillis();
        boolean online = probe.isReachable(node.host(), node.port(), config.probeTimeout());
        NodeStatus status = online ? NodeStatus.ONLINE
                : node.supportsWol() ? NodeStatus.SLEEPING : NodeStatus.OFFLINE;
        if (status != node.status()) {
            log.info("Node {} is now {}", node.id(), status.label());
        }
        return node.toBuilder()
                .status(status)
                .latencyMs(System.currentTimeMillis() - start)
                .lastSeen(online ? Instant.now() : node.lastSeen())
                .build();
    }

    /**
     * Record that a node became reachable outside a regular refresh (e.g. after a wake).
     */
    public Optional<ClusterNode> markOnline(String nodeId) {
        synchronized (lock) {
            ClusterNode node = nodes.get(nodeId);
            if (node == null) {
                return Optional.empty();
            }
            ClusterNode online = node.toBuilder()
                    .status(NodeStatus.ONLINE)
                    .lastSeen(Instant.now())
                    .build();
            nodes.put(nodeId, online);
            return Optional.of(online);
        }
    }

    public Optional<ClusterNode> getNode(String nodeId) {
        synchronized (lock) {
            return Optional.ofNullable(nodes.get(nodeId));
        }
    }

    public List<ClusterNode> getAllNodes() {
        synchronized (lock) {
            return List.copyOf(nodes.values());
        }
    }

    public List<ClusterNode> getOnlineNodes() {
        return getAllNodes().stream().filter(ClusterNode::isOnline).toList();
    }

    public List<NodeCapability> getNodeCapabilities(String nodeId) {
        return getNode(nodeId).map(ClusterNode::capabilities).orElse(List.of());
    }

    /** Registered nodes listed for {@code capability} in the routing table, in table order. */
    public List<ClusterNode> getNodesByCapability(String capability) {
        synchronized (lock) {
            List<ClusterNode> result = new ArrayList<>();
            for (String id : catalog.nodesFor(capability)) {
                ClusterNode node = nodes.get(id);
                if (node != null) {
                    result.add(node);
                }
            }
            return result;
        }
    }

    /**
     * Register on first use, refresh, and aggregate.
     */
    public ClusterStatus getClusterStatus() {
        if (!initialized) {
            registerNodes();
        }
        List<ClusterNode> all = refreshNodeStatus();

        int online = 0;
        int offline = 0;
        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        for (ClusterNode node : all) {
            if (node.isOnline()) {
                online++;
            } else if (node.status() == NodeStatus.OFFLINE || node.status() == NodeStatus.SLEEPING) {
                offline++;
            }
            for (NodeCapability cap : node.capabilities()) {
                List<String> entries = capabilities.computeIfAbsent(cap.category().label(), k -> new ArrayList<>());
                if (node.isOnline()) {
                    entries.add(node.id() + ":" + cap.id());
                }
            }
        }

        return new ClusterStatus(all, all.size(), online, offline, capabilities, Instant.now());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /** The routing table and the per-node catalog are maintained separately; flag where they disagree. */
    private void reportCatalogDivergence(Set<String> registered) {
        catalog.routingTable().forEach((capability, nodeIds) -> {
            for (String id : nodeIds) {
                if (!registered.contains(id)) {
                    log.warn("Capability '{}' routes to node '{}' which is not in the node directory", capability, id);
                }
            }
        });
        for (String id : registered) {
            if (catalog.capabilitiesOf(id).isEmpty()) {
                log.warn("Node '{}' has no catalog capabilities", id);
            }
        }
    }

    @Override
    public void close() {
        probeExecutor.shutdownNow();
    }
}
