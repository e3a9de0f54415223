package homelab.orchestrator.catalog;

import homelab.orchestrator.model.CapabilityCategory;
import homelab.orchestrator.model.NodeCapability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static homelab.orchestrator.model.CapabilityCategory.AI;
import static homelab.orchestrator.model.CapabilityCategory.COMPUTE;
import static homelab.orchestrator.model.CapabilityCategory.DEPLOYMENT;
import static homelab.orchestrator.model.CapabilityCategory.DOCKER;
import static homelab.orchestrator.model.CapabilityCategory.MEDIA;
import static homelab.orchestrator.model.CapabilityCategory.NETWORK;
import static homelab.orchestrator.model.CapabilityCategory.STORAGE;
import static homelab.orchestrator.model.CapabilityCategory.VIRTUALIZATION;

/**
 * Static placement data for the homelab.
 *
 * Two independent tables are kept here: the capabilities each node advertises
 * (with per-node priorities used to rank candidates) and the routing table
 * mapping a requested capability to the node ids that may serve it, in
 * preference order. The routing table is the source of truth for placement.
 */
public final class CapabilityCatalog {

    private final Map<String, List<NodeCapability>> nodeCapabilities;
    private final Map<String, List<String>> routingTable;

    public CapabilityCatalog(Map<String, List<NodeCapability>> nodeCapabilities,
            Map<String, List<String>> routingTable) {
        Map<String, List<NodeCapability>> caps = new LinkedHashMap<>();
        nodeCapabilities.forEach((node, list) -> caps.put(node, List.copyOf(list)));
        Map<String, List<String>> routes = new LinkedHashMap<>();
        routingTable.forEach((cap, nodes) -> routes.put(cap, List.copyOf(nodes)));
        this.nodeCapabilities = Collections.unmodifiableMap(caps);
        this.routingTable = Collections.unmodifiableMap(routes);
    }

    /** Catalog of the linode / home / windows homelab. */
    public static CapabilityCatalog homelab() {
        Map<String, List<NodeCapability>> caps = new LinkedHashMap<>();
        caps.put("linode", List.of(
                cap("docker", "Docker", DOCKER, "Container orchestration", 100),
                cap("pm2", "PM2", DEPLOYMENT, "Node.js process manager", 90),
                cap("web-hosting", "Web Hosting", NETWORK, "Public web services", 100),
                cap("postgres", "PostgreSQL", STORAGE, "Database services", 90),
                cap("redis", "Redis", STORAGE, "Cache and message broker", 85),
                cap("caddy", "Caddy", NETWORK, "Reverse proxy and TLS", 95),
                cap("discord-bot", "Discord Bot", DEPLOYMENT, "Discord bot hosting", 80),
                cap("stream-bot", "Stream Bot", DEPLOYMENT, "Stream bot hosting", 80),
                cap("dashboard", "Dashboard", DEPLOYMENT, "Dashboard hosting", 85)));
        caps.put("home", List.of(
                cap("kvm", "KVM/libvirt", VIRTUALIZATION, "Virtual machine hypervisor", 100),
                cap("plex", "Plex", MEDIA, "Media server", 90),
                cap("jellyfin", "Jellyfin", MEDIA, "Media server alternative", 85),
                cap("nas", "NAS", STORAGE, "Network attached storage", 95),
                cap("wol-relay", "WoL Relay", NETWORK, "Wake-on-LAN relay server", 100),
                cap("docker", "Docker", DOCKER, "Container orchestration", 90),
                cap("vnc", "VNC Server", VIRTUALIZATION, "Remote desktop access", 80),
                cap("xrdp", "XRDP", VIRTUALIZATION, "RDP server for Linux", 75),
                cap("home-assistant", "Home Assistant", COMPUTE, "Home automation", 85),
                cap("vm-management", "VM Management", VIRTUALIZATION, "Virtual machine control", 100)));
        caps.put("windows", List.of(
                cap("ollama", "Ollama", AI, "Local LLM inference", 100),
                cap("stable-diffusion", "Stable Diffusion WebUI", AI, "Image generation", 100),
                cap("comfyui", "ComfyUI", AI, "Advanced image/video generation", 95),
                cap("gpu-compute", "GPU Compute", COMPUTE, "CUDA/GPU acceleration", 100),
                cap("text-generation", "Text Generation", AI, "LLM text generation", 100),
                cap("image-generation", "Image Generation", AI, "AI image synthesis", 100),
                cap("video-generation", "Video Generation", AI, "AI video synthesis", 90),
                cap("embedding", "Embeddings", AI, "Vector embeddings", 85),
                cap("code-completion", "Code Completion", AI, "AI code assistance", 95),
                cap("sunshine", "Sunshine", VIRTUALIZATION, "Game streaming server", 80)));

        Map<String, List<String>> routes = new LinkedHashMap<>();
        routes.put("ai-image", List.of("windows"));
        routes.put("ai-video", List.of("windows"));
        routes.put("ai-text", List.of("windows"));
        routes.put("ai-code", List.of("windows"));
        routes.put("ai-embedding", List.of("windows"));
        routes.put("ollama", List.of("windows"));
        routes.put("stable-diffusion", List.of("windows"));
        routes.put("comfyui", List.of("windows"));
        routes.put("gpu", List.of("windows"));
        routes.put("docker-linode", List.of("linode"));
        routes.put("docker-home", List.of("home"));
        routes.put("docker", List.of("linode", "home"));
        routes.put("kvm", List.of("home"));
        routes.put("vm", List.of("home"));
        routes.put("plex", List.of("home"));
        routes.put("media", List.of("home"));
        routes.put("nas", List.of("home"));
        routes.put("wol", List.of("home"));
        routes.put("web-hosting", List.of("linode"));
        routes.put("database", List.of("linode"));
        routes.put("discord-bot", List.of("linode"));
        routes.put("stream-bot", List.of("linode"));
        routes.put("dashboard", List.of("linode"));

        return new CapabilityCatalog(caps, routes);
    }

    /** Capabilities advertised by a node, empty for nodes the catalog does not know. */
    public List<NodeCapability> capabilitiesOf(String nodeId) {
        return nodeCapabilities.getOrDefault(nodeId, List.of());
    }

    /** Node ids that may serve {@code capability}, in table order. */
    public List<String> nodesFor(String capability) {
        return routingTable.getOrDefault(capability, List.of());
    }

    public Set<String> routedCapabilities() {
        return routingTable.keySet();
    }

    public Map<String, List<String>> routingTable() {
        return routingTable;
    }

    private static NodeCapability cap(String id, String name, CapabilityCategory category, String description,
            int priority) {
        return new NodeCapability(id, name, category, description, priority);
    }
}
