package homelab.orchestrator.service;

import homelab.orchestrator.catalog.CapabilityCatalog;
import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.execution.NodeExecutionAdapter;
import homelab.orchestrator.model.CapabilityCategory;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.model.NodeAction;
import homelab.orchestrator.model.NodeCapability;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.model.NodeStatus;
import homelab.orchestrator.testsupport.FakeReachabilityProbe;
import homelab.orchestrator.testsupport.FakeWakePrimitive;
import homelab.orchestrator.testsupport.Nodes;
import homelab.orchestrator.testsupport.RecordingAgentTransport;
import homelab.orchestrator.testsupport.RecordingShellTransport;
import homelab.orchestrator.wake.WakeCoordinator;
import homelab.orchestrator.wake.WakeResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRouterTest {

    private final FakeReachabilityProbe probe = new FakeReachabilityProbe()
            .up(Nodes.LINODE_HOST).up(Nodes.HOME_HOST).up(Nodes.WINDOWS_HOST);
    private final FakeWakePrimitive wake = new FakeWakePrimitive();
    private final RecordingShellTransport shell = new RecordingShellTransport();
    private final RecordingAgentTransport agent = new RecordingAgentTransport();

    private ClusterNodeRegistry registry;
    private CapabilityRouter router;

    private void start(CapabilityCatalog catalog) {
        OrchestratorConfig config = OrchestratorConfig.defaults();
        registry = new ClusterNodeRegistry(() -> List.of(Nodes.linode(), Nodes.home(), Nodes.windows()),
                catalog, probe, config);
        WakeCoordinator wakeCoordinator = new WakeCoordinator(registry, wake, config);
        NodeExecutionAdapter executor = new NodeExecutionAdapter(registry, wakeCoordinator, shell,
                () -> Optional.of("key".getBytes()), agent, config);
        router = new CapabilityRouter(registry, wakeCoordinator, executor);
        registry.registerNodes();
    }

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.close();
        }
    }

    @Test
    @DisplayName("Online candidates are ranked by their own capability priority")
    void highestPriorityOnlineNodeWins() {
        start(CapabilityCatalog.homelab());

        // linode advertises docker at 100, home at 90
        assertEquals("linode", router.routeJobToNode("docker").orElseThrow().id());

        probe.down(Nodes.LINODE_HOST);
        registry.refreshNodeStatus();
        assertEquals("home", router.routeJobToNode("docker").orElseThrow().id());
    }

    @Test
    @DisplayName("Priority beats table order, equal priorities keep table order")
    void priorityThenTableOrder() {
        CapabilityCatalog catalog = new CapabilityCatalog(
                Map.of(
                        "linode", List.of(new NodeCapability("backup", "Backup", CapabilityCategory.STORAGE, "", 80),
                                new NodeCapability("cron", "Cron", CapabilityCategory.COMPUTE, "", 50)),
                        "home", List.of(new NodeCapability("backup", "Backup", CapabilityCategory.STORAGE, "", 50),
                                new NodeCapability("cron", "Cron", CapabilityCategory.COMPUTE, "", 50))),
                Map.of("backup", List.of("home", "linode"), "cron", List.of("home", "linode")));
        start(catalog);

        assertEquals("linode", router.routeJobToNode("backup").orElseThrow().id());
        assertEquals("home", router.routeJobToNode("cron").orElseThrow().id());
    }

    @Test
    @DisplayName("Without online candidates a sleeping wake-capable node is chosen")
    void sleepingNodeIsFallback() {
        probe.down(Nodes.WINDOWS_HOST);
        start(CapabilityCatalog.homelab());

        ClusterNode chosen = router.routeJobToNode("ai-text").orElseThrow();
        assertEquals("windows", chosen.id());
        assertEquals(NodeStatus.SLEEPING, chosen.status());
    }

    @Test
    @DisplayName("Offline nodes without wake support are never chosen")
    void offlineNodeIsNotRouted() {
        probe.down(Nodes.HOME_HOST);
        start(CapabilityCatalog.homelab());

        assertTrue(router.routeJobToNode("plex").isEmpty());
    }

    @Test
    @DisplayName("Unknown capability reports no capacity without touching a transport")
    void noCapacity() {
        start(CapabilityCatalog.homelab());

        NodeExecutionResult result = router.routeAndExecute("quantum", NodeAction.CHECK_STATUS, Map.of(), true);

        assertFalse(result.success());
        assertEquals(ExecutionErrorKind.NO_CAPACITY, result.errorKind());
        assertEquals(CapabilityRouter.NO_NODE, result.nodeId());
        assertTrue(shell.commands.isEmpty());
        assertTrue(agent.calls.isEmpty());
    }

    @Test
    @DisplayName("A sleeping node is woken before the action runs")
    void wakeThenExecute() {
        probe.down(Nodes.WINDOWS_HOST);
        start(CapabilityCatalog.homelab());

        NodeExecutionResult result = router.routeAndExecute("ai-image", NodeAction.CHECK_STATUS, Map.of(), true);

        assertTrue(result.success(), () -> "unexpected failure: " + result.error());
        assertEquals("windows", result.nodeId());
        assertEquals("done", result.output());
        assertEquals(1, wake.requests.size());
        assertEquals(1, agent.calls.size());
        assertEquals("/api/health", agent.calls.get(0).path());
        assertTrue(registry.getNode("windows").orElseThrow().isOnline());
    }

    @Test
    @DisplayName("Without the wake flag a sleeping node is reported unavailable")
    void noWakeRequested() {
        probe.down(Nodes.WINDOWS_HOST);
        start(CapabilityCatalog.homelab());

        NodeExecutionResult result = router.routeAndExecute("ai-image", NodeAction.CHECK_STATUS, Map.of(), false);

        assertEquals(ExecutionErrorKind.NODE_UNAVAILABLE, result.errorKind());
        assertTrue(wake.requests.isEmpty());
        assertTrue(agent.calls.isEmpty());
    }

    @Test
    @DisplayName("A failed wake is returned and the action is skipped")
    void failedWake() {
        probe.down(Nodes.WINDOWS_HOST);
        wake.respond(WakeResponse.failed(ExecutionErrorKind.WAKE_TIMEOUT, "did not come online"));
        start(CapabilityCatalog.homelab());

        NodeExecutionResult result = router.routeAndExecute("gpu", NodeAction.AI_GENERATE,
                Map.of("prompt", "a cat"), true);

        assertFalse(result.success());
        assertEquals(ExecutionErrorKind.WAKE_TIMEOUT, result.errorKind());
        assertEquals("wake", result.action());
        assertTrue(agent.calls.isEmpty());
    }

    @Test
    @DisplayName("Routed Linux actions run over the shell transport")
    void linuxExecution() {
        start(CapabilityCatalog.homelab());

        NodeExecutionResult result = router.routeAndExecute("plex", NodeAction.RESTART_SERVICE,
                Map.of("service", "plex"), true);

        assertTrue(result.success());
        assertEquals("home", result.nodeId());
        assertEquals(List.of("docker restart plex"), shell.commands);
        assertEquals("homelab", shell.targets.get(0).user());
    }
}
