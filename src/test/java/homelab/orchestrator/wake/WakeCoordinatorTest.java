package homelab.orchestrator.wake;

import homelab.orchestrator.catalog.CapabilityCatalog;
import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.model.NodeExecutionResult;
import homelab.orchestrator.model.NodeStatus;
import homelab.orchestrator.service.ClusterNodeRegistry;
import homelab.orchestrator.testsupport.FakeReachabilityProbe;
import homelab.orchestrator.testsupport.FakeWakePrimitive;
import homelab.orchestrator.testsupport.Nodes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WakeCoordinatorTest {

    private final FakeWakePrimitive primitive = new FakeWakePrimitive();
    private ClusterNodeRegistry registry;
    private WakeCoordinator coordinator;

    @BeforeEach
    void setUp() {
        OrchestratorConfig config = OrchestratorConfig.defaults().withWakeTimeout(Duration.ofSeconds(90));
        FakeReachabilityProbe probe = new FakeReachabilityProbe().up(Nodes.LINODE_HOST);
        registry = new ClusterNodeRegistry(() -> List.of(Nodes.linode(), Nodes.windows()),
                CapabilityCatalog.homelab(), probe, config);
        registry.registerNodes();
        coordinator = new WakeCoordinator(registry, primitive, config);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("Successful wake passes the node's WoL settings and marks it online")
    void wakeSleepingNode() {
        assertEquals(NodeStatus.SLEEPING, registry.getNode("windows").orElseThrow().status());

        NodeExecutionResult result = coordinator.wakeNode("windows");

        assertTrue(result.success());
        assertEquals("wake", result.action());
        assertEquals(NodeStatus.ONLINE, registry.getNode("windows").orElseThrow().status());

        WakeRequest request = primitive.requests.get(0);
        assertEquals(Nodes.WINDOWS_MAC, request.macAddress());
        assertEquals("192.168.1.255", request.broadcastAddress());
        assertEquals("home", request.relayNodeId());
        assertEquals(Nodes.WINDOWS_HOST, request.targetHost());
        assertEquals(9765, request.checkPort());
        assertEquals(Duration.ofSeconds(90), request.waitTimeout());
    }

    @Test
    @DisplayName("Nodes without WoL settings are a configuration error")
    void wakeWithoutWol() {
        NodeExecutionResult result = coordinator.wakeNode("linode");

        assertEquals(ExecutionErrorKind.CONFIGURATION, result.errorKind());
        assertEquals("WoL not configured", result.error());
        assertTrue(primitive.requests.isEmpty());
    }

    @Test
    void wakeUnknownNode() {
        assertEquals(ExecutionErrorKind.NOT_FOUND, coordinator.wakeNode("nas").errorKind());
    }

    @Test
    @DisplayName("Failure kinds from the primitive are kept and the node stays asleep")
    void failedWake() {
        primitive.respond(WakeResponse.failed(ExecutionErrorKind.RELAY_FAILURE, "relay down"));

        NodeExecutionResult result = coordinator.wakeNode("windows");

        assertFalse(result.success());
        assertEquals(ExecutionErrorKind.RELAY_FAILURE, result.errorKind());
        assertEquals("relay down", result.error());
        assertEquals(NodeStatus.SLEEPING, registry.getNode("windows").orElseThrow().status());
    }

    @Test
    void failureWithoutKindIsWakeTimeout() {
        primitive.respond(new WakeResponse(false, false, null, "no answer", null));

        assertEquals(ExecutionErrorKind.WAKE_TIMEOUT, coordinator.wakeNode("windows").errorKind());
    }

    @Test
    void throwingPrimitiveIsTransportFailure() {
        WakeCoordinator broken = new WakeCoordinator(registry, request -> {
            throw new IllegalStateException("socket closed");
        }, OrchestratorConfig.defaults());

        NodeExecutionResult result = broken.wakeNode("windows");

        assertEquals(ExecutionErrorKind.TRANSPORT, result.errorKind());
        assertEquals("socket closed", result.error());
    }
}
