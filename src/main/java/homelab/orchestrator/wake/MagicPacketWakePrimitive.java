package homelab.orchestrator.wake;

import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.execution.KeyMaterialSource;
import homelab.orchestrator.execution.ShellResult;
import homelab.orchestrator.execution.ShellTarget;
import homelab.orchestrator.execution.ShellTransport;
import homelab.orchestrator.execution.TransportException;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.model.ExecutionErrorKind;
import homelab.orchestrator.probe.ReachabilityProbe;
import homelab.orchestrator.service.ClusterNodeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Wake-on-LAN by magic packet: six 0xFF bytes followed by the MAC repeated sixteen times,
 * sent as UDP broadcast to port 9 either from this host or by a relay node over SSH.
 * Then polls the target until it accepts connections.
 */
public class MagicPacketWakePrimitive implements WakePrimitive {

    private static final Logger log = LoggerFactory.getLogger(MagicPacketWakePrimitive.class);

    public static final int WOL_PORT = 9;
    public static final String DEFAULT_BROADCAST = "255.255.255.255";

    private static final Pattern OCTET = Pattern.compile("[0-9A-Fa-f]{2}");

    private final ReachabilityProbe probe;
    private final ClusterNodeRegistry nodes;
    private final ShellTransport shell;
    private final KeyMaterialSource keys;
    private final OrchestratorConfig config;

    public MagicPacketWakePrimitive(ReachabilityProbe probe, ClusterNodeRegistry nodes, ShellTransport shell,
            KeyMaterialSource keys, OrchestratorConfig config) {
        this.probe = probe;
        this.nodes = nodes;
        this.shell = shell;
        this.keys = keys;
        this.config = config;
    }

    @Override
    public WakeResponse wake(WakeRequest request) {
        byte[] packet;
        try {
            packet = magicPacket(request.macAddress());
        } catch (IllegalArgumentException e) {
            return WakeResponse.failed(ExecutionErrorKind.CONFIGURATION, e.getMessage());
        }

        WakeResponse sendFailure = request.relayNodeId() != null && !request.relayNodeId().isBlank()
                ? sendViaRelay(request)
                : sendDirect(request, packet);
        if (sendFailure != null) {
            return sendFailure;
        }

        return waitForOnline(request);
    }

    private WakeResponse sendDirect(WakeRequest request, byte[] packet) {
        String broadcast = request.broadcastAddress() != null && !request.broadcastAddress().isBlank()
                ? request.broadcastAddress()
                : DEFAULT_BROADCAST;
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setBroadcast(true);
            socket.send(new DatagramPacket(packet, packet.length, InetAddress.getByName(broadcast), WOL_PORT));
            log.info("Sent magic packet for {} to {}:{}", request.macAddress(), broadcast, WOL_PORT);
            return null;
        } catch (IOException e) {
            log.warn("Failed to send magic packet to {}: {}", broadcast, e.getMessage());
            return WakeResponse.failed(ExecutionErrorKind.TRANSPORT, "Failed to send magic packet: " + e.getMessage());
        }
    }

    private WakeResponse sendViaRelay(WakeRequest request) {
        Optional<ClusterNode> relay = nodes.getNode(request.relayNodeId());
        if (relay.isEmpty()) {
            return WakeResponse.failed(ExecutionErrorKind.RELAY_FAILURE,
                    "Relay node '" + request.relayNodeId() + "' not found");
        }
        ClusterNode node = relay.get();
        String user = node.descriptor() != null ? node.descriptor().user() : null;
        if (user == null || user.isBlank()) {
            return WakeResponse.failed(ExecutionErrorKind.CONFIGURATION,
                    "SSH user not configured for relay node '" + node.id() + "'");
        }
        Optional<byte[]> key = keys.privateKey();
        if (key.isEmpty()) {
            return WakeResponse.failed(ExecutionErrorKind.CONFIGURATION, "SSH key not found");
        }

        String command = "wakeonlan " + (request.broadcastAddress() != null && !request.broadcastAddress().isBlank()
                ? "-i " + request.broadcastAddress() + " "
                : "") + request.macAddress();
        try {
            ShellResult result = shell.exec(new ShellTarget(node.host(), node.port(), user), key.get(), command,
                    config.sshTimeout());
            if (!result.isSuccess()) {
                return WakeResponse.failed(ExecutionErrorKind.RELAY_FAILURE,
                        "Relay '" + node.id() + "' failed: " + result.failureMessage());
            }
            log.info("Relay {} sent magic packet for {}", node.id(), request.macAddress());
            return null;
        } catch (TransportException e) {
            return WakeResponse.failed(ExecutionErrorKind.RELAY_FAILURE,
                    "Relay '" + node.id() + "' unreachable: " + e.getMessage());
        }
    }

    private WakeResponse waitForOnline(WakeRequest request) {
        long start = System.currentTimeMillis();
        long deadline = start + request.waitTimeout().toMillis();
        Duration pollInterval = config.wakePollInterval();

        while (true) {
            if (probe.isReachable(request.targetHost(), request.checkPort(), config.probeTimeout())) {
                long seconds = (System.currentTimeMillis() - start) / 1000;
                return WakeResponse.online("Node is online after " + seconds + "s");
            }
            long left = deadline - System.currentTimeMillis();
            if (left <= 0) {
                break;
            }
            try {
                Thread.sleep(Math.min(left, pollInterval.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return WakeResponse.failed(ExecutionErrorKind.TRANSPORT, "Interrupted while waiting for node");
            }
        }

        return WakeResponse.failed(ExecutionErrorKind.WAKE_TIMEOUT,
                "Wake signal sent but node did not come online within "
                        + request.waitTimeout().toSeconds() + "s");
    }

    /**
     * @throws IllegalArgumentException if the MAC address is not six hex octets
     */
    static byte[] magicPacket(String macAddress) {
        if (macAddress == null) {
            throw new IllegalArgumentException("MAC address is required");
        }
        String[] parts = macAddress.trim().split("[:-]");
        if (parts.length != 6) {
            throw new IllegalArgumentException("Invalid MAC address: " + macAddress);
        }
        byte[] mac = new byte[6];
        for (int i = 0; i < 6; i++) {
            if (!OCTET.matcher(parts[i]).matches()) {
                throw new IllegalArgumentException("Invalid MAC address: " + macAddress);
            }
            mac[i] = (byte) Integer.parseInt(parts[i], 16);
        }

        byte[] packet = new byte[6 + 16 * 6];
        for (int i = 0; i < 6; i++) {
            packet[i] = (byte) 0xFF;
        }
        for (int i = 6; i < packet.length; i += 6) {
            System.arraycopy(mac, 0, packet, i, 6);
        }
        return packet;
    }
}
