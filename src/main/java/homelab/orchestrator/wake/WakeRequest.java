package homelab.orchestrator.wake;

import java.time.Duration;

/**
 * @param broadcastAddress directed broadcast for the magic packet, null for 255.255.255.255
 * @param relayNodeId      node that sends the packet on the target's LAN, null to send directly
 * @param checkPort        port polled on {@code targetHost} to detect the node coming up
 */
public record WakeRequest(
        String macAddress,
        String broadcastAddress,
        String relayNodeId,
        String targetHost,
        int checkPort,
        Duration waitTimeout) {
}
