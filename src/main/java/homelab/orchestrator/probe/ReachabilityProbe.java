package homelab.orchestrator.probe;

import java.time.Duration;

/**
 * Timed reachability check of a host:port.
 */
@FunctionalInterface
public interface ReachabilityProbe {

    /**
     * @return true if a connection to {@code host:port} was accepted within {@code timeout}
     */
    boolean isReachable(String host, int port, Duration timeout);
}
