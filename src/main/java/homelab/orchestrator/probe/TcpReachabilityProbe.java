package homelab.orchestrator.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Reachability by opening (and immediately closing) a TCP connection.
 */
public class TcpReachabilityProbe implements ReachabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(TcpReachabilityProbe.class);

    @Override
    public boolean isReachable(String host, int port, Duration timeout) {
        if (host == null || host.isBlank()) {
            return false;
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("{}:{} not reachable: {}", host, port, e.getMessage());
            return false;
        }
    }
}
