package homelab.orchestrator.testsupport;

import homelab.orchestrator.probe.ReachabilityProbe;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reachability controlled per host. Hosts not marked up are unreachable.
 */
public class FakeReachabilityProbe implements ReachabilityProbe {

    private final Set<String> up = ConcurrentHashMap.newKeySet();
    private final Set<String> broken = ConcurrentHashMap.newKeySet();
    private final AtomicInteger calls = new AtomicInteger();

    public FakeReachabilityProbe up(String host) {
        up.add(host);
        return this;
    }

    public FakeReachabilityProbe down(String host) {
        up.remove(host);
        return this;
    }

    /** Probing this host throws */
    public FakeReachabilityProbe broken(String host) {
        broken.add(host);
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public boolean isReachable(String host, int port, Duration timeout) {
        calls.incrementAndGet();
        if (broken.contains(host)) {
            throw new IllegalStateException("probe exploded for " + host);
        }
        return up.contains(host);
    }
}
