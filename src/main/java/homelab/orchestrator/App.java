package homelab.orchestrator;

import homelab.orchestrator.config.Dependencies;
import homelab.orchestrator.config.OrchestratorConfig;
import homelab.orchestrator.model.ClusterNode;
import homelab.orchestrator.server.OrchestratorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point: wires the orchestrator, registers the cluster, starts the
 * background scheduler and serves the HTTP API until the JVM shuts down.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        OrchestratorConfig config = OrchestratorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        List<ClusterNode> nodes = deps.orchestrator().registerNodes();
        log.info("{} of {} nodes online", nodes.stream().filter(ClusterNode::isOnline).count(), nodes.size());

        OrchestratorNettyServer server = new OrchestratorNettyServer(config, deps.routerHandler());
        if (!server.start()) {
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "shutdown"));
        shutdown.await();
    }
}
