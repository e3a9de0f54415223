package homelab.orchestrator.config;

import homelab.orchestrator.api.v1.ClusterController;
import homelab.orchestrator.api.v1.HealthController;
import homelab.orchestrator.api.v1.JobController;
import homelab.orchestrator.api.v1.StatsController;
import homelab.orchestrator.assistant.CodeAssistant;
import homelab.orchestrator.assistant.OllamaCodeAssistant;
import homelab.orchestrator.catalog.CapabilityCatalog;
import homelab.orchestrator.core.JobEventBus;
import homelab.orchestrator.directory.JsonNodeDirectory;
import homelab.orchestrator.directory.NodeDirectory;
import homelab.orchestrator.execution.AgentTransport;
import homelab.orchestrator.execution.FileKeyMaterialSource;
import homelab.orchestrator.execution.HttpAgentTransport;
import homelab.orchestrator.execution.JschShellTransport;
import homelab.orchestrator.execution.KeyMaterialSource;
import homelab.orchestrator.execution.NodeExecutionAdapter;
import homelab.orchestrator.execution.ShellTransport;
import homelab.orchestrator.probe.HttpRuntimeHealthProbe;
import homelab.orchestrator.probe.ReachabilityProbe;
import homelab.orchestrator.probe.RuntimeHealthProbe;
import homelab.orchestrator.probe.TcpReachabilityProbe;
import homelab.orchestrator.scheduler.JobScheduler;
import homelab.orchestrator.scheduler.Scheduler;
import homelab.orchestrator.scheduler.SubagentRegistry;
import homelab.orchestrator.server.RouterHandler;
import homelab.orchestrator.service.AIResourceSelector;
import homelab.orchestrator.service.CapabilityRouter;
import homelab.orchestrator.service.ClusterNodeRegistry;
import homelab.orchestrator.service.Orchestrator;
import homelab.orchestrator.store.InMemoryJobRepository;
import homelab.orchestrator.store.InMemorySubagentRepository;
import homelab.orchestrator.wake.MagicPacketWakePrimitive;
import homelab.orchestrator.wake.WakeCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the orchestrator and its HTTP layer.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startScheduler();
 * Orchestrator orchestrator = deps.orchestrator();
 * // ...
 * deps.close();
 * </pre>
 *
 * External systems (node directory, probes, transports, code assistant,
 * credentials) can be replaced through {@link Externals} for tests.
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final JobEventBus events;
    private final JobScheduler jobScheduler;
    private final ClusterNodeRegistry nodeRegistry;
    private final AIResourceSelector resourceSelector;
    private final Scheduler scheduler;
    private final Orchestrator orchestrator;

    // Controllers
    private final HealthController healthController;
    private final StatsController statsController;
    private final JobController jobController;
    private final ClusterController clusterController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(OrchestratorConfig config, Externals overrides) {
        this.config = config;
        Externals externals = overrides.withDefaults(config);

        log.info("Initializing dependencies with config: {}", config);

        // Jobs
        this.events = new JobEventBus();
        SubagentRegistry subagents = new SubagentRegistry(new InMemorySubagentRepository());
        this.jobScheduler = new JobScheduler(new InMemoryJobRepository(), subagents, events, config);

        // Cluster
        this.nodeRegistry = new ClusterNodeRegistry(externals.directory, externals.catalog, externals.probe, config);
        MagicPacketWakePrimitive wakePrimitive = new MagicPacketWakePrimitive(externals.probe, nodeRegistry,
                externals.shell, externals.keys, config);
        WakeCoordinator wakeCoordinator = new WakeCoordinator(nodeRegistry, wakePrimitive, config);
        NodeExecutionAdapter executionAdapter = new NodeExecutionAdapter(nodeRegistry, wakeCoordinator,
                externals.shell, externals.keys, externals.agent, config);
        CapabilityRouter router = new CapabilityRouter(nodeRegistry, wakeCoordinator, executionAdapter);

        // AI resources
        this.resourceSelector = new AIResourceSelector(externals.runtimeProbe, externals.codeAssistant,
                externals.credentials);
        this.scheduler = new Scheduler(jobScheduler, resourceSelector::refreshResourceStatus, config);

        this.orchestrator = new Orchestrator(jobScheduler, events, nodeRegistry, executionAdapter, wakeCoordinator,
                router, resourceSelector, externals.codeAssistant, scheduler);

        // Controllers (public API)
        this.healthController = new HealthController(orchestrator);
        this.statsController = new StatsController(orchestrator);
        this.jobController = new JobController(orchestrator);
        this.clusterController = new ClusterController(orchestrator);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config, new Externals());
    }

    public static Dependencies create(OrchestratorConfig config, Externals externals) {
        return new Dependencies(config, externals);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(OrchestratorConfig.fromEnv());
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public JobEventBus events() {
        return events;
    }

    public JobScheduler jobScheduler() {
        return jobScheduler;
    }

    public ClusterNodeRegistry nodeRegistry() {
        return nodeRegistry;
    }

    public AIResourceSelector resourceSelector() {
        return resourceSelector;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * RouterHandler with every controller registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(statsController)
                    .registerController(jobController)
                    .registerController(clusterController);
            log.info("RouterHandler created with {} controllers", 4);
        }
        return routerHandler;
    }

    /**
     * Start the retention sweep and periodic AI resource monitoring.
     */
    public void startScheduler() {
        scheduler.start();
        scheduler.startResourceMonitoring(config.resourceMonitorInterval());
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            orchestrator.close();
        } catch (RuntimeException e) {
            log.warn("Error closing orchestrator: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }

    /**
     * Systems outside the process. Unset fields fall back to the production implementation.
     */
    public static final class Externals {
        private NodeDirectory directory;
        private CapabilityCatalog catalog = CapabilityCatalog.homelab();
        private ReachabilityProbe probe = new TcpReachabilityProbe();
        private ShellTransport shell = new JschShellTransport();
        private KeyMaterialSource keys;
        private AgentTransport agent;
        private RuntimeHealthProbe runtimeProbe;
        private CodeAssistant codeAssistant;
        private CredentialSource credentials = CredentialSource.environment();

        Externals withDefaults(OrchestratorConfig config) {
            if (directory == null) {
                directory = new JsonNodeDirectory(config.nodesFile());
            }
            if (keys == null) {
                keys = new FileKeyMaterialSource(config.sshKeyPath());
            }
            if (agent == null) {
                agent = new HttpAgentTransport(config.probeTimeout());
            }
            if (runtimeProbe == null) {
                runtimeProbe = new HttpRuntimeHealthProbe(config);
            }
            if (codeAssistant == null) {
                codeAssistant = new OllamaCodeAssistant(config);
            }
            return this;
        }

        public Externals directory(NodeDirectory directory) {
            this.directory = directory;
            return this;
        }

        public Externals catalog(CapabilityCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Externals probe(ReachabilityProbe probe) {
            this.probe = probe;
            return this;
        }

        public Externals shell(ShellTransport shell) {
            this.shell = shell;
            return this;
        }

        public Externals keys(KeyMaterialSource keys) {
            this.keys = keys;
            return this;
        }

        public Externals agent(AgentTransport agent) {
            this.agent = agent;
            return this;
        }

        public Externals runtimeProbe(RuntimeHealthProbe runtimeProbe) {
            this.runtimeProbe = runtimeProbe;
            return this;
        }

        public Externals codeAssistant(CodeAssistant codeAssistant) {
            this.codeAssistant = codeAssistant;
            return this;
        }

        public Externals credentials(CredentialSource credentials) {
            this.credentials = credentials;
            return this;
        }
    }
}
