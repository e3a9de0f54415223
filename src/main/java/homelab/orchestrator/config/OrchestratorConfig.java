package homelab.orchestrator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for orchestrator settings.
 * All settings have sensible defaults.
 */
public final class OrchestratorConfig {

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, mutating API calls must carry X-Orchestrator-Key

    // Job settings
    private int maxConcurrent = 5;
    private int defaultRetries = 2;
    private Duration defaultJobTimeout = Duration.ofMinutes(2);
    private Duration jobRetention = Duration.ofHours(1);
    private Duration retentionSweepInterval = Duration.ofMinutes(5);

    // Cluster settings
    private Path nodesFile = Path.of("nodes.json");
    private Path sshKeyPath = Path.of(System.getProperty("user.home"), ".ssh", "homelab");
    private String defaultAgentToken = null;
    private Duration probeTimeout = Duration.ofSeconds(5);
    private Duration sshTimeout = Duration.ofSeconds(30);
    private Duration agentTimeout = Duration.ofSeconds(60);
    private Duration wakeTimeout = Duration.ofMinutes(3);
    private Duration wakePollInterval = Duration.ofSeconds(5);

    // AI resource settings
    private Duration resourceMonitorInterval = Duration.ofSeconds(30);
    private String ollamaUrl = "http://localhost:11434";
    private String stableDiffusionUrl = "http://localhost:7860";
    private String comfyUiUrl = "http://localhost:8188";
    private String codeAssistantModel = "qwen2.5-coder:14b";
    private Duration codeAssistantTimeout = Duration.ofMinutes(5);
    private Path projectPath = Path.of(".");

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config = new OrchestratorConfig();

        String port = System.getenv("ORCH_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String apiKey = System.getenv("ORCH_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String maxConcurrent = System.getenv("ORCH_MAX_CONCURRENT");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            config.maxConcurrent = Integer.parseInt(maxConcurrent);
        }

        String retries = System.getenv("ORCH_DEFAULT_RETRIES");
        if (retries != null && !retries.isBlank()) {
            config.defaultRetries = Integer.parseInt(retries);
        }

        String nodesFile = System.getenv("ORCH_NODES_FILE");
        if (nodesFile != null && !nodesFile.isBlank()) {
            config.nodesFile = Path.of(nodesFile);
        }

        String sshKey = System.getenv("ORCH_SSH_KEY_PATH");
        if (sshKey != null && !sshKey.isBlank()) {
            config.sshKeyPath = Path.of(sshKey);
        }

        String agentToken = System.getenv("NEBULA_AGENT_TOKEN");
        if (agentToken != null && !agentToken.isBlank()) {
            config.defaultAgentToken = agentToken;
        }

        String ollama = System.getenv("OLLAMA_URL");
        if (ollama != null && !ollama.isBlank()) {
            config.ollamaUrl = ollama;
        }

        String sd = System.getenv("SD_URL");
        if (sd != null && !sd.isBlank()) {
            config.stableDiffusionUrl = sd;
        }

        String comfy = System.getenv("COMFYUI_URL");
        if (comfy != null && !comfy.isBlank()) {
            config.comfyUiUrl = comfy;
        }

        String model = System.getenv("ORCH_CODE_MODEL");
        if (model != null && !model.isBlank()) {
            config.codeAssistantModel = model;
        }

        String project = System.getenv("ORCH_PROJECT_PATH");
        if (project != null && !project.isBlank()) {
            config.projectPath = Path.of(project);
        }

        return config;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int defaultRetries() {
        return defaultRetries;
    }

    public Duration defaultJobTimeout() {
        return defaultJobTimeout;
    }

    public Duration jobRetention() {
        return jobRetention;
    }

    public Duration retentionSweepInterval() {
        return retentionSweepInterval;
    }

    public Path nodesFile() {
        return nodesFile;
    }

    public Path sshKeyPath() {
        return sshKeyPath;
    }

    public String defaultAgentToken() {
        return defaultAgentToken;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public Duration sshTimeout() {
        return sshTimeout;
    }

    public Duration agentTimeout() {
        return agentTimeout;
    }

    public Duration wakeTimeout() {
        return wakeTimeout;
    }

    public Duration wakePollInterval() {
        return wakePollInterval;
    }

    public Duration resourceMonitorInterval() {
        return resourceMonitorInterval;
    }

    public String ollamaUrl() {
        return ollamaUrl;
    }

    public String stableDiffusionUrl() {
        return stableDiffusionUrl;
    }

    public String comfyUiUrl() {
        return comfyUiUrl;
    }

    public String codeAssistantModel() {
        return codeAssistantModel;
    }

    public Duration codeAssistantTimeout() {
        return codeAssistantTimeout;
    }

    public Path projectPath() {
        return projectPath;
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public OrchestratorConfig withMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
        return this;
    }

    public OrchestratorConfig withDefaultRetries(int retries) {
        this.defaultRetries = retries;
        return this;
    }

    public OrchestratorConfig withJobRetention(Duration retention) {
        this.jobRetention = retention;
        return this;
    }

    public OrchestratorConfig withRetentionSweepInterval(Duration interval) {
        this.retentionSweepInterval = interval;
        return this;
    }

    public OrchestratorConfig withNodesFile(Path path) {
        this.nodesFile = path;
        return this;
    }

    public OrchestratorConfig withSshKeyPath(Path path) {
        this.sshKeyPath = path;
        return this;
    }

    public OrchestratorConfig withDefaultAgentToken(String token) {
        this.defaultAgentToken = token;
        return this;
    }

    public OrchestratorConfig withProbeTimeout(Duration timeout) {
        this.probeTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withWakeTimeout(Duration timeout) {
        this.wakeTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withWakePollInterval(Duration interval) {
        this.wakePollInterval = interval;
        return this;
    }

    public OrchestratorConfig withResourceMonitorInterval(Duration interval) {
        this.resourceMonitorInterval = interval;
        return this;
    }

    public OrchestratorConfig withOllamaUrl(String url) {
        this.ollamaUrl = url;
        return this;
    }

    public OrchestratorConfig withStableDiffusionUrl(String url) {
        this.stableDiffusionUrl = url;
        return this;
    }

    public OrchestratorConfig withComfyUiUrl(String url) {
        this.comfyUiUrl = url;
        return this;
    }

    public OrchestratorConfig withSshTimeout(Duration timeout) {
        this.sshTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withAgentTimeout(Duration timeout) {
        this.agentTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withProjectPath(Path path) {
        this.projectPath = path;
        return this;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "serverPort=" + serverPort +
                ", maxConcurrent=" + maxConcurrent +
                ", defaultRetries=" + defaultRetries +
                ", nodesFile=" + nodesFile +
                ", apiKeySet=" + hasApiKey() +
                ", agentTokenSet=" + (defaultAgentToken != null) +
                '}';
    }
}
