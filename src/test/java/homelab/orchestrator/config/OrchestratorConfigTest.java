package homelab.orchestrator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    @Test
    void defaults() {
        OrchestratorConfig config = OrchestratorConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertEquals(5, config.maxConcurrent());
        assertEquals(2, config.defaultRetries());
        assertEquals(Duration.ofMinutes(2), config.defaultJobTimeout());
        assertEquals(Duration.ofMinutes(3), config.wakeTimeout());
        assertFalse(config.hasApiKey());
    }

    @Test
    void toStringHidesSecrets() {
        OrchestratorConfig config = OrchestratorConfig.defaults()
                .withApiKey("api-secret")
                .withDefaultAgentToken("agent-secret");

        String text = config.toString();

        assertTrue(config.hasApiKey());
        assertTrue(text.contains("apiKeySet=true"));
        assertFalse(text.contains("api-secret"));
        assertFalse(text.contains("agent-secret"));
    }

    @Test
    void firstSetCredentialWins() {
        Map<String, String> env = Map.of("REPLICATE_API_KEY", "r8", "OPENAI_API_KEY", "sk");
        CredentialSource credentials = name -> Optional.ofNullable(env.get(name));

        assertEquals(Optional.of("r8"), credentials.first("REPLICATE_API_TOKEN", "REPLICATE_API_KEY"));
        assertEquals(Optional.empty(), credentials.first("ANTHROPIC_API_KEY"));
    }
}
