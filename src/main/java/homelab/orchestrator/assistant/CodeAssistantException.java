package homelab.orchestrator.assistant;

/**
 * A code assistant workflow could not produce a result.
 */
public class CodeAssistantException extends Exception {

    public CodeAssistantException(String message) {
        super(message);
    }

    public CodeAssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
