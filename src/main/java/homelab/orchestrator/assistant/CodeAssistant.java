package homelab.orchestrator.assistant;

import java.util.List;

/**
 * Local code-generation backend used by the orchestrator's code workflows.
 */
public interface CodeAssistant {

    /**
     * Run a single task. Failures are reported in the result, never thrown.
     */
    CodeGenerationResult execute(CodeTask task);

    FeatureDevelopmentResult developFeature(String specification) throws CodeAssistantException;

    /**
     * @param files paths whose contents are attached to the prompt; unreadable files are skipped
     */
    BugFixResult fixBugs(String description, List<String> files) throws CodeAssistantException;

    CodeReviewResult reviewCode(List<String> files) throws CodeAssistantException;

    /** Whether the backend is reachable and usable right now */
    boolean checkInstallation();
}
