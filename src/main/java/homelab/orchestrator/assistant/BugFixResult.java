package homelab.orchestrator.assistant;

import java.util.List;

public record BugFixResult(List<FileFix> fixes) {

    /** Unified diff for one file */
    public record FileFix(String file, String diff) {
    }

    public BugFixResult {
        fixes = List.copyOf(fixes);
    }
}
