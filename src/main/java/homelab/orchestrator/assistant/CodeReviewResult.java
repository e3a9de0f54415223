package homelab.orchestrator.assistant;

import java.util.List;

public record CodeReviewResult(List<Issue> issues, List<String> suggestions) {

    /** Severity is one of error, warning, info. */
    public record Issue(String file, int line, String message, String severity) {
    }

    public CodeReviewResult {
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
    }
}
