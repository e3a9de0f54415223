package homelab.orchestrator.assistant;

import java.util.List;
import java.util.Objects;

/**
 * One request to the code assistant.
 */
public record CodeTask(Type type, String prompt, List<String> files, OutputFormat outputFormat) {

    public enum Type {
        GENERATE, REFACTOR, FIX, EXPLAIN, REVIEW, DEPLOY;

        public static Type parse(String value) {
            if (value == null || value.isBlank()) {
                return GENERATE;
            }
            try {
                return valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown code task type: " + value);
            }
        }
    }

    public enum OutputFormat {
        TEXT, JSON, DIFF
    }

    public CodeTask {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(prompt, "prompt is required");
        files = files == null ? List.of() : List.copyOf(files);
        outputFormat = outputFormat == null ? OutputFormat.TEXT : outputFormat;
    }

    public static CodeTask of(Type type, String prompt) {
        return new CodeTask(type, prompt, List.of(), OutputFormat.TEXT);
    }
}
