package homelab.orchestrator.assistant;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CodeGenerationResult(boolean success, String output, List<String> changes, String error) {

    public static CodeGenerationResult ok(String output, List<String> changes) {
        return new CodeGenerationResult(true, output, List.copyOf(changes), null);
    }

    public static CodeGenerationResult failed(String error) {
        return new CodeGenerationResult(false, "", List.of(), error);
    }
}
