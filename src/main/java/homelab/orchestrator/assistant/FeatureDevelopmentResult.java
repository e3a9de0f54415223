package homelab.orchestrator.assistant;

import java.util.List;

/**
 * Files and shell commands proposed for a feature. {@code tests} lists the
 * paths among {@code files} that look like test files.
 */
public record FeatureDevelopmentResult(List<GeneratedFile> files, List<String> commands, List<String> tests) {

    public record GeneratedFile(String path, String content) {
    }

    public FeatureDevelopmentResult {
        files = List.copyOf(files);
        commands = List.copyOf(commands);
        tests = List.copyOf(tests);
    }
}
