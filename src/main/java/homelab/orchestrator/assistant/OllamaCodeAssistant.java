package homelab.orchestrator.assistant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import homelab.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Code assistant backed by an Ollama chat model on the local network.
 *
 * File paths handed to {@link #fixBugs} and {@link #reviewCode} are resolved
 * against the configured project path.
 */
public class OllamaCodeAssistant implements CodeAssistant {

    private static final Logger log = LoggerFactory.getLogger(OllamaCodeAssistant.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String BASE_PROMPT = "You are an expert software developer and code architect. "
            + "You write clean, maintainable, well-documented code following best practices.";

    private final OrchestratorConfig config;
    private final HttpClient http;

    public OllamaCodeAssistant(OrchestratorConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.probeTimeout()).build());
    }

    public OllamaCodeAssistant(OrchestratorConfig config, HttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public CodeGenerationResult execute(CodeTask task) {
        long start = System.currentTimeMillis();
        try {
            String output = chat(systemPrompt(task.type()), userPrompt(task));
            log.debug("{} task finished in {}ms", task.type(), System.currentTimeMillis() - start);
            return CodeGenerationResult.ok(output, CodeOutputParser.changes(output));
        } catch (IOException e) {
            log.warn("{} task failed: {}", task.type(), e.getMessage());
            return CodeGenerationResult.failed(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CodeGenerationResult.failed("interrupted");
        }
    }

    @Override
    public FeatureDevelopmentResult developFeature(String specification) throws CodeAssistantException {
        String prompt = "Develop the following feature:\n\n" + specification + "\n\n"
                + "Provide:\n"
                + "1. All files needed with complete code (include file paths as comments)\n"
                + "2. Any shell commands needed\n"
                + "3. Test files if applicable\n\n"
                + "Structure your response clearly with file paths and complete code.";

        String output = run(new CodeTask(CodeTask.Type.GENERATE, prompt, List.of(), CodeTask.OutputFormat.TEXT),
                "Feature development failed");

        List<FeatureDevelopmentResult.GeneratedFile> files = CodeOutputParser.files(output);
        List<String> tests = files.stream()
                .map(FeatureDevelopmentResult.GeneratedFile::path)
                .filter(OllamaCodeAssistant::isTestPath)
                .toList();
        return new FeatureDevelopmentResult(files, CodeOutputParser.commands(output), tests);
    }

    @Override
    public BugFixResult fixBugs(String description, List<String> files) throws CodeAssistantException {
        StringBuilder prompt = new StringBuilder("Fix the following bug:\n\n").append(description);
        String contents = readFiles(files);
        if (!contents.isEmpty()) {
            prompt.append("\n\nRelevant files:").append(contents);
        }
        prompt.append("\n\nProvide the fix as a unified diff format for each file that needs changes.");

        String output = run(new CodeTask(CodeTask.Type.FIX, prompt.toString(), files, CodeTask.OutputFormat.DIFF),
                "Bug fix failed");
        return new BugFixResult(CodeOutputParser.diffs(output));
    }

    @Override
    public CodeReviewResult reviewCode(List<String> files) throws CodeAssistantException {
        String prompt = "Review the following code files for issues, bugs, security vulnerabilities, and improvements:\n"
                + readFiles(files)
                + "\n\nProvide a structured review with:\n"
                + "1. Issues found (file, line number, message, severity: error/warning/info)\n"
                + "2. General suggestions for improvement\n\n"
                + "Format issues as: [SEVERITY] file:line - message";

        String output = run(new CodeTask(CodeTask.Type.REVIEW, prompt, files, CodeTask.OutputFormat.TEXT),
                "Code review failed");
        return new CodeReviewResult(CodeOutputParser.issues(output), CodeOutputParser.suggestions(output));
    }

    @Override
    public boolean checkInstallation() {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(config.ollamaUrl() + "/api/tags"))
                    .timeout(Duration.ofSeconds(3))
                    .GET()
                    .build();
            HttpResponse<Void> response = http.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() / 100 == 2;
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Code assistant backend not reachable: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String run(CodeTask task, String failure) throws CodeAssistantException {
        CodeGenerationResult result = execute(task);
        if (!result.success()) {
            throw new CodeAssistantException(result.error() != null ? result.error() : failure);
        }
        return result.output();
    }

    private String chat(String system, String user) throws IOException, InterruptedException {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", config.codeAssistantModel());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", system);
        messages.addObject().put("role", "user").put("content", user);
        body.put("stream", false);
        body.putObject("options").put("temperature", 0.3).put("num_predict", 4096);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(config.ollamaUrl() + "/api/chat"))
                    .timeout(config.codeAssistantTimeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid ollama url: " + config.ollamaUrl(), e);
        }

        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Ollama request failed: " + response.statusCode());
        }
        JsonNode content = MAPPER.readTree(response.body()).path("message").path("content");
        return content.isMissingNode() || content.isNull() ? "" : content.asText();
    }

    private String readFiles(List<String> files) {
        if (files == null || files.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String file : files) {
            Path path = config.projectPath().resolve(file);
            try {
                sb.append("\n--- File: ").append(file).append(" ---\n")
                        .append(Files.readString(path, StandardCharsets.UTF_8)).append('\n');
            } catch (IOException e) {
                log.warn("Could not read file {}: {}", path, e.getMessage());
            }
        }
        return sb.toString();
    }

    static String systemPrompt(CodeTask.Type type) {
        return switch (type) {
            case GENERATE -> BASE_PROMPT + " Generate complete, production-ready code based on the requirements."
                    + " Include proper error handling, types, and documentation.";
            case REFACTOR -> BASE_PROMPT + " Refactor the provided code to improve quality, readability, and"
                    + " maintainability while preserving functionality.";
            case FIX -> BASE_PROMPT + " Analyze and fix bugs in the provided code."
                    + " Explain what was wrong and how you fixed it.";
            case EXPLAIN -> BASE_PROMPT + " Provide a clear, detailed explanation of the code."
                    + " Break down complex logic and explain design decisions.";
            case REVIEW -> BASE_PROMPT + " Review the code for bugs, security issues, performance problems,"
                    + " and style issues. Provide actionable feedback.";
            case DEPLOY -> BASE_PROMPT + " Prepare the code for deployment."
                    + " Check for production readiness and suggest deployment steps.";
        };
    }

    static String userPrompt(CodeTask task) {
        StringBuilder prompt = new StringBuilder(task.prompt());
        if (!task.files().isEmpty()) {
            prompt.append("\n\nFiles to work with:\n").append(String.join("\n", task.files()));
        }
        switch (task.outputFormat()) {
            case JSON -> prompt.append("\n\nRespond in JSON format.");
            case DIFF -> prompt.append("\n\nProvide changes in unified diff format.");
            case TEXT -> {
            }
        }
        return prompt.toString();
    }

    private static boolean isTestPath(String path) {
        return path.contains(".test.") || path.contains(".spec.") || path.endsWith("Test.java");
    }
}
