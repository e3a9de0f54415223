package homelab.orchestrator.assistant;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structure from free-form model output: file blocks, shell commands,
 * unified diffs, review issues and suggestions.
 */
public final class CodeOutputParser {

    private static final String CODE_EXT = "ts|tsx|js|jsx|py|java|json|yaml|yml";

    private static final Pattern FILE_BLOCK = Pattern.compile(
            "```(?:typescript|javascript|python|java|tsx|jsx|ts|js|py)?[ \\t]*\\n"
                    + "(?://\\s*(?:File:\\s*)?(\\S+\\.(?:" + CODE_EXT + "))|#\\s*(?:File:\\s*)?(\\S+\\.py))[ \\t]*\\n"
                    + "([\\s\\S]*?)```",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SHELL_BLOCK = Pattern.compile(
            "```(?:bash|sh|shell)[ \\t]*\\n([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROMPT_LINE = Pattern.compile("^\\$\\s+(.+)$", Pattern.MULTILINE);

    private static final Pattern DIFF_GIT = Pattern.compile("^diff\\s+--git\\s+a/(\\S+)\\s+b/\\S+");
    private static final Pattern DIFF_OLD = Pattern.compile("^---\\s*a/(\\S+)");

    private static final Pattern ISSUE = Pattern.compile(
            "\\[(ERROR|WARNING|INFO)\\]\\s*(.+):(\\d+)\\s*[-–]\\s*(.+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SUGGESTION = Pattern.compile(
            "(?:Suggestion|Recommend|Consider|Improvement):\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUGGESTIONS_HEADING = Pattern.compile("^#+\\s*Suggestions?.*", Pattern.CASE_INSENSITIVE);
    private static final Pattern BULLET = Pattern.compile("^[-*]\\s+(.+)");

    private static final String CHANGE_EXT = CODE_EXT + "|md";
    private static final List<Pattern> CHANGE_PATTERNS = List.of(
            Pattern.compile("```\\w*[ \\t]*\\n//\\s*(\\S+\\.(?:" + CHANGE_EXT + "))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("File:\\s*(\\S+\\.(?:" + CHANGE_EXT + "))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Create\\s+(?:file\\s+)?(\\S+\\.(?:" + CHANGE_EXT + "))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Modify\\s+(?:file\\s+)?(\\S+\\.(?:" + CHANGE_EXT + "))", Pattern.CASE_INSENSITIVE));

    private CodeOutputParser() {
    }

    /** Fenced code blocks whose first line names the file in a comment. */
    public static List<FeatureDevelopmentResult.GeneratedFile> files(String output) {
        List<FeatureDevelopmentResult.GeneratedFile> files = new ArrayList<>();
        Matcher m = FILE_BLOCK.matcher(output);
        while (m.find()) {
            String path = m.group(1) != null ? m.group(1) : m.group(2);
            String content = m.group(3).trim();
            if (path != null && !content.isEmpty()) {
                files.add(new FeatureDevelopmentResult.GeneratedFile(path.trim(), content));
            }
        }
        return files;
    }

    /** Lines of shell blocks and {@code $ }-prefixed lines, deduplicated, comments skipped. */
    public static List<String> commands(String output) {
        Set<String> commands = new LinkedHashSet<>();
        Matcher block = SHELL_BLOCK.matcher(output);
        while (block.find()) {
            for (String line : block.group(1).split("\n")) {
                String cmd = line.trim();
                if (cmd.startsWith("$ ")) {
                    cmd = cmd.substring(2).trim();
                }
                if (!cmd.isEmpty() && !cmd.startsWith("#")) {
                    commands.add(cmd);
                }
            }
        }
        Matcher prompt = PROMPT_LINE.matcher(output);
        while (prompt.find()) {
            commands.add(prompt.group(1).trim());
        }
        return new ArrayList<>(commands);
    }

    /**
     * Unified diffs, one per file. A section starts at {@code diff --git a/x b/x} or
     * {@code --- a/x}; the {@code ---} line right after a git header belongs to it.
     */
    public static List<BugFixResult.FileFix> diffs(String output) {
        List<BugFixResult.FileFix> fixes = new ArrayList<>();
        String file = null;
        StringBuilder body = new StringBuilder();
        boolean afterGitHeader = false;

        for (String line : output.split("\n", -1)) {
            Matcher git = DIFF_GIT.matcher(line);
            Matcher old = DIFF_OLD.matcher(line);
            if (git.find()) {
                addFix(fixes, file, body);
                file = git.group(1);
                body.setLength(0);
                afterGitHeader = true;
                continue;
            }
            if (old.find() && !afterGitHeader) {
                addFix(fixes, file, body);
                file = old.group(1);
                body.setLength(0);
                continue;
            }
            if (line.startsWith("+++") || line.startsWith("@@")) {
                afterGitHeader = false;
            }
            if (line.startsWith("```")) {
                continue;
            }
            if (file != null) {
                body.append(line).append('\n');
            }
        }
        addFix(fixes, file, body);
        return fixes;
    }

    private static void addFix(List<BugFixResult.FileFix> fixes, String file, StringBuilder body) {
        if (file != null && !body.toString().isBlank()) {
            fixes.add(new BugFixResult.FileFix(file.trim(), body.toString().trim()));
        }
    }

    /** Lines shaped like {@code [SEVERITY] file:line - message}. */
    public static List<CodeReviewResult.Issue> issues(String output) {
        List<CodeReviewResult.Issue> issues = new ArrayList<>();
        Matcher m = ISSUE.matcher(output);
        while (m.find()) {
            issues.add(new CodeReviewResult.Issue(
                    m.group(2).trim(),
                    Integer.parseInt(m.group(3)),
                    m.group(4).trim(),
                    m.group(1).toLowerCase()));
        }
        return issues;
    }

    /** Inline {@code Suggestion:} style lines plus the bullets of a Suggestions section. */
    public static List<String> suggestions(String output) {
        List<String> suggestions = new ArrayList<>();
        Matcher m = SUGGESTION.matcher(output);
        while (m.find()) {
            suggestions.add(m.group(1).trim());
        }

        boolean inSection = false;
        for (String line : output.split("\n")) {
            if (SUGGESTIONS_HEADING.matcher(line).matches()) {
                inSection = true;
                continue;
            }
            if (!inSection) {
                continue;
            }
            if (line.startsWith("#")) {
                inSection = false;
                continue;
            }
            Matcher bullet = BULLET.matcher(line);
            if (bullet.find()) {
                suggestions.add(bullet.group(1).trim());
            }
        }
        return suggestions;
    }

    /** File paths the output claims to create or modify. */
    public static List<String> changes(String output) {
        Set<String> changes = new LinkedHashSet<>();
        for (Pattern pattern : CHANGE_PATTERNS) {
            Matcher m = pattern.matcher(output);
            while (m.find()) {
                changes.add(m.group(1));
            }
        }
        return new ArrayList<>(changes);
    }
}
