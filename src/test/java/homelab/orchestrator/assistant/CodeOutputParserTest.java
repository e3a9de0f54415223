package homelab.orchestrator.assistant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeOutputParserTest {

    @Test
    @DisplayName("File blocks are recognised by a path comment on their first line")
    void files() {
        String output = """
                Here is the feature.

                ```typescript
                // src/components/Toggle.tsx
                export const Toggle = () => null;
                ```

                ```python
                # scripts/seed.py
                print("seed")
                ```

                ```ts
                const notAFile = 1;
                ```
                """;

        List<FeatureDevelopmentResult.GeneratedFile> files = CodeOutputParser.files(output);

        assertEquals(2, files.size());
        assertEquals("src/components/Toggle.tsx", files.get(0).path());
        assertEquals("export const Toggle = () => null;", files.get(0).content());
        assertEquals("scripts/seed.py", files.get(1).path());
    }

    @Test
    void commands() {
        String output = """
                ```bash
                # install
                npm install zod
                $ npm test
                npm install zod
                ```
                Then run:
                $ docker compose up -d
                """;

        assertEquals(List.of("npm install zod", "npm test", "docker compose up -d"),
                CodeOutputParser.commands(output));
    }

    @Test
    @DisplayName("Diffs are split per file, with or without git headers")
    void diffs() {
        String output = """
                The fix:
                ```diff
                diff --git a/src/auth.ts b/src/auth.ts
                --- a/src/auth.ts
                +++ b/src/auth.ts
                @@ -1,3 +1,3 @@
                -if (password) {
                +if (password && password.length > 0) {
                ```
                ```diff
                --- a/src/login.ts
                +++ b/src/login.ts
                @@ -10 +10 @@
                -return null;
                +return user;
                ```
                """;

        List<BugFixResult.FileFix> fixes = CodeOutputParser.diffs(output);

        assertEquals(2, fixes.size());
        assertEquals("src/auth.ts", fixes.get(0).file());
        assertTrue(fixes.get(0).diff().startsWith("--- a/src/auth.ts"));
        assertTrue(fixes.get(0).diff().contains("+if (password && password.length > 0) {"));
        assertFalse(fixes.get(0).diff().contains("```"));
        assertEquals("src/login.ts", fixes.get(1).file());
        assertTrue(fixes.get(1).diff().endsWith("+return user;"));
    }

    @Test
    void noDiffs() {
        assertTrue(CodeOutputParser.diffs("I could not find the bug.").isEmpty());
    }

    @Test
    void reviewIssuesAndSuggestions() {
        String output = """
                [ERROR] src/db.ts:42 - SQL built by string concatenation
                [warning] src/app.ts:7 – unused import
                Consider: extracting the retry loop

                ## Suggestions
                - Add integration tests
                * Enable strict mode

                ## Summary
                - not a suggestion
                """;

        List<CodeReviewResult.Issue> issues = CodeOutputParser.issues(output);
        assertEquals(2, issues.size());
        assertEquals(new CodeReviewResult.Issue("src/db.ts", 42, "SQL built by string concatenation", "error"),
                issues.get(0));
        assertEquals("warning", issues.get(1).severity());
        assertEquals(7, issues.get(1).line());

        assertEquals(List.of("extracting the retry loop", "Add integration tests", "Enable strict mode"),
                CodeOutputParser.suggestions(output));
    }

    @Test
    void changes() {
        String output = """
                File: src/index.ts
                Create src/routes/health.ts and Modify file README.md
                ```ts
                // src/index.ts
                ```
                """;

        assertEquals(List.of("src/index.ts", "src/routes/health.ts", "README.md"), CodeOutputParser.changes(output));
    }
}
