package homelab.orchestrator.execution;

/**
 * Outcome of a remote shell command that ran to completion.
 */
public record ShellResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /** stderr, else stdout, else the exit code */
    public String failureMessage() {
        if (stderr != null && !stderr.isBlank()) {
            return stderr.trim();
        }
        if (stdout != null && !stdout.isBlank()) {
            return stdout.trim();
        }
        return "Exit code " + exitCode;
    }
}
