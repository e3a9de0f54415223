package homelab.orchestrator.execution;

/**
 * Where and as whom to open a remote shell.
 */
public record ShellTarget(String host, int port, String user) {

    @Override
    public String toString() {
        return user + "@" + host + ":" + port;
    }
}
