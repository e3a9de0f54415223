package homelab.orchestrator.execution;

import java.time.Duration;

/**
 * Runs one command on a POSIX host over a remote shell session.
 */
public interface ShellTransport {

    /**
     * @param timeout deadline covering connect and execution
     * @throws TransportException if the session could not be established or the deadline passed
     */
    ShellResult exec(ShellTarget target, byte[] privateKey, String command, Duration timeout)
            throws TransportException;
}
