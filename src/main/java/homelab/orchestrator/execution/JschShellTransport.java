package homelab.orchestrator.execution;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * SSH transport on JSch with key authentication. One session per command.
 */
public class JschShellTransport implements ShellTransport {

    private static final Logger log = LoggerFactory.getLogger(JschShellTransport.class);
    private static final long POLL_MS = 50;

    @Override
    public ShellResult exec(ShellTarget target, byte[] privateKey, String command, Duration timeout)
            throws TransportException {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        int timeoutMs = (int) timeout.toMillis();
        Session session = null;
        ChannelExec channel = null;
        try {
            JSch jsch = new JSch();
            jsch.addIdentity("homelab", privateKey, null, null);

            session = jsch.getSession(target.user(), target.host(), target.port());
            session.setConfig("StrictHostKeyChecking", "no");
            session.connect(timeoutMs);

            ByteArrayOutputStream stdout = new ByteArrayOutputStream();
            ByteArrayOutputStream stderr = new ByteArrayOutputStream();
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setOutputStream(stdout);
            channel.setErrStream(stderr);
            channel.connect(remaining(deadline));

            while (!channel.isClosed()) {
                if (System.currentTimeMillis() >= deadline) {
                    throw TransportException.timeout("Connection timeout");
                }
                Thread.sleep(POLL_MS);
            }

            int exit = channel.getExitStatus();
            log.debug("{} exited {} for: {}", target, exit, command);
            return new ShellResult(exit,
                    stdout.toString(StandardCharsets.UTF_8).trim(),
                    stderr.toString(StandardCharsets.UTF_8).trim());

        } catch (JSchException e) {
            if (isTimeout(e)) {
                throw TransportException.timeout("Connection timeout");
            }
            throw TransportException.unreachable(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.unreachable("interrupted while running command on " + target, e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
            if (session != null) {
                session.disconnect();
            }
        }
    }

    private static int remaining(long deadline) throws TransportException {
        long left = deadline - System.currentTimeMillis();
        if (left <= 0) {
            throw TransportException.timeout("Connection timeout");
        }
        return (int) left;
    }

    private static boolean isTimeout(JSchException e) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.toLowerCase().contains("timeout");
    }
}
