package homelab.orchestrator.execution;

import homelab.orchestrator.model.ExecutionErrorKind;

/**
 * The remote side could not be reached or did not answer in time.
 * Transports never retry; the kind is either TRANSPORT or TIMEOUT.
 */
public class TransportException extends Exception {

    private final ExecutionErrorKind kind;

    public TransportException(ExecutionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TransportException timeout(String message) {
        return new TransportException(ExecutionErrorKind.TIMEOUT, message, null);
    }

    public static TransportException unreachable(String message, Throwable cause) {
        return new TransportException(ExecutionErrorKind.TRANSPORT, message, cause);
    }

    public ExecutionErrorKind kind() {
        return kind;
    }
}
