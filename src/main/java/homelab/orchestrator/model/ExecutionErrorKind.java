package homelab.orchestrator.model;

/**
 * Classification of a failed {@link NodeExecutionResult}.
 */
public enum ExecutionErrorKind {
    /** Unknown node id */
    NOT_FOUND,
    /** Node is not online and the action is not a wake */
    NODE_UNAVAILABLE,
    /** Missing key material, hardware address or agent token; not retryable as-is */
    CONFIGURATION,
    /** Connection refused, unreachable host, protocol error */
    TRANSPORT,
    /** Transport deadline exceeded */
    TIMEOUT,
    /** Remote side answered with a failure (non-zero exit, non-2xx status) */
    REMOTE_FAILURE,
    /** No node or resource offers the requested capability */
    NO_CAPACITY,
    /** Wake signal sent but the node did not come online in time; caller may retry */
    WAKE_TIMEOUT,
    /** The wake relay could not send the signal */
    RELAY_FAILURE
}
