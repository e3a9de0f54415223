package homelab.orchestrator.wake;

import homelab.orchestrator.model.ExecutionErrorKind;

/**
 * Outcome of a wake attempt.
 *
 * @param online      the target answered the reachability poll
 * @param failureKind why the attempt failed, null on success
 */
public record WakeResponse(
        boolean success,
        boolean online,
        String message,
        String error,
        ExecutionErrorKind failureKind) {

    public static WakeResponse online(String message) {
        return new WakeResponse(true, true, message, null, null);
    }

    public static WakeResponse failed(ExecutionErrorKind kind, String error) {
        return new WakeResponse(false, false, null, error, kind);
    }
}
