package homelab.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Uniform envelope returned by every node operation, whatever the transport.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeExecutionResult(
        boolean success,
        String nodeId,
        String action,
        String output,
        String error,
        ExecutionErrorKind errorKind,
        long executionTimeMs,
        Instant timestamp) {

    public static NodeExecutionResult ok(String nodeId, NodeAction action, String output, long elapsedMs) {
        return new NodeExecutionResult(true, nodeId, action.wireName(), output, null, null, elapsedMs,
                Instant.now());
    }

    public static NodeExecutionResult failure(String nodeId, NodeAction action, ExecutionErrorKind kind,
            String error, long elapsedMs) {
        return new NodeExecutionResult(false, nodeId, action.wireName(), null, error, kind, elapsedMs,
                Instant.now());
    }
}
