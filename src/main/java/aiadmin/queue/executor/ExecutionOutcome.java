package aiadmin.queue.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What one executor attempt produced.
 *
 * @param type   success or failure class
 * @param result operation output, success only
 * @param reason failure detail, failures only
 */
public record ExecutionOutcome(Type type, Map<String, Object> result, String reason) {

    public enum Type {
        SUCCESS,
        RETRYABLE_FAILURE,
        FATAL_FAILURE
    }

    public ExecutionOutcome {
        Objects.requireNonNull(type, "type is required");
        // null values are allowed (e.g. a digest the registry did not report)
        result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : Map.of();
    }

    public static ExecutionOutcome success(Map<String, Object> result) {
        return new ExecutionOutcome(Type.SUCCESS, result, null);
    }

    public static ExecutionOutcome retryable(String reason) {
        return new ExecutionOutcome(Type.RETRYABLE_FAILURE, null, reason);
    }

    public static ExecutionOutcome fatal(String reason) {
        return new ExecutionOutcome(Type.FATAL_FAILURE, null, reason);
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isRetryable() {
        return type == Type.RETRYABLE_FAILURE;
    }
}
