package aiadmin.queue.executor;

import aiadmin.queue.model.TaskKind;
import aiadmin.queue.model.ValidationException;

import java.util.Map;
import java.util.Set;

/**
 * Performs the external operation behind one or more task kinds.
 * <p>
 * Implementations must be thread-safe and must tolerate being abandoned: after a timeout
 * or a cancel the worker interrupts the attempt thread and stops waiting, and later calls
 * must still behave.
 */
public interface TaskExecutor {

    /** Kinds this executor handles */
    Set<TaskKind> kinds();

    /**
     * Check submission parameters.
     *
     * @throws ValidationException if the parameters are unusable
     */
    void validate(TaskKind kind, Map<String, Object> params);

    /**
     * Contention key for a submission that did not supply one, or null if none can be
     * derived.
     */
    default String deriveKey(TaskKind kind, Map<String, Object> params) {
        return null;
    }

    /**
     * Run one attempt. May return a failure outcome or throw
     * {@link RetryableExecutionException} / {@link FatalExecutionException}.
     */
    ExecutionOutcome execute(TaskKind kind, Map<String, Object> params, ExecutionContext ctx) throws Exception;
}
