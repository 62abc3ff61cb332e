package aiadmin.queue.executor;

import aiadmin.queue.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each task kind to the executor that runs it.
 */
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private final Map<TaskKind, TaskExecutor> executors = new EnumMap<>(TaskKind.class);

    /**
     * Register an executor for all of its kinds. A later registration replaces an earlier
     * one for the same kind.
     */
    public synchronized ExecutorRegistry register(TaskExecutor executor) {
        for (TaskKind kind : executor.kinds()) {
            TaskExecutor previous = executors.put(kind, executor);
            if (previous != null && previous != executor) {
                log.warn("Executor for {} replaced: {} -> {}", kind,
                        previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
            }
        }
        log.debug("Registered executor {} for {}", executor.getClass().getSimpleName(), executor.kinds());
        return this;
    }

    public synchronized Optional<TaskExecutor> lookup(TaskKind kind) {
        return Optional.ofNullable(executors.get(kind));
    }

    public synchronized Set<TaskKind> registeredKinds() {
        return Set.copyOf(executors.keySet());
    }
}
