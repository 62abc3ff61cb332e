package aiadmin.queue.worker;

import aiadmin.queue.executor.ExecutionContext;
import aiadmin.queue.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Execution context backed by the task store: cancel checks and progress reports go
 * straight to the task row.
 */
final class DefaultExecutionContext implements ExecutionContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultExecutionContext.class);

    private final TaskRepository taskRepository;
    private final String taskId;
    private final int attempt;
    private final Instant deadline;

    DefaultExecutionContext(TaskRepository taskRepository, String taskId, int attempt, Instant deadline) {
        this.taskRepository = taskRepository;
        this.taskId = taskId;
        this.attempt = attempt;
        this.deadline = deadline;
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public Instant deadline() {
        return deadline;
    }

    @Override
    public boolean isCancelRequested() {
        return taskRepository.isCancelRequested(taskId);
    }

    @Override
    public void reportProgress(int percent, String step) {
        int clamped = Math.max(0, Math.min(100, percent));
        try {
            taskRepository.updateProgress(taskId, clamped, step);
        } catch (RuntimeException e) {
            // Progress is advisory; a failed write must not fail the attempt
            log.warn("Failed to record progress for task {}: {}", taskId, e.getMessage());
        }
    }
}
