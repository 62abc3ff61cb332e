package aiadmin.queue.service;

import aiadmin.queue.config.QueueConfig;
import aiadmin.queue.core.KeyedPendingQueue;
import aiadmin.queue.core.SequenceAllocator;
import aiadmin.queue.executor.ExecutorRegistry;
import aiadmin.queue.executor.TaskExecutor;
import aiadmin.queue.model.CancelResult;
import aiadmin.queue.model.QueueStats;
import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskFilter;
import aiadmin.queue.model.TaskKind;
import aiadmin.queue.model.TaskNotFoundException;
import aiadmin.queue.model.TaskState;
import aiadmin.queue.model.ValidationException;
import aiadmin.queue.repository.TaskRepository;
import aiadmin.queue.worker.WorkerPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service layer for the task queue.
 * Admission, status queries, cancellation and the operator controls
 * (pause/resume, stats, clearing finished tasks).
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // a task bouncing between PENDING and RUNNING while we cancel is retried this often
    private static final int CANCEL_RACE_ATTEMPTS = 5;

    /** Width of the task_key column */
    static final int MAX_KEY_LENGTH = 512;

    private final TaskRepository taskRepository;
    private final KeyedPendingQueue pendingQueue;
    private final ExecutorRegistry registry;
    private final SequenceAllocator sequence;
    private final WorkerPool workerPool;
    private final QueueConfig config;

    private volatile boolean acceptingTasks = true;

    public TaskService(TaskRepository taskRepository, KeyedPendingQueue pendingQueue, ExecutorRegistry registry,
            SequenceAllocator sequence, WorkerPool workerPool, QueueConfig config) {
        this.taskRepository = taskRepository;
        this.pendingQueue = pendingQueue;
        this.registry = registry;
        this.sequence = sequence;
        this.workerPool = workerPool;
        this.config = config;
    }

    /**
     * Admit a new task.
     *
     * @param kind   wire name of the task kind, e.g. {@code docker_push}
     * @param key    contention key; blank to let the executor derive it
     * @param params executor parameters
     * @return the new task ID
     * @throws ValidationException   on unknown kind, missing key or invalid parameters
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public String submit(String kind, String key, Map<String, Object> params) {
        if (kind == null || kind.isBlank()) {
            throw new ValidationException("kind is required");
        }
        TaskKind taskKind = TaskKind.parse(kind)
                .orElseThrow(() -> new ValidationException("unknown task kind: " + kind));
        return submit(taskKind, key, params);
    }

    public String submit(TaskKind kind, String key, Map<String, Object> params) {
        if (!acceptingTasks) {
            throw new IllegalStateException("task queue is shutting down");
        }
        if (kind == null) {
            throw new ValidationException("kind is required");
        }
        TaskExecutor executor = registry.lookup(kind)
                .orElseThrow(() -> new ValidationException("no executor registered for kind " + kind.wireName()));

        Map<String, Object> safeParams = params != null ? params : Map.of();
        executor.validate(kind, safeParams);

        String effectiveKey = key;
        if (effectiveKey == null || effectiveKey.isBlank()) {
            effectiveKey = executor.deriveKey(kind, safeParams);
            if (effectiveKey == null || effectiveKey.isBlank()) {
                throw new ValidationException("key is required for kind " + kind.wireName());
            }
        }
        validateKey(effectiveKey);

        String paramsJson;
        try {
            paramsJson = MAPPER.writeValueAsString(safeParams);
        } catch (JsonProcessingException e) {
            throw new ValidationException("params are not serializable: " + e.getOriginalMessage());
        }

        Task task = Task.builder()
                .id(generateTaskId())
                .kind(kind)
                .key(effectiveKey)
                .params(paramsJson)
                .seq(sequence.next())
                .maxAttempts(config.maxAttempts())
                .createdAt(Instant.now())
                .build();

        taskRepository.save(task);
        pendingQueue.enqueue(task.id(), task.key(), task.seq());

        log.info("Task {} submitted: {} key={}", task.id(), kind.wireName(), task.key());
        return task.id();
    }

    /**
     * Current snapshot of a task.
     *
     * @throws TaskNotFoundException if the ID is unknown or evicted
     */
    public Task status(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("taskId is required");
        }
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Tasks matching the filter, oldest first.
     */
    public List<Task> listStatus(TaskFilter filter) {
        return taskRepository.findAll(filter != null ? filter : TaskFilter.all());
    }

    /**
     * Cancel a task.
     * <p>
     * A PENDING task is cancelled immediately and never runs. A RUNNING task is flagged;
     * its worker abandons the attempt and records CANCELLED. Cancelling a finished task is
     * a no-op.
     *
     * @throws TaskNotFoundException if the ID is unknown
     */
    public CancelResult cancel(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("taskId is required");
        }

        for (int i = 0; i < CANCEL_RACE_ATTEMPTS; i++) {
            if (taskRepository.cancelIfPending(taskId, Instant.now())) {
                pendingQueue.remove(taskId);
                log.info("Task {} cancelled while pending", taskId);
                return CancelResult.CANCELLED;
            }
            if (taskRepository.requestCancel(taskId)) {
                log.info("Cancel requested for running task {}", taskId);
                return CancelResult.CANCEL_REQUESTED;
            }

            Task current = taskRepository.findById(taskId)
                    .orElseThrow(() -> new TaskNotFoundException(taskId));
            if (current.isTerminal()) {
                log.debug("Task {} already {} (idempotent cancel)", taskId, current.state());
                return CancelResult.ALREADY_TERMINAL;
            }
            // Went RUNNING -> PENDING (retry) or PENDING -> RUNNING between our updates
        }
        throw new IllegalStateException("Task " + taskId + " kept changing state during cancel");
    }

    /**
     * Counts per state plus worker utilisation.
     */
    public QueueStats stats() {
        Map<TaskState, Integer> counts = taskRepository.countByState();
        int pending = counts.getOrDefault(TaskState.PENDING, 0);
        int running = counts.getOrDefault(TaskState.RUNNING, 0);
        int succeeded = counts.getOrDefault(TaskState.SUCCEEDED, 0);
        int failed = counts.getOrDefault(TaskState.FAILED, 0);
        int cancelled = counts.getOrDefault(TaskState.CANCELLED, 0);
        return new QueueStats(
                pending + running + succeeded + failed + cancelled,
                pending, running, succeeded, failed, cancelled,
                config.concurrency(),
                workerPool.busyWorkers(),
                pendingQueue.isPaused());
    }

    /** Workers stop picking up new tasks; running tasks finish. */
    public void pause() {
        pendingQueue.pause();
        log.info("Queue paused");
    }

    public void resume() {
        pendingQueue.resume();
        log.info("Queue resumed");
    }

    public boolean isPaused() {
        return pendingQueue.isPaused();
    }

    /**
     * Delete every terminal task.
     *
     * @return number of tasks removed
     */
    public int clearFinished() {
        int cleared = taskRepository.deleteFinished();
        log.info("Cleared {} finished tasks", cleared);
        return cleared;
    }

    public int countPending() {
        return taskRepository.countByState().getOrDefault(TaskState.PENDING, 0);
    }

    public int countRunning() {
        return taskRepository.countByState().getOrDefault(TaskState.RUNNING, 0);
    }

    /**
     * Stop admitting tasks. Already queued tasks are left to the worker pool.
     */
    public void shutdown() {
        acceptingTasks = false;
        log.info("Task service no longer accepting tasks");
    }

    private static void validateKey(String key) {
        if (key.length() > MAX_KEY_LENGTH) {
            throw new ValidationException("key is longer than " + MAX_KEY_LENGTH + " characters");
        }
        if (key.chars().anyMatch(Character::isISOControl)) {
            throw new ValidationException("key must not contain control characters");
        }
    }

    private String generateTaskId() {
        return UUID.randomUUID().toString();
    }
}
