package aiadmin.queue.repository;

import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskFilter;
import aiadmin.queue.model.TaskState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * <p>
 * Every transition method is conditional on the current state and returns whether the row
 * actually moved, so racing callers (a worker and a cancel request) resolve to exactly one
 * winner.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * List tasks matching the filter, ordered by creation time (ties by sequence).
     *
     * @param filter state/key filter, null fields match all
     * @return point-in-time copy of the matching tasks
     */
    List<Task> findAll(TaskFilter filter);

    /**
     * Find tasks in a state, ordered by queue sequence.
     *
     * @param state the state to filter by
     * @return list of tasks
     */
    List<Task> findByState(TaskState state);

    /**
     * Count tasks per state. States with no tasks map to zero.
     */
    Map<TaskState, Integer> countByState();

    /**
     * Count RUNNING tasks holding the given key.
     */
    int countRunningByKey(String key);

    /**
     * Highest queue sequence ever stored, or 0.
     */
    long maxSeq();

    /**
     * Move a PENDING task to RUNNING and count the attempt.
     * Refuses when another task with the same key is already RUNNING.
     *
     * @param taskId    the task ID
     * @param startedAt attempt start time
     * @return true if the task is now RUNNING
     */
    boolean markRunning(String taskId, Instant startedAt);

    /**
     * Complete a RUNNING task successfully.
     *
     * @return true if updated
     */
    boolean markSucceeded(String taskId, String result, Instant finishedAt);

    /**
     * Mark a RUNNING task as permanently failed.
     *
     * @param errorMessage the last error
     * @param result       error detail JSON exposed as the task result
     * @return true if updated
     */
    boolean markFailed(String taskId, String errorMessage, String result, Instant finishedAt);

    /**
     * Return a RUNNING task to PENDING at the given tail sequence for another attempt.
     * Refuses once a cancel has been requested.
     *
     * @return true if updated
     */
    boolean requeueForRetry(String taskId, long seq, String errorMessage);

    /**
     * Move a PENDING task straight to CANCELLED.
     *
     * @return true if the task was pending and is now cancelled
     */
    boolean cancelIfPending(String taskId, Instant finishedAt);

    /**
     * Set the cancel flag on a RUNNING task.
     *
     * @return true if the task is running and the flag is set
     */
    boolean requestCancel(String taskId);

    /**
     * Move a RUNNING task to CANCELLED after the worker observed the cancel flag.
     *
     * @return true if updated
     */
    boolean markCancelled(String taskId, Instant finishedAt);

    /**
     * Read the cancel flag of a task; false when the task does not exist.
     */
    boolean isCancelRequested(String taskId);

    /**
     * Record executor-reported progress on a RUNNING task.
     */
    void updateProgress(String taskId, int progress, String step);

    /**
     * Recover a RUNNING task left behind by a previous process: PENDING at the given
     * sequence, attempt count kept.
     *
     * @return true if updated
     */
    boolean resetToPending(String taskId, long seq);

    /**
     * Delete terminal tasks finished before the cutoff.
     *
     * @return number of tasks deleted
     */
    int deleteFinishedBefore(Instant cutoff);

    /**
     * Delete all terminal tasks.
     *
     * @return number of tasks deleted
     */
    int deleteFinished();
}
