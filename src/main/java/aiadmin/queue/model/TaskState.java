package aiadmin.queue.model;

/**
 * Task execution state.
 */
public enum TaskState {
    /** Task queued, waiting for a worker and a free key */
    PENDING,
    /** Task picked up by a worker, an attempt is in flight */
    RUNNING,
    /** Executor reported success */
    SUCCEEDED,
    /** Executor reported a fatal failure, or retries are exhausted */
    FAILED,
    /** Task cancelled by user */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
