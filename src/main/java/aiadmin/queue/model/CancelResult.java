package aiadmin.queue.model;

/**
 * Result of a cancel request.
 */
public enum CancelResult {
    /** Task was pending and is now CANCELLED; it never reached the executor */
    CANCELLED,

    /** Task is running; the worker will cancel it at its next checkpoint */
    CANCEL_REQUESTED,

    /** Task was already in a terminal state - idempotent no-op */
    ALREADY_TERMINAL
}
