package aiadmin.queue.model;

/**
 * Point-in-time counters for the whole queue.
 */
public record QueueStats(
        int total,
        int pending,
        int running,
        int succeeded,
        int failed,
        int cancelled,
        int concurrency,
        int busyWorkers,
        boolean paused) {
}
