package aiadmin.queue.executor;

import java.time.Instant;

/**
 * Per-attempt view handed to an executor.
 */
public interface ExecutionContext {

    String taskId();

    /** 1-based number of the current attempt */
    int attempt();

    /** Wall-clock instant after which the worker abandons the attempt */
    Instant deadline();

    /**
     * Cooperative checkpoint. Long-running executors should poll this and stop early
     * when it turns true.
     */
    boolean isCancelRequested();

    /**
     * Publish progress visible through status queries.
     *
     * @param percent 0-100
     * @param step    short human-readable description
     */
    void reportProgress(int percent, String step);
}
