package aiadmin.queue.executor;

/**
 * Transient failure (network error, registry hiccup). The task is retried while its
 * attempt budget lasts.
 */
public class RetryableExecutionException extends RuntimeException {

    public RetryableExecutionException(String message) {
        super(message);
    }

    public RetryableExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
