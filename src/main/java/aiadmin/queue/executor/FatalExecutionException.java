package aiadmin.queue.executor;

/**
 * Failure that another attempt cannot fix (bad credentials, malformed target).
 * The task fails immediately without consuming its retry budget.
 */
public class FatalExecutionException extends RuntimeException {

    public FatalExecutionException(String message) {
        super(message);
    }

    public FatalExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
