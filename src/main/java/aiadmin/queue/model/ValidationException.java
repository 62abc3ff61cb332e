package aiadmin.queue.model;

/**
 * Submission rejected before admission: unknown kind, missing key or parameters that
 * fail the executor's checks.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
