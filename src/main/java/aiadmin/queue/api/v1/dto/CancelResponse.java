package aiadmin.queue.api.v1.dto;

import aiadmin.queue.model.CancelResult;
import aiadmin.queue.model.TaskState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for cancel.
 * POST /api/v1/tasks/{id}/cancel
 * <p>
 * {@code accepted} is false only for a task that had already finished; {@code finalState}
 * is present once the task is terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CancelResponse(
        @JsonProperty("id") String id,
        @JsonProperty("accepted") boolean accepted,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("finalState") String finalState) {

    /**
     * @param currentState state read after the cancel, used for ALREADY_TERMINAL
     */
    public static CancelResponse from(String id, CancelResult result, TaskState currentState) {
        return switch (result) {
            case CANCELLED -> new CancelResponse(id, true, "cancelled", TaskState.CANCELLED.name());
            case CANCEL_REQUESTED -> new CancelResponse(id, true, "cancel_requested", null);
            case ALREADY_TERMINAL -> new CancelResponse(id, false, "already_terminal",
                    currentState != null ? currentState.name() : null);
        };
    }
}
