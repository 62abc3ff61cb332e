package aiadmin.queue.api.v1.dto;

import aiadmin.queue.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;

/**
 * Response DTO for one task.
 * GET /api/v1/tasks/{id}, and each entry of GET /api/v1/tasks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskSnapshotResponse(
        @JsonProperty("id") String id,
        @JsonProperty("kind") String kind,
        @JsonProperty("key") String key,
        @JsonProperty("state") String state,
        @JsonProperty("attemptCount") int attemptCount,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("progress") int progress,
        @JsonProperty("currentStep") String currentStep,
        @JsonProperty("cancelRequested") boolean cancelRequested) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Create response from domain model.
     * The stored result is JSON text; it is embedded as a JSON value, or as a string if
     * it does not parse.
     */
    public static TaskSnapshotResponse from(Task task) {
        return new TaskSnapshotResponse(
                task.id(),
                task.kind().wireName(),
                task.key(),
                task.state().name(),
                task.attemptCount(),
                task.maxAttempts(),
                task.createdAt(),
                task.startedAt(),
                task.finishedAt(),
                parseResult(task.result()),
                task.errorMessage(),
                task.progress(),
                task.currentStep(),
                task.cancelRequested());
    }

    private static JsonNode parseResult(String result) {
        if (result == null || result.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readTree(result);
        } catch (Exception e) {
            return TextNode.valueOf(result);
        }
    }
}
