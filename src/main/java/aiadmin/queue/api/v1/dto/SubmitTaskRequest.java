package aiadmin.queue.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 */
public record SubmitTaskRequest(
        @JsonProperty("kind") String kind,
        @JsonProperty("key") String key,
        @JsonProperty("params") Map<String, Object> params) {

    /** Parameters, never null */
    public Map<String, Object> paramsOrEmpty() {
        return params != null ? params : Map.of();
    }

    /** Validate the request shape; parameter checks belong to the executor */
    public void validate() {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind is required");
        }
    }
}
