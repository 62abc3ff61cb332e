package aiadmin.queue.api.v1.dto;

import aiadmin.queue.model.QueueStats;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for queue statistics.
 * GET /api/v1/queue/stats
 */
public record QueueStatsResponse(
        @JsonProperty("total") int total,
        @JsonProperty("pending") int pending,
        @JsonProperty("running") int running,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("cancelled") int cancelled,
        @JsonProperty("concurrency") int concurrency,
        @JsonProperty("busyWorkers") int busyWorkers,
        @JsonProperty("paused") boolean paused) {

    public static QueueStatsResponse from(QueueStats stats) {
        return new QueueStatsResponse(
                stats.total(),
                stats.pending(),
                stats.running(),
                stats.succeeded(),
                stats.failed(),
                stats.cancelled(),
                stats.concurrency(),
                stats.busyWorkers(),
                stats.paused());
    }
}
