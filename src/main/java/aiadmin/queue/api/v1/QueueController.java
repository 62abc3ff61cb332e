package aiadmin.queue.api.v1;

import aiadmin.queue.api.Controller;
import aiadmin.queue.api.v1.dto.QueueStatsResponse;
import aiadmin.queue.service.TaskService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;

/**
 * Operator controls for the queue as a whole.
 * 
 * GET /api/v1/queue/stats - Counts per state and worker utilisation
 * POST /api/v1/queue/pause - Stop starting new tasks
 * POST /api/v1/queue/resume - Start again
 * POST /api/v1/queue/clear - Delete finished tasks
 */
public class QueueController implements Controller {

    private static final String STATS = "/api/v1/queue/stats";
    private static final String PAUSE = "/api/v1/queue/pause";
    private static final String RESUME = "/api/v1/queue/resume";
    private static final String CLEAR = "/api/v1/queue/clear";

    private final TaskService taskService;

    public QueueController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return STATS.equals(path);
        }
        if (method.equals(HttpMethod.POST)) {
            return PAUSE.equals(path) || RESUME.equals(path) || CLEAR.equals(path);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        switch (path) {
            case STATS:
                return ControllerResponse.ok(QueueStatsResponse.from(taskService.stats()));
            case PAUSE:
                taskService.pause();
                return pausedState();
            case RESUME:
                taskService.resume();
                return pausedState();
            case CLEAR:
                int cleared = taskService.clearFinished();
                return ControllerResponse.ok(Map.of("cleared", cleared));
            default:
                return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "unknown queue endpoint");
        }
    }

    private ControllerResponse pausedState() {
        return ControllerResponse.ok(Map.of("paused", taskService.isPaused()));
    }
}
