package aiadmin.queue.api.v1;

import aiadmin.queue.api.Controller;
import aiadmin.queue.api.v1.dto.HealthResponse;
import aiadmin.queue.service.TaskService;
import aiadmin.queue.store.Database;
import aiadmin.queue.worker.WorkerPool;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskService taskService;
    private final WorkerPool workerPool;

    public HealthController(Database database, TaskService taskService, WorkerPool workerPool) {
        this.database = database;
        this.taskService = taskService;
        this.workerPool = workerPool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (!database.isHealthy()) {
            return ControllerResponse.of(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy("connection failed"));
        }

        try {
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    workerPool.isRunning(),
                    taskService.isPaused(),
                    taskService.countPending(),
                    taskService.countRunning());
            return ControllerResponse.ok(response);
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.of(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
