package aiadmin.queue.api.v1;

import aiadmin.queue.api.Controller;
import aiadmin.queue.api.v1.dto.CancelResponse;
import aiadmin.queue.api.v1.dto.SubmitTaskRequest;
import aiadmin.queue.api.v1.dto.TaskSnapshotResponse;
import aiadmin.queue.model.CancelResult;
import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskFilter;
import aiadmin.queue.model.TaskState;
import aiadmin.queue.server.RouterHandler;
import aiadmin.queue.service.TaskService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for queued tasks (public API).
 * 
 * POST /api/v1/tasks - Submit a task
 * GET /api/v1/tasks - List tasks (?state=&key=)
 * GET /api/v1/tasks/{id} - Task status
 * POST /api/v1/tasks/{id}/cancel - Cancel a task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        if (req.method().equals(HttpMethod.POST)) {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }
            Matcher cancelMatcher = TASK_CANCEL_PATTERN.matcher(path);
            if (cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }
        } else {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return handleList(req);
            }
            Matcher idMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (idMatcher.matches()) {
                return handleStatus(idMatcher.group(1));
            }
        }
        return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "unknown task endpoint");
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        request.validate();

        String id = taskService.submit(request.kind(), request.key(), request.paramsOrEmpty());
        log.debug("Submitted task {} via API", id);

        return ControllerResponse.created(Map.of("id", id));
    }

    /**
     * GET /api/v1/tasks/{id}
     */
    private ControllerResponse handleStatus(String taskId) {
        Task task = taskService.status(taskId);
        return ControllerResponse.ok(TaskSnapshotResponse.from(task));
    }

    /**
     * GET /api/v1/tasks?state=&key=
     */
    private ControllerResponse handleList(FullHttpRequest req) {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        TaskState state = parseState(firstParam(query, "state"));
        String key = firstParam(query, "key");

        List<TaskSnapshotResponse> tasks = taskService.listStatus(new TaskFilter(state, key)).stream()
                .map(TaskSnapshotResponse::from)
                .toList();

        return ControllerResponse.ok(Map.of("tasks", tasks));
    }

    /**
     * POST /api/v1/tasks/{id}/cancel
     */
    private ControllerResponse handleCancel(String taskId) {
        CancelResult result = taskService.cancel(taskId);
        TaskState current = result == CancelResult.ALREADY_TERMINAL
                ? taskService.status(taskId).state()
                : null;
        return ControllerResponse.ok(CancelResponse.from(taskId, result, current));
    }

    private static String firstParam(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    private static TaskState parseState(String value) {
        if (value == null) {
            return null;
        }
        try {
            return TaskState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown state: " + value);
        }
    }
}
