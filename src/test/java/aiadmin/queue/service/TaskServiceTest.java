package aiadmin.queue.service;

import aiadmin.queue.config.QueueConfig;
import aiadmin.queue.core.KeyedPendingQueue;
import aiadmin.queue.core.SequenceAllocator;
import aiadmin.queue.executor.ExecutorRegistry;
import aiadmin.queue.executor.ScriptedExecutor;
import aiadmin.queue.model.CancelResult;
import aiadmin.queue.model.QueueStats;
import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskFilter;
import aiadmin.queue.model.TaskKind;
import aiadmin.queue.model.TaskNotFoundException;
import aiadmin.queue.model.TaskState;
import aiadmin.queue.model.ValidationException;
import aiadmin.queue.store.Database;
import aiadmin.queue.store.JdbcTaskRepository;
import aiadmin.queue.worker.WorkerPool;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queue manager operations. Workers are never started, so every task stays where the
 * test puts it.
 */
class TaskServiceTest {

    private static Database db;
    private static JdbcTaskRepository repo;
    private static QueueConfig config;

    private KeyedPendingQueue queue;
    private TaskService service;

    @BeforeAll
    static void setup() {
        config = QueueConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withMaxAttempts(4);
        db = new Database(config);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
        queue = new KeyedPendingQueue();
        ExecutorRegistry registry = new ExecutorRegistry().register(new ScriptedExecutor());
        SequenceAllocator sequence = SequenceAllocator.startingAfter(repo.maxSeq());
        WorkerPool pool = new WorkerPool(repo, queue, registry, sequence, config);
        service = new TaskService(repo, queue, registry, sequence, pool, config);
    }

    @Test
    void submitCreatesPendingTask() {
        String id = service.submit("docker_push", "registry/app:1.0", Map.of("image_name", "registry/app"));

        Task task = service.status(id);
        assertEquals(TaskState.PENDING, task.state());
        assertEquals(TaskKind.DOCKER_PUSH, task.kind());
        assertEquals("registry/app:1.0", task.key());
        assertEquals(0, task.attemptCount());
        assertEquals(4, task.maxAttempts());
        assertTrue(task.params().contains("registry/app"));
        assertNotNull(task.createdAt());
        assertNull(task.startedAt());
        assertTrue(queue.contains(id));
    }

    @Test
    void idsAreUnique() {
        String a = service.submit("docker_push", "k", Map.of());
        String b = service.submit("docker_push", "k", Map.of());
        assertNotEquals(a, b);
    }

    @Test
    void blankKeyIsDerivedByExecutor() {
        String id = service.submit("docker_push", " ", Map.of("target", "repo:tag"));
        assertEquals("repo:tag", service.status(id).key());
    }

    @Test
    void rejectsInvalidSubmissions() {
        assertThrows(ValidationException.class, () -> service.submit("rm_rf", "k", Map.of()));
        assertThrows(ValidationException.class, () -> service.submit("", "k", Map.of()));
        // Known kind without a registered executor
        assertThrows(ValidationException.class, () -> service.submit("ollama_run", "k", Map.of()));
        // Executor schema check
        ValidationException e = assertThrows(ValidationException.class,
                () -> service.submit("docker_push", "k", Map.of("invalid", "yes")));
        assertTrue(e.getMessage().contains("invalid params"));
        // No key and nothing to derive it from
        assertThrows(ValidationException.class, () -> service.submit("docker_push", null, Map.of()));
        // Key must fit the store column and be printable
        assertThrows(ValidationException.class,
                () -> service.submit("docker_push", "k".repeat(TaskService.MAX_KEY_LENGTH + 1), Map.of()));
        assertThrows(ValidationException.class,
                () -> service.submit("docker_push", null, Map.of("target", "k".repeat(600))));
        assertThrows(ValidationException.class, () -> service.submit("docker_push", "repo\ntag", Map.of()));

        assertTrue(repo.findAll(TaskFilter.all()).isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    void acceptsKeyOfMaximumLength() {
        String key = "k".repeat(TaskService.MAX_KEY_LENGTH);
        String id = service.submit("docker_push", key, Map.of());
        assertEquals(key, service.status(id).key());
    }

    @Test
    void unknownIdIsNotFound() {
        TaskNotFoundException e = assertThrows(TaskNotFoundException.class, () -> service.status("missing"));
        assertEquals("missing", e.taskId());
        assertThrows(TaskNotFoundException.class, () -> service.cancel("missing"));
    }

    @Test
    void listIsOrderedAndFiltered() {
        String a = service.submit("docker_push", "k1", Map.of());
        String b = service.submit("docker_pull", "k2", Map.of());
        String c = service.submit("docker_push", "k1", Map.of());
        repo.markRunning(b, Instant.now());

        assertEquals(List.of(a, b, c), ids(service.listStatus(TaskFilter.all())));
        assertEquals(List.of(a, b, c), ids(service.listStatus(null)));
        assertEquals(List.of(a, c), ids(service.listStatus(TaskFilter.byKey("k1"))));
        assertEquals(List.of(b), ids(service.listStatus(TaskFilter.byState(TaskState.RUNNING))));
    }

    @Test
    void cancelPendingIsImmediate() {
        String id = service.submit("docker_push", "k", Map.of());

        assertEquals(CancelResult.CANCELLED, service.cancel(id));

        Task task = service.status(id);
        assertEquals(TaskState.CANCELLED, task.state());
        assertNotNull(task.finishedAt());
        assertFalse(queue.contains(id));
    }

    @Test
    void cancelRunningSetsFlag() {
        String id = service.submit("docker_push", "k", Map.of());
        repo.markRunning(id, Instant.now());

        assertEquals(CancelResult.CANCEL_REQUESTED, service.cancel(id));

        Task task = service.status(id);
        assertEquals(TaskState.RUNNING, task.state());
        assertTrue(task.cancelRequested());
        // Asking again is harmless
        assertEquals(CancelResult.CANCEL_REQUESTED, service.cancel(id));
    }

    @Test
    @DisplayName("Cancel on a succeeded task is a no-op twice and leaves the result alone")
    void cancelIsIdempotentOnTerminal() {
        String id = service.submit("docker_push", "k", Map.of());
        repo.markRunning(id, Instant.now());
        repo.markSucceeded(id, "{\"digest\":\"sha256:1\"}", Instant.now());

        assertEquals(CancelResult.ALREADY_TERMINAL, service.cancel(id));
        assertEquals(CancelResult.ALREADY_TERMINAL, service.cancel(id));

        Task task = service.status(id);
        assertEquals(TaskState.SUCCEEDED, task.state());
        assertEquals("{\"digest\":\"sha256:1\"}", task.result());
        assertFalse(task.cancelRequested());
    }

    @Test
    void statsCountStates() {
        String a = service.submit("docker_push", "k1", Map.of());
        service.submit("docker_push", "k2", Map.of());
        String c = service.submit("docker_push", "k3", Map.of());
        repo.markRunning(a, Instant.now());
        service.cancel(c);
        service.pause();

        QueueStats stats = service.stats();
        assertEquals(3, stats.total());
        assertEquals(1, stats.pending());
        assertEquals(1, stats.running());
        assertEquals(1, stats.cancelled());
        assertEquals(0, stats.succeeded());
        assertEquals(config.concurrency(), stats.concurrency());
        assertEquals(0, stats.busyWorkers());
        assertTrue(stats.paused());

        service.resume();
        assertFalse(service.stats().paused());
    }

    @Test
    void clearFinishedKeepsActiveTasks() {
        String a = service.submit("docker_push", "k1", Map.of());
        String b = service.submit("docker_push", "k2", Map.of());
        service.cancel(a);

        assertEquals(1, service.clearFinished());
        assertThrows(TaskNotFoundException.class, () -> service.status(a));
        assertEquals(TaskState.PENDING, service.status(b).state());
    }

    @Test
    void shutdownRejectsSubmissions() {
        service.shutdown();
        assertThrows(IllegalStateException.class, () -> service.submit("docker_push", "k", Map.of()));
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
