package aiadmin.queue.worker;

import aiadmin.queue.config.QueueConfig;
import aiadmin.queue.core.KeyedPendingQueue;
import aiadmin.queue.core.SequenceAllocator;
import aiadmin.queue.executor.ExecutionOutcome;
import aiadmin.queue.executor.ExecutorRegistry;
import aiadmin.queue.executor.FatalExecutionException;
import aiadmin.queue.executor.RetryableExecutionException;
import aiadmin.queue.executor.ScriptedExecutor;
import aiadmin.queue.model.CancelResult;
import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskKind;
import aiadmin.queue.model.TaskState;
import aiadmin.queue.repository.TaskRepository;
import aiadmin.queue.service.TaskService;
import aiadmin.queue.store.Database;
import aiadmin.queue.store.JdbcTaskRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the worker loop against an in-memory H2 store.
 */
class WorkerPoolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration WAIT = Duration.ofSeconds(10);

    private Database db;
    private JdbcTaskRepository repo;
    private ScriptedExecutor executor;
    private WorkerPool pool;
    private TaskService service;
    private KeyedPendingQueue queue;

    @BeforeEach
    void setUp() {
        db = new Database(baseConfig());
        repo = new JdbcTaskRepository(db);
        executor = new ScriptedExecutor();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
        db.close();
    }

    private QueueConfig baseConfig() {
        return QueueConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-workers-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withConcurrency(2)
                .withMaxAttempts(3)
                .withAttemptTimeout(Duration.ofSeconds(5))
                .withCancelPollInterval(Duration.ofMillis(20))
                .withBackoff(Duration.ofMillis(10), Duration.ofMillis(50));
    }

    private void startPool(QueueConfig config) {
        startPool(config, repo);
    }

    private void startPool(QueueConfig config, TaskRepository poolRepo) {
        queue = new KeyedPendingQueue();
        ExecutorRegistry registry = new ExecutorRegistry().register(executor);
        SequenceAllocator sequence = SequenceAllocator.startingAfter(poolRepo.maxSeq());
        pool = new WorkerPool(poolRepo, queue, registry, sequence, config);
        service = new TaskService(poolRepo, queue, registry, sequence, pool, config);
        pool.start();
    }

    private String submit(String key) {
        return service.submit("docker_push", key, Map.of("image_name", "app"));
    }

    private Task awaitState(String taskId, TaskState expected) throws InterruptedException {
        Instant deadline = Instant.now().plus(WAIT);
        Task task = null;
        while (Instant.now().isBefore(deadline)) {
            task = repo.findById(taskId).orElseThrow();
            if (task.state() == expected) {
                return task;
            }
            Thread.sleep(10);
        }
        fail("Task " + taskId + " did not reach " + expected + ", last seen: " + task);
        return task;
    }

    @Test
    @DisplayName("Two retryable failures then success ends SUCCEEDED with three attempts")
    void retriesThenSucceeds() throws Exception {
        executor.then(ScriptedExecutor.retryable("registry 502"))
                .then(ScriptedExecutor.retryable("connection reset"))
                .then(ScriptedExecutor.succeed(Map.of("digest", "sha256:abc")));
        startPool(baseConfig());

        String id = submit("repo:tag");
        Task task = awaitState(id, TaskState.SUCCEEDED);

        assertEquals(3, task.attemptCount());
        assertEquals(3, executor.callCount());
        assertEquals("sha256:abc", MAPPER.readTree(task.result()).get("digest").asText());
        assertNull(task.errorMessage());
        assertNotNull(task.finishedAt());
    }

    @Test
    @DisplayName("Retryable failure on every attempt ends FAILED after max attempts")
    void exhaustedRetriesFail() throws Exception {
        executor.otherwise(ScriptedExecutor.retryable("network down"));
        startPool(baseConfig());

        String id = submit("repo:tag");
        Task task = awaitState(id, TaskState.FAILED);

        assertEquals(3, task.attemptCount());
        assertEquals(3, executor.callCount());
        JsonNode result = MAPPER.readTree(task.result());
        assertEquals("network down", result.get("error").asText());
        assertTrue(result.get("retryable").asBoolean());

        // Never picked up again
        Thread.sleep(200);
        assertEquals(3, executor.callCount());
    }

    @Test
    @DisplayName("Fatal failure skips the retry budget")
    void fatalShortCircuits() throws Exception {
        executor.otherwise(ScriptedExecutor.fatal("unauthorized: authentication required"));
        startPool(baseConfig());

        String id = submit("repo:tag");
        Task task = awaitState(id, TaskState.FAILED);

        assertEquals(1, task.attemptCount());
        assertEquals(1, executor.callCount());
        assertFalse(MAPPER.readTree(task.result()).get("retryable").asBoolean());
        assertEquals("unauthorized: authentication required", task.errorMessage());
    }

    @Test
    void thrownExceptionsAreClassified() throws Exception {
        executor.then((p, c) -> {
            throw new RetryableExecutionException("registry hiccup");
        }).then((p, c) -> {
            throw new IOException("broken pipe");
        });
        startPool(baseConfig());

        String retried = submit("a:1");
        assertEquals(3, awaitState(retried, TaskState.SUCCEEDED).attemptCount());

        executor.then((p, c) -> {
            throw new FatalExecutionException("denied");
        }).then((p, c) -> {
            throw new IllegalStateException("bug in executor");
        });

        String fatal = submit("b:1");
        Task fatalTask = awaitState(fatal, TaskState.FAILED);
        assertEquals(1, fatalTask.attemptCount());
        assertEquals("denied", fatalTask.errorMessage());

        String unexpected = submit("c:1");
        Task unexpectedTask = awaitState(unexpected, TaskState.FAILED);
        assertEquals(1, unexpectedTask.attemptCount());
        assertEquals("bug in executor", unexpectedTask.errorMessage());
    }

    @Test
    @DisplayName("Unserializable result fails the task and frees its key")
    void unserializableResultFails() throws Exception {
        executor.then(ScriptedExecutor.succeed(Map.of("handle", new Object())));
        startPool(baseConfig());

        String a = submit("repo:tag");
        String b = submit("repo:tag");

        Task failed = awaitState(a, TaskState.FAILED);
        assertTrue(failed.errorMessage().contains("not serializable"));
        assertFalse(MAPPER.readTree(failed.result()).get("retryable").asBoolean());
        assertEquals(1, failed.attemptCount());

        awaitState(b, TaskState.SUCCEEDED);
        assertEquals(List.of(a, b), executor.calls());
    }

    @Test
    @DisplayName("Store error while RUNNING fails the task instead of holding the key")
    void storeErrorWhileRunningFails() throws Exception {
        AtomicBoolean failNext = new AtomicBoolean(true);
        TaskRepository flaky = new JdbcTaskRepository(db) {
            @Override
            public boolean isCancelRequested(String taskId) {
                if (failNext.compareAndSet(true, false)) {
                    throw new RuntimeException("connection reset");
                }
                return super.isCancelRequested(taskId);
            }
        };
        startPool(baseConfig(), flaky);

        String a = submit("repo:tag");
        String b = submit("repo:tag");

        Task failed = awaitState(a, TaskState.FAILED);
        assertEquals("internal error: connection reset", failed.errorMessage());

        awaitState(b, TaskState.SUCCEEDED);
    }

    @Test
    @DisplayName("Cancel requested before an internal error ends CANCELLED")
    void internalErrorWithCancelRequestedEndsCancelled() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        executor.then((params, ctx) -> {
            release.await();
            return ExecutionOutcome.success(Map.of("handle", new Object()));
        });
        AtomicBoolean failNext = new AtomicBoolean(false);
        TaskRepository flaky = new JdbcTaskRepository(db) {
            @Override
            public boolean isCancelRequested(String taskId) {
                if (failNext.compareAndSet(true, false)) {
                    throw new RuntimeException("connection reset");
                }
                return super.isCancelRequested(taskId);
            }
        };
        startPool(baseConfig().withCancelPollInterval(Duration.ofSeconds(30)), flaky);

        String a = submit("repo:tag");
        awaitState(a, TaskState.RUNNING);
        assertTrue(repo.requestCancel(a));
        failNext.set(true);
        release.countDown();

        awaitState(a, TaskState.CANCELLED);
    }

    @Test
    @DisplayName("Same key: A runs to completion before B starts")
    void fifoWithinKey() throws Exception {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        executor.otherwise((p, ctx) -> {
            events.add("start:" + ctx.taskId());
            Thread.sleep(50);
            events.add("end:" + ctx.taskId());
            return ExecutionOutcome.success(Map.of());
        });
        startPool(baseConfig().withConcurrency(4));

        String a = submit("repo:tag");
        String b = submit("repo:tag");
        awaitState(b, TaskState.SUCCEEDED);
        awaitState(a, TaskState.SUCCEEDED);

        assertEquals(List.of("start:" + a, "end:" + a, "start:" + b, "end:" + b), events);
    }

    @Test
    @DisplayName("Cancel B while A runs: B never executes, executor called once")
    void cancelPendingWhileKeyBusy() throws Exception {
        CountDownLatch releaseA = new CountDownLatch(1);
        executor.then(ScriptedExecutor.awaiting(releaseA));
        startPool(baseConfig());

        String a = submit("repo:tag");
        String b = submit("repo:tag");
        awaitState(a, TaskState.RUNNING);

        assertEquals(CancelResult.CANCELLED, service.cancel(b));
        Task cancelled = repo.findById(b).orElseThrow();
        assertEquals(TaskState.CANCELLED, cancelled.state());
        assertEquals(0, cancelled.attemptCount());

        releaseA.countDown();
        awaitState(a, TaskState.SUCCEEDED);
        Thread.sleep(100);

        assertEquals(List.of(a), executor.calls());
        assertEquals(TaskState.CANCELLED, repo.findById(b).orElseThrow().state());
    }

    @Test
    @DisplayName("Cancelling a running task abandons the attempt and frees the key")
    void cancelRunning() throws Exception {
        executor.then(ScriptedExecutor.hang());
        startPool(baseConfig());

        String a = submit("repo:tag");
        awaitState(a, TaskState.RUNNING);

        assertEquals(CancelResult.CANCEL_REQUESTED, service.cancel(a));
        Task task = awaitState(a, TaskState.CANCELLED);
        assertTrue(task.cancelRequested());
        assertNull(task.result());
        assertNotNull(task.finishedAt());

        // Key is free again
        String next = submit("repo:tag");
        awaitState(next, TaskState.SUCCEEDED);

        assertEquals(CancelResult.ALREADY_TERMINAL, service.cancel(a));
    }

    @Test
    @DisplayName("Cancel observed after the executor returned still wins")
    void cancelSeenAfterSuccess() throws Exception {
        executor.then((p, ctx) -> {
            // Flag raised by a concurrent cancel while the executor is finishing
            repo.requestCancel(ctx.taskId());
            return ExecutionOutcome.success(Map.of("pushed", true));
        });
        startPool(baseConfig());

        String id = submit("repo:tag");
        Task task = awaitState(id, TaskState.CANCELLED);
        assertNull(task.result());
    }

    @Test
    @DisplayName("Hung attempt times out and is retried")
    void timeoutIsRetryable() throws Exception {
        executor.then(ScriptedExecutor.hang());
        startPool(baseConfig().withAttemptTimeout(Duration.ofMillis(200)));

        String id = submit("repo:tag");
        Task task = awaitState(id, TaskState.SUCCEEDED);

        assertEquals(2, task.attemptCount());
        assertEquals(2, executor.callCount());
    }

    @Test
    void timeoutWithoutBudgetFails() throws Exception {
        executor.otherwise(ScriptedExecutor.hang());
        startPool(baseConfig().withAttemptTimeout(Duration.ofMillis(100)).withMaxAttempts(1));

        String id = submit("repo:tag");
        Task task = awaitState(id, TaskState.FAILED);

        assertEquals(1, task.attemptCount());
        assertTrue(task.errorMessage().contains("timed out"), task.errorMessage());
    }

    @Test
    void progressIsVisibleWhileRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        executor.then((p, ctx) -> {
            ctx.reportProgress(40, "Pushing layers...");
            release.await();
            return ExecutionOutcome.success(Map.of());
        });
        startPool(baseConfig());

        String id = submit("repo:tag");
        Instant deadline = Instant.now().plus(WAIT);
        Task running = repo.findById(id).orElseThrow();
        while (running.progress() != 40 && Instant.now().isBefore(deadline)) {
            Thread.sleep(10);
            running = repo.findById(id).orElseThrow();
        }
        assertEquals(TaskState.RUNNING, running.state());
        assertEquals(40, running.progress());
        assertEquals("Pushing layers...", running.currentStep());

        release.countDown();
        assertEquals(100, awaitState(id, TaskState.SUCCEEDED).progress());
    }

    @Test
    void pausedQueueHoldsTasks() throws Exception {
        startPool(baseConfig());
        service.pause();

        String id = submit("repo:tag");
        Thread.sleep(200);
        assertEquals(TaskState.PENDING, repo.findById(id).orElseThrow().state());
        assertEquals(0, executor.callCount());
        assertTrue(service.stats().paused());

        service.resume();
        awaitState(id, TaskState.SUCCEEDED);
    }

    @Test
    @DisplayName("Randomized submissions never run two tasks with the same key at once")
    void singleFlightPerKey() throws Exception {
        Map<String, AtomicInteger> runningPerKey = new ConcurrentHashMap<>();
        AtomicInteger violations = new AtomicInteger();
        Map<String, List<String>> startOrder = new ConcurrentHashMap<>();
        Random random = new Random(42);

        executor.otherwise((params, ctx) -> {
            String key = (String) params.get("target");
            int concurrent = runningPerKey.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            if (concurrent > 1) {
                violations.incrementAndGet();
            }
            startOrder.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>()))
                    .add(ctx.taskId());
            try {
                Thread.sleep(1 + (ctx.taskId().hashCode() & 7));
            } finally {
                runningPerKey.get(key).decrementAndGet();
            }
            return ExecutionOutcome.success(Map.of());
        });
        startPool(baseConfig().withConcurrency(4));

        List<String> keys = List.of("a:1", "b:1", "c:1", "d:1", "e:1");
        Map<String, List<String>> submitted = new HashMap<>();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String key = keys.get(random.nextInt(keys.size()));
            String id = service.submit("docker_push", null, Map.of("target", key));
            submitted.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
            ids.add(id);
        }

        for (String id : ids) {
            awaitState(id, TaskState.SUCCEEDED);
        }

        assertEquals(0, violations.get());
        for (Map.Entry<String, List<String>> entry : submitted.entrySet()) {
            assertEquals(entry.getValue(), startOrder.get(entry.getKey()), "FIFO for " + entry.getKey());
        }
    }

    @Test
    @DisplayName("Startup recovery resolves tasks left RUNNING by a previous process")
    void recoversInterruptedTasks() throws Exception {
        Instant now = Instant.now();
        repo.save(Task.builder().id("resume-me").key("k1").kind(TaskKind.DOCKER_PUSH)
                .state(TaskState.RUNNING).seq(1).attemptCount(1).maxAttempts(3)
                .startedAt(now).createdAt(now).build());
        repo.save(Task.builder().id("out-of-budget").key("k2").kind(TaskKind.DOCKER_PUSH)
                .state(TaskState.RUNNING).seq(2).attemptCount(3).maxAttempts(3)
                .startedAt(now).createdAt(now).build());
        repo.save(Task.builder().id("was-cancelled").key("k3").kind(TaskKind.DOCKER_PUSH)
                .state(TaskState.RUNNING).seq(3).attemptCount(1).maxAttempts(3).cancelRequested(true)
                .startedAt(now).createdAt(now).build());
        repo.save(Task.builder().id("still-pending").key("k1").kind(TaskKind.DOCKER_PUSH)
                .seq(4).maxAttempts(3).createdAt(now).build());

        startPool(baseConfig());

        Task resumed = awaitState("resume-me", TaskState.SUCCEEDED);
        assertEquals(2, resumed.attemptCount());
        awaitState("still-pending", TaskState.SUCCEEDED);

        Task failed = repo.findById("out-of-budget").orElseThrow();
        assertEquals(TaskState.FAILED, failed.state());
        assertEquals(3, failed.attemptCount());

        assertEquals(TaskState.CANCELLED, repo.findById("was-cancelled").orElseThrow().state());

        // FIFO on k1 survives the restart
        assertEquals(List.of("resume-me", "still-pending"), executor.calls());

        // New submissions continue after the recovered sequence
        String fresh = submit("k9");
        assertTrue(repo.findById(fresh).orElseThrow().seq() > 4);
    }

    @Test
    void shutdownStopsWorkers() throws Exception {
        startPool(baseConfig());
        assertTrue(pool.isRunning());

        pool.shutdown();
        assertFalse(pool.isRunning());

        String id = submit("repo:tag");
        Thread.sleep(100);
        assertEquals(TaskState.PENDING, repo.findById(id).orElseThrow().state());
        assertEquals(0, pool.busyWorkers());
    }
}
