package aiadmin.queue.worker;

import aiadmin.queue.config.QueueConfig;
import aiadmin.queue.core.KeyedPendingQueue;
import aiadmin.queue.core.KeyedPendingQueue.Claim;
import aiadmin.queue.core.SequenceAllocator;
import aiadmin.queue.executor.ExecutionOutcome;
import aiadmin.queue.executor.ExecutorRegistry;
import aiadmin.queue.executor.FatalExecutionException;
import aiadmin.queue.executor.RetryableExecutionException;
import aiadmin.queue.executor.TaskExecutor;
import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskState;
import aiadmin.queue.repository.TaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads draining the {@link KeyedPendingQueue}.
 * <p>
 * Each worker:
 * 1. Takes the oldest eligible task whose key is free (the key is now locked)
 * 2. Moves it PENDING -> RUNNING in the store
 * 3. Runs the executor on an attempt thread, waiting at most the attempt timeout and
 * polling the cancel flag meanwhile
 * 4. Records SUCCEEDED / FAILED / CANCELLED, or re-queues the task with backoff
 * 5. Releases the key
 * <p>
 * The store is the arbiter: every transition is conditional, so a cancel racing with a
 * worker resolves to one outcome.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final TaskRepository taskRepository;
    private final KeyedPendingQueue pendingQueue;
    private final ExecutorRegistry registry;
    private final RetryPolicy retryPolicy;
    private final SequenceAllocator sequence;
    private final QueueConfig config;

    private final List<Thread> workers = new ArrayList<>();
    private final ExecutorService attemptThreads;
    private final AtomicInteger busyWorkers = new AtomicInteger();
    private final AtomicInteger attemptThreadIds = new AtomicInteger();

    private volatile boolean running = false;

    public WorkerPool(TaskRepository taskRepository, KeyedPendingQueue pendingQueue, ExecutorRegistry registry,
            SequenceAllocator sequence, QueueConfig config) {
        this.taskRepository = taskRepository;
        this.pendingQueue = pendingQueue;
        this.registry = registry;
        this.retryPolicy = RetryPolicy.from(config);
        this.sequence = sequence;
        this.config = config;
        this.attemptThreads = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "queue-attempt-" + attemptThreadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Recover tasks left behind by a previous process, then start the workers.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        recover();
        running = true;
        for (int i = 1; i <= config.concurrency(); i++) {
            Thread worker = new Thread(this::workerLoop, "queue-worker-" + i);
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
        }
        log.info("Worker pool started with {} workers", config.concurrency());
    }

    /**
     * Bring the in-memory queue in line with the store.
     * <p>
     * RUNNING rows belong to a process that no longer exists: they go back to PENDING at
     * their original position if they have attempts left, to CANCELLED if a cancel was
     * requested, and to FAILED otherwise. Every PENDING row is then queued.
     *
     * @return number of tasks queued
     */
    public int recover() {
        Instant now = Instant.now();
        int reset = 0;
        int failed = 0;
        int cancelled = 0;

        for (Task task : taskRepository.findByState(TaskState.RUNNING)) {
            try {
                if (task.cancelRequested()) {
                    if (taskRepository.markCancelled(task.id(), now)) {
                        cancelled++;
                    }
                } else if (task.canRetry()) {
                    if (taskRepository.resetToPending(task.id(), task.seq())) {
                        reset++;
                    }
                } else {
                    String error = "Interrupted while RUNNING - max attempts exceeded ("
                            + task.attemptCount() + "/" + task.maxAttempts() + ")";
                    if (taskRepository.markFailed(task.id(), error, errorJson(error, true), now)) {
                        failed++;
                    }
                }
            } catch (Exception e) {
                log.error("Failed to recover task {}", task.id(), e);
            }
        }

        int queued = 0;
        for (Task task : taskRepository.findByState(TaskState.PENDING)) {
            pendingQueue.enqueue(task.id(), task.key(), task.seq());
            queued++;
        }

        log.info("Recovery: {} reset, {} failed, {} cancelled, {} pending queued", reset, failed, cancelled, queued);
        return queued;
    }

    /**
     * Stop selecting tasks, interrupt the workers and abandon in-flight attempts.
     * Abandoned tasks stay RUNNING in the store and are recovered on the next start.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        pendingQueue.close();
        workers.forEach(Thread::interrupt);
        attemptThreads.shutdownNow();

        for (Thread worker : workers) {
            try {
                worker.join(5000);
                if (worker.isAlive()) {
                    log.warn("Worker {} did not stop in time", worker.getName());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        workers.clear();
        log.info("Worker pool stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isRunning() {
        return running;
    }

    /** Workers currently processing a task. */
    public int busyWorkers() {
        return busyWorkers.get();
    }

    private void workerLoop() {
        log.debug("{} started", Thread.currentThread().getName());
        while (running) {
            Optional<Claim> claim;
            try {
                claim = pendingQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (claim.isEmpty()) {
                break;
            }

            busyWorkers.incrementAndGet();
            try {
                process(claim.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Worker error on task {}", claim.get().taskId(), e);
            } finally {
                busyWorkers.decrementAndGet();
            }
        }
        log.debug("{} stopped", Thread.currentThread().getName());
    }

    private void process(Claim claim) throws InterruptedException {
        String taskId = claim.taskId();
        boolean keyHandedBack = false;
        try {
            if (!taskRepository.markRunning(taskId, Instant.now())) {
                keyHandedBack = handleNotStarted(claim);
                return;
            }
            try {
                keyHandedBack = runClaimed(taskId);
            } catch (RuntimeException e) {
                log.error("Task {} hit an internal error while RUNNING", taskId, e);
                finishAfterError(taskId, e);
            }
        } finally {
            if (!keyHandedBack) {
                pendingQueue.release(claim.key());
            }
        }
    }

    /**
     * Run one attempt of a task this worker has just moved to RUNNING.
     *
     * @return true if the task was re-queued and its key released with it
     */
    private boolean runClaimed(String taskId) throws InterruptedException {
        Optional<Task> loaded = taskRepository.findById(taskId);
        if (loaded.isEmpty()) {
            log.warn("Task {} vanished after being marked RUNNING", taskId);
            return false;
        }
        Task task = loaded.get();

        if (task.cancelRequested()) {
            finishCancelled(task);
            return false;
        }

        log.info("Task {} ({} {}) attempt {}/{} started",
                taskId, task.kind().wireName(), task.key(), task.attemptCount(), task.maxAttempts());

        ExecutionOutcome outcome = runAttempt(task);

        if (taskRepository.isCancelRequested(taskId)) {
            finishCancelled(task);
            return false;
        }
        return record(task, outcome);
    }

    /**
     * Leave RUNNING after an unexpected error so the key is not held by the store forever:
     * CANCELLED if a cancel was requested, FAILED otherwise. If the store itself is failing
     * the row stays RUNNING and startup recovery resolves it.
     */
    private void finishAfterError(String taskId, RuntimeException error) {
        String reason = "internal error: "
                + (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        try {
            Instant now = Instant.now();
            if (taskRepository.isCancelRequested(taskId)) {
                if (taskRepository.markCancelled(taskId, now)) {
                    log.info("Task {} cancelled", taskId);
                }
            } else if (taskRepository.markFailed(taskId, reason, errorJson(reason, false), now)) {
                log.warn("Task {} failed: {}", taskId, reason);
            }
        } catch (RuntimeException e) {
            log.error("Task {} could not be moved out of RUNNING; left for recovery", taskId, e);
        }
    }

    /**
     * markRunning refused: the task was cancelled while queued, or the store still shows
     * another RUNNING task for the key. In the latter case put the task back so it is not
     * lost from the queue.
     *
     * @return true if the key was released together with the re-queue
     */
    private boolean handleNotStarted(Claim claim) {
        Optional<Task> current = taskRepository.findById(claim.taskId());
        if (current.isPresent() && current.get().state() == TaskState.PENDING) {
            Task task = current.get();
            log.warn("Task {} could not start, key {} busy in store; re-queued", task.id(), task.key());
            pendingQueue.requeueAndRelease(task.id(), task.key(), task.seq(),
                    config.cancelPollInterval().toNanos());
            return true;
        }
        log.debug("Task {} no longer pending, skipped", claim.taskId());
        return false;
    }

    private ExecutionOutcome runAttempt(Task task) throws InterruptedException {
        Optional<TaskExecutor> executor = registry.lookup(task.kind());
        if (executor.isEmpty()) {
            return ExecutionOutcome.fatal("no executor registered for kind " + task.kind().wireName());
        }

        Map<String, Object> params;
        try {
            params = MAPPER.readValue(task.params(), PARAMS_TYPE);
        } catch (JsonProcessingException e) {
            return ExecutionOutcome.fatal("malformed params: " + e.getOriginalMessage());
        }

        Duration timeout = config.attemptTimeout();
        Instant deadline = Instant.now().plus(timeout);
        DefaultExecutionContext ctx = new DefaultExecutionContext(
                taskRepository, task.id(), task.attemptCount(), deadline);

        Future<ExecutionOutcome> future = attemptThreads.submit(
                () -> executor.get().execute(task.kind(), params, ctx));

        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        long pollNanos = Math.max(1L, config.cancelPollInterval().toNanos());
        try {
            while (true) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    future.cancel(true);
                    log.warn("Task {} attempt {} timed out after {}", task.id(), task.attemptCount(), timeout);
                    return ExecutionOutcome.retryable("attempt timed out after " + timeout);
                }
                try {
                    ExecutionOutcome outcome = future.get(Math.min(pollNanos, remaining), TimeUnit.NANOSECONDS);
                    return outcome != null ? outcome : ExecutionOutcome.fatal("executor returned no outcome");
                } catch (TimeoutException e) {
                    if (taskRepository.isCancelRequested(task.id())) {
                        future.cancel(true);
                        log.info("Task {} abandoned on cancel request", task.id());
                        return ExecutionOutcome.fatal("cancelled");
                    }
                } catch (ExecutionException e) {
                    return classify(task, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private ExecutionOutcome classify(Task task, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (error instanceof RetryableExecutionException
                || error instanceof IOException
                || error instanceof UncheckedIOException
                || error instanceof InterruptedException) {
            log.warn("Task {} attempt {} failed (retryable): {}", task.id(), task.attemptCount(), message);
            return ExecutionOutcome.retryable(message);
        }
        if (error instanceof FatalExecutionException) {
            log.warn("Task {} attempt {} failed (fatal): {}", task.id(), task.attemptCount(), message);
        } else {
            log.error("Task {} attempt {} threw unexpected exception", task.id(), task.attemptCount(), error);
        }
        return ExecutionOutcome.fatal(message);
    }

    /**
     * Write the attempt outcome to the store.
     *
     * @return true if the task was re-queued and its key released with it
     */
    private boolean record(Task task, ExecutionOutcome outcome) {
        Instant now = Instant.now();
        String taskId = task.id();

        if (outcome.isSuccess()) {
            String resultJson;
            try {
                resultJson = MAPPER.writeValueAsString(outcome.result());
            } catch (JsonProcessingException e) {
                log.warn("Task {} returned a result that cannot be stored: {}", taskId, e.getOriginalMessage());
                outcome = ExecutionOutcome.fatal("result is not serializable: " + e.getOriginalMessage());
                resultJson = null;
            }
            if (resultJson != null) {
                if (taskRepository.markSucceeded(taskId, resultJson, now)) {
                    log.info("Task {} succeeded on attempt {}", taskId, task.attemptCount());
                } else {
                    log.warn("Task {} finished but was no longer RUNNING", taskId);
                }
                return false;
            }
        }

        String reason = outcome.reason() != null ? outcome.reason() : "unknown error";

        if (outcome.isRetryable() && task.canRetry()) {
            Duration delay = retryPolicy.delayAfter(task.attemptCount());
            long seq = sequence.next();
            if (taskRepository.requeueForRetry(taskId, seq, reason)) {
                pendingQueue.requeueAndRelease(taskId, task.key(), seq, delay.toNanos());
                log.info("Task {} will retry in {} (attempt {} of {})",
                        taskId, delay, task.attemptCount(), task.maxAttempts());
                return true;
            }
            // A cancel arrived between the check and the requeue
            if (taskRepository.isCancelRequested(taskId)) {
                finishCancelled(task);
            }
            return false;
        }

        if (taskRepository.markFailed(taskId, reason, errorJson(reason, outcome.isRetryable()), now)) {
            if (outcome.isRetryable()) {
                log.warn("Task {} permanently failed after {} attempts: {}", taskId, task.attemptCount(), reason);
            } else {
                log.warn("Task {} failed: {}", taskId, reason);
            }
        }
        return false;
    }

    private void finishCancelled(Task task) {
        if (taskRepository.markCancelled(task.id(), Instant.now())) {
            log.info("Task {} cancelled", task.id());
        }
    }

    private static String toJson(Map<String, Object> value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String errorJson(String error, boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("retryable", retryable);
        return toJson(body);
    }
}
