package aiadmin.queue.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic maintenance jobs on one background thread.
 * <p>
 * Jobs are registered with {@link #every(String, Duration, Runnable)} before {@link #start()}.
 * A job that throws is logged and runs again at its next tick.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private record Job(Duration interval, Runnable body) {
    }

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final ScheduledExecutorService executor;

    private volatile boolean running = false;

    public Scheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "queue-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a job that runs every {@code interval}, first after one interval.
     */
    public synchronized Scheduler every(String name, Duration interval, Runnable body) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval for " + name + " must be positive");
        }
        if (running) {
            throw new IllegalStateException("scheduler already started");
        }
        jobs.put(name, new Job(interval, body));
        return this;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        jobs.forEach((name, job) -> {
            long periodMs = job.interval().toMillis();
            executor.scheduleAtFixedRate(guarded(name, job.body()), periodMs, periodMs, TimeUnit.MILLISECONDS);
            log.info("Scheduled {} every {}", name, job.interval());
        });
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler did not finish in time, forced stop");
            } else {
                log.info("Scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized int jobCount() {
        return jobs.size();
    }

    private static Runnable guarded(String name, Runnable body) {
        return () -> {
            try {
                body.run();
            } catch (RuntimeException e) {
                log.error("Scheduled job {} failed", name, e);
            }
        };
    }
}
