package aiadmin.queue.scheduler;

import aiadmin.queue.config.QueueConfig;
import aiadmin.queue.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Background job that evicts finished tasks.
 * <p>
 * SUCCEEDED, FAILED and CANCELLED tasks whose finish time is older than the retention
 * window are deleted; after that their IDs report not found. PENDING and RUNNING tasks
 * are never touched.
 */
public class RetentionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionReaper.class);

    private final TaskRepository taskRepository;
    private final QueueConfig config;
    private final Clock clock;

    public RetentionReaper(TaskRepository taskRepository, QueueConfig config) {
        this(taskRepository, config, Clock.systemUTC());
    }

    public RetentionReaper(TaskRepository taskRepository, QueueConfig config, Clock clock) {
        this.taskRepository = taskRepository;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        evictExpired();
    }

    /**
     * Delete terminal tasks finished before {@code now - retention}.
     *
     * @return number of tasks evicted
     */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(config.retention());
        int evicted = taskRepository.deleteFinishedBefore(cutoff);
        if (evicted > 0) {
            log.info("Retention reaper: evicted {} tasks finished before {}", evicted, cutoff);
        } else {
            log.debug("No expired tasks found");
        }
        return evicted;
    }
}
