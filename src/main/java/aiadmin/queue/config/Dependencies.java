package aiadmin.queue.config;

import aiadmin.queue.api.v1.HealthController;
import aiadmin.queue.api.v1.QueueController;
import aiadmin.queue.api.v1.TaskController;
import aiadmin.queue.core.KeyedPendingQueue;
import aiadmin.queue.core.SequenceAllocator;
import aiadmin.queue.executor.ExecutorRegistry;
import aiadmin.queue.executor.TaskExecutor;
import aiadmin.queue.executor.docker.DockerPushExecutor;
import aiadmin.queue.repository.TaskRepository;
import aiadmin.queue.scheduler.RetentionReaper;
import aiadmin.queue.scheduler.Scheduler;
import aiadmin.queue.server.QueueNettyServer;
import aiadmin.queue.server.RouterHandler;
import aiadmin.queue.service.TaskService;
import aiadmin.queue.store.Database;
import aiadmin.queue.store.JdbcTaskRepository;
import aiadmin.queue.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the queue components.
 * 
 * Usage:
 * 
 * <pre>
 * Dependencies deps = Dependencies.create(QueueConfig.fromEnv());
 * deps.start(); // recover, start workers and scheduler
 * String id = deps.taskService().submit("docker_push", null, params);
 * // ...
 * deps.close(); // stop workers, scheduler, database
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QueueConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final KeyedPendingQueue pendingQueue;
    private final ExecutorRegistry executorRegistry;
    private final SequenceAllocator sequence;
    private final WorkerPool workerPool;
    private final TaskService taskService;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final QueueController queueController;

    // Lazily created
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private QueueNettyServer server;

    private Dependencies(QueueConfig config, List<TaskExecutor> executors) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskRepository = new JdbcTaskRepository(database);

        // Queue core
        this.pendingQueue = new KeyedPendingQueue();
        this.executorRegistry = new ExecutorRegistry();
        executors.forEach(executorRegistry::register);
        this.sequence = SequenceAllocator.startingAfter(taskRepository.maxSeq());

        // Services
        this.workerPool = new WorkerPool(taskRepository, pendingQueue, executorRegistry, sequence, config);
        this.taskService = new TaskService(taskRepository, pendingQueue, executorRegistry, sequence, workerPool,
                config);

        // Controllers
        this.healthController = new HealthController(database, taskService, workerPool);
        this.taskController = new TaskController(taskService);
        this.queueController = new QueueController(taskService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and executors.
     */
    public static Dependencies create(QueueConfig config, List<TaskExecutor> executors) {
        return new Dependencies(config, executors);
    }

    /**
     * Create dependencies with the built-in executors.
     */
    public static Dependencies create(QueueConfig config) {
        return create(config, List.of(new DockerPushExecutor()));
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(QueueConfig.fromEnv());
    }

    // Getters
    public QueueConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public KeyedPendingQueue pendingQueue() {
        return pendingQueue;
    }

    public ExecutorRegistry executorRegistry() {
        return executorRegistry;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public TaskService taskService() {
        return taskService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(queueController);
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler()
                    .every("retention-reaper", config.retentionSweepInterval(),
                            new RetentionReaper(taskRepository, config));
        }
        return scheduler;
    }

    public synchronized QueueNettyServer server() {
        if (server == null) {
            server = new QueueNettyServer(routerHandler());
        }
        return server;
    }

    /**
     * Recover persisted tasks and start the workers and the retention scheduler.
     */
    public void start() {
        workerPool.start();
        scheduler().start();
    }

    /**
     * Start workers and scheduler, then serve HTTP.
     *
     * @return the bound port
     */
    public int startServer() {
        start();
        return server().start(config.serverHost(), config.serverPort());
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        taskService.shutdown();

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            workerPool.shutdown();
        } catch (Exception e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
