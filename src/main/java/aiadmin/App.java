package aiadmin;

import aiadmin.queue.config.Dependencies;
import aiadmin.queue.config.QueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point: starts the task queue and its HTTP API, and stops both on JVM shutdown.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        QueueConfig config = QueueConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping task queue...");
            try {
                deps.close();
            } finally {
                stopped.countDown();
            }
        }, "queue-shutdown"));

        try {
            int port = deps.startServer();
            log.info("ai-admin task queue started on port {}", port);
        } catch (RuntimeException e) {
            log.error("Failed to start task queue", e);
            // the shutdown hook closes the dependencies
            System.exit(1);
        }

        stopped.await();
    }
}
