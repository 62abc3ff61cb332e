package aiadmin.queue.config;

import java.time.Duration;

/**
 * Configuration holder for the task queue.
 * All settings have sensible defaults.
 */
public final class QueueConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/ai-admin-queue;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8060;
    private String serverHost = "0.0.0.0";

    // Worker settings
    private int concurrency = 2;
    private int maxAttempts = 3;
    private Duration attemptTimeout = Duration.ofMinutes(30);
    private Duration cancelPollInterval = Duration.ofMillis(200);

    // Retry backoff
    private Duration backoffBase = Duration.ofSeconds(2);
    private Duration backoffMax = Duration.ofMinutes(5);

    // Retention of finished tasks
    private Duration retention = Duration.ofHours(24);
    private Duration retentionSweepInterval = Duration.ofMinutes(1);

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    public static QueueConfig fromEnv() {
        QueueConfig config = new QueueConfig();

        String dbUrl = System.getenv("AI_ADMIN_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("AI_ADMIN_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String concurrency = System.getenv("AI_ADMIN_CONCURRENCY");
        if (concurrency != null && !concurrency.isBlank()) {
            config.concurrency = Integer.parseInt(concurrency);
        }

        String maxAttempts = System.getenv("AI_ADMIN_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxAttempts = Integer.parseInt(maxAttempts);
        }

        String timeout = System.getenv("AI_ADMIN_ATTEMPT_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.attemptTimeout = Duration.ofSeconds(Long.parseLong(timeout));
        }

        String retention = System.getenv("AI_ADMIN_RETENTION_HOURS");
        if (retention != null && !retention.isBlank()) {
            config.retention = Duration.ofHours(Long.parseLong(retention));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int concurrency() {
        return concurrency;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration attemptTimeout() {
        return attemptTimeout;
    }

    public Duration cancelPollInterval() {
        return cancelPollInterval;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    public Duration backoffMax() {
        return backoffMax;
    }

    public Duration retention() {
        return retention;
    }

    public Duration retentionSweepInterval() {
        return retentionSweepInterval;
    }

    // Fluent setters for testing/customization
    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QueueConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public QueueConfig withConcurrency(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.concurrency = concurrency;
        return this;
    }

    public QueueConfig withMaxAttempts(int attempts) {
        if (attempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = attempts;
        return this;
    }

    public QueueConfig withAttemptTimeout(Duration timeout) {
        this.attemptTimeout = timeout;
        return this;
    }

    public QueueConfig withCancelPollInterval(Duration interval) {
        this.cancelPollInterval = interval;
        return this;
    }

    public QueueConfig withBackoff(Duration base, Duration max) {
        this.backoffBase = base;
        this.backoffMax = max;
        return this;
    }

    public QueueConfig withRetention(Duration retention) {
        this.retention = retention;
        return this;
    }

    public QueueConfig withRetentionSweepInterval(Duration interval) {
        this.retentionSweepInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", concurrency=" + concurrency +
                ", maxAttempts=" + maxAttempts +
                ", attemptTimeout=" + attemptTimeout +
                ", backoff=" + backoffBase + ".." + backoffMax +
                ", retention=" + retention +
                '}';
    }
}
