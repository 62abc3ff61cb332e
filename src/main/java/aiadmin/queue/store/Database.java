package aiadmin.queue.store;

import aiadmin.queue.config.QueueConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Pooled connections to the task store plus its schema.
 * <p>
 * Connections come with auto-commit off; callers commit each statement themselves.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private static final List<String> SCHEMA = List.of(
            """
                    CREATE TABLE IF NOT EXISTS tasks (
                        id               VARCHAR(64) PRIMARY KEY,
                        task_key         VARCHAR(512) NOT NULL,
                        kind             VARCHAR(32) NOT NULL,
                        params           CLOB NOT NULL,
                        state            VARCHAR(20) DEFAULT 'PENDING',
                        seq              BIGINT NOT NULL,
                        attempt_count    INT DEFAULT 0,
                        max_attempts     INT DEFAULT 3,
                        cancel_requested BOOLEAN DEFAULT FALSE,
                        error_message    VARCHAR(4096),
                        result           CLOB,
                        progress         INT DEFAULT 0,
                        current_step     VARCHAR(512),
                        created_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                        started_at       TIMESTAMP,
                        finished_at      TIMESTAMP
                    )
                    """,
            // markRunning busy-key check
            "CREATE INDEX IF NOT EXISTS idx_tasks_key_state ON tasks(task_key, state)",
            // recovery scans
            "CREATE INDEX IF NOT EXISTS idx_tasks_state_seq ON tasks(state, seq)",
            "CREATE INDEX IF NOT EXISTS idx_tasks_created ON tasks(created_at, seq)",
            // retention sweep
            "CREATE INDEX IF NOT EXISTS idx_tasks_finished ON tasks(finished_at)");

    private final HikariDataSource dataSource;

    public Database(QueueConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("queue-db");
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setMaximumPoolSize(poolSize);
        hikari.setMinimumIdle(Math.min(2, poolSize));
        hikari.setConnectionTimeout(5_000);
        hikari.setIdleTimeout(300_000);
        hikari.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikari);
        log.info("Task store pool open: {} (max {} connections)", jdbcUrl, poolSize);

        createSchema();
    }

    /**
     * Borrow a connection; close it to return it to the pool.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * True if a pooled connection passes a validity check within two seconds.
     */
    public boolean isHealthy() {
        if (dataSource.isClosed()) {
            return false;
        }
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void createSchema() {
        try (Connection conn = getConnection(); Statement st = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                st.execute(ddl);
            }
            conn.commit();
            log.info("Task store schema ready");
        } catch (SQLException e) {
            dataSource.close();
            throw new IllegalStateException("Failed to create task store schema", e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("Task store pool closed");
        }
    }
}
