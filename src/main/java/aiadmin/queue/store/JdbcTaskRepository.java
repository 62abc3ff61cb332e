package aiadmin.queue.store;

import aiadmin.queue.model.Task;
import aiadmin.queue.model.TaskFilter;
import aiadmin.queue.model.TaskKind;
import aiadmin.queue.model.TaskState;
import aiadmin.queue.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Each transition is one conditional UPDATE committed on its own, so a reader sees either
 * the state before or after it.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, task_key, kind, params, state, seq, attempt_count, max_attempts,
                                       cancel_requested, error_message, result, progress, current_step,
                                       created_at, started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.key());
            ps.setString(3, task.kind().name());
            ps.setString(4, task.params());
            ps.setString(5, task.state().name());
            ps.setLong(6, task.seq());
            ps.setInt(7, task.attemptCount());
            ps.setInt(8, task.maxAttempts());
            ps.setBoolean(9, task.cancelRequested());
            ps.setString(10, task.errorMessage());
            ps.setString(11, task.result());
            ps.setInt(12, task.progress());
            ps.setString(13, task.currentStep());
            setTimestamp(ps, 14, task.createdAt() != null ? task.createdAt() : Instant.now());
            setTimestamp(ps, 15, task.startedAt());
            setTimestamp(ps, 16, task.finishedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findAll(TaskFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE 1 = 1");
        List<String> args = new ArrayList<>();
        if (filter.state() != null) {
            sql.append(" AND state = ?");
            args.add(filter.state().name());
        }
        if (filter.key() != null) {
            sql.append(" AND task_key = ?");
            args.add(filter.key());
        }
        sql.append(" ORDER BY created_at, seq");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < args.size(); i++) {
                ps.setString(i + 1, args.get(i));
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    @Override
    public List<Task> findByState(TaskState state) {
        String sql = "SELECT * FROM tasks WHERE state = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, state.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks by state: " + state, e);
        }
    }

    @Override
    public Map<TaskState, Integer> countByState() {
        String sql = "SELECT state, COUNT(*) FROM tasks GROUP BY state";

        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            counts.put(state, 0);
        }

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                counts.put(TaskState.valueOf(rs.getString(1)), rs.getInt(2));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks", e);
        }
    }

    @Override
    public int countRunningByKey(String key) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE task_key = ? AND state = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count running tasks for key: " + key, e);
        }
    }

    @Override
    public long maxSeq() {
        String sql = "SELECT COALESCE(MAX(seq), 0) FROM tasks";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read max sequence", e);
        }
    }

    @Override
    public boolean markRunning(String taskId, Instant startedAt) {
        // The NOT EXISTS clause keeps the single-flight rule in the store as well
        String sql = """
                    UPDATE tasks t
                    SET state = 'RUNNING', started_at = ?, attempt_count = attempt_count + 1,
                        progress = 0, current_step = NULL
                    WHERE t.id = ? AND t.state = 'PENDING'
                      AND NOT EXISTS (
                          SELECT 1 FROM tasks r WHERE r.task_key = t.task_key AND r.state = 'RUNNING'
                      )
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedAt);
            ps.setString(2, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} moved to RUNNING", taskId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to start task: " + taskId, e);
        }
    }

    @Override
    public boolean markSucceeded(String taskId, String result, Instant finishedAt) {
        String sql = """
                    UPDATE tasks
                    SET state = 'SUCCEEDED', result = ?, finished_at = ?, progress = 100, error_message = NULL
                    WHERE id = ? AND state = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result);
            setTimestamp(ps, 2, finishedAt);
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete task: " + taskId, e);
        }
    }

    @Override
    public boolean markFailed(String taskId, String errorMessage, String result, Instant finishedAt) {
        String sql = """
                    UPDATE tasks
                    SET state = 'FAILED', error_message = ?, result = ?, finished_at = ?
                    WHERE id = ? AND state = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(errorMessage));
            ps.setString(2, result);
            setTimestamp(ps, 3, finishedAt);
            ps.setString(4, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} marked as FAILED: {}", taskId, errorMessage);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark task as failed: " + taskId, e);
        }
    }

    @Override
    public boolean requeueForRetry(String taskId, long seq, String errorMessage) {
        String sql = """
                    UPDATE tasks
                    SET state = 'PENDING', seq = ?, error_message = ?, started_at = NULL
                    WHERE id = ? AND state = 'RUNNING' AND cancel_requested = FALSE
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, seq);
            ps.setString(2, truncate(errorMessage));
            ps.setString(3, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} returned to PENDING for retry", taskId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to requeue task: " + taskId, e);
        }
    }

    @Override
    public boolean cancelIfPending(String taskId, Instant finishedAt) {
        String sql = """
                    UPDATE tasks
                    SET state = 'CANCELLED', cancel_requested = TRUE, finished_at = ?
                    WHERE id = ? AND state = 'PENDING'
                """;
        return cancelUpdate(sql, taskId, finishedAt);
    }

    @Override
    public boolean requestCancel(String taskId) {
        String sql = "UPDATE tasks SET cancel_requested = TRUE WHERE id = ? AND state = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to request cancel for task: " + taskId, e);
        }
    }

    @Override
    public boolean markCancelled(String taskId, Instant finishedAt) {
        String sql = """
                    UPDATE tasks
                    SET state = 'CANCELLED', cancel_requested = TRUE, finished_at = ?
                    WHERE id = ? AND state = 'RUNNING'
                """;
        return cancelUpdate(sql, taskId, finishedAt);
    }

    @Override
    public boolean isCancelRequested(String taskId) {
        String sql = "SELECT cancel_requested FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cancel flag: " + taskId, e);
        }
    }

    @Override
    public void updateProgress(String taskId, int progress, String step) {
        String sql = "UPDATE tasks SET progress = ?, current_step = ? WHERE id = ? AND state = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, Math.max(0, Math.min(100, progress)));
            ps.setString(2, step);
            ps.setString(3, taskId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update progress: " + taskId, e);
        }
    }

    @Override
    public boolean resetToPending(String taskId, long seq) {
        String sql = """
                    UPDATE tasks
                    SET state = 'PENDING', seq = ?, started_at = NULL
                    WHERE id = ? AND state = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, seq);
            ps.setString(2, taskId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset task: " + taskId, e);
        }
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        String sql = """
                    DELETE FROM tasks
                    WHERE state IN ('SUCCEEDED', 'FAILED', 'CANCELLED') AND finished_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to evict finished tasks", e);
        }
    }

    @Override
    public int deleteFinished() {
        String sql = "DELETE FROM tasks WHERE state IN ('SUCCEEDED', 'FAILED', 'CANCELLED')";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear finished tasks", e);
        }
    }

    // Helper methods

    private boolean cancelUpdate(String sql, String taskId, Instant finishedAt) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, finishedAt);
            ps.setString(2, taskId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} cancelled", taskId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel task: " + taskId, e);
        }
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .key(rs.getString("task_key"))
                .kind(TaskKind.valueOf(rs.getString("kind")))
                .params(rs.getString("params"))
                .state(TaskState.valueOf(rs.getString("state")))
                .seq(rs.getLong("seq"))
                .attemptCount(rs.getInt("attempt_count"))
                .maxAttempts(rs.getInt("max_attempts"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .errorMessage(rs.getString("error_message"))
                .result(rs.getString("result"))
                .progress(rs.getInt("progress"))
                .currentStep(rs.getString("current_step"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 4096) {
            return message;
        }
        return message.substring(0, 4093) + "...";
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
