package aiadmin.queue.model;

/**
 * Optional state/key filter for listing tasks. Null fields match everything.
 */
public record TaskFilter(TaskState state, String key) {

    public static TaskFilter all() {
        return new TaskFilter(null, null);
    }

    public static TaskFilter byState(TaskState state) {
        return new TaskFilter(state, null);
    }

    public static TaskFilter byKey(String key) {
        return new TaskFilter(null, key);
    }

    public boolean matches(Task task) {
        if (state != null && task.state() != state) {
            return false;
        }
        return key == null || key.equals(task.key());
    }
}
