package aiadmin.queue.model;

import java.util.Optional;

/**
 * Operation type of a queued task. Selects the executor that runs it.
 * <p>
 * Only {@link #DOCKER_PUSH} ships with an executor. The other kinds are admitted once an
 * executor for them is passed to {@code Dependencies.create(config, executors)}; until then
 * submitting them is rejected as a validation error.
 */
public enum TaskKind {
    DOCKER_PUSH("docker_push"),
    DOCKER_BUILD("docker_build"),
    DOCKER_PULL("docker_pull"),
    OLLAMA_PULL("ollama_pull"),
    OLLAMA_RUN("ollama_run");

    private final String wireName;

    TaskKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a kind from its wire name ("docker_push") or enum name ("DOCKER_PUSH").
     */
    public static Optional<TaskKind> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        for (TaskKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(v) || kind.name().equalsIgnoreCase(v)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
