package aiadmin.queue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one queued unit of work.
 * Every read from the store returns a fresh snapshot; transitions produce new rows, never
 * mutate an instance.
 */
public final class Task {
    private final String id;
    private final String key; // contention key, e.g. "registry/repo:tag"
    private final TaskKind kind;
    private final String params; // JSON object, interpreted only by the executor
    private final TaskState state;
    private final long seq;
    private final int attemptCount;
    private final int maxAttempts;
    private final boolean cancelRequested;
    private final String errorMessage;
    private final String result; // JSON, SUCCEEDED/FAILED only
    private final int progress;
    private final String currentStep;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.params = builder.params != null ? builder.params : "{}";
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.seq = builder.seq;
        this.attemptCount = builder.attemptCount;
        this.maxAttempts = builder.maxAttempts;
        this.cancelRequested = builder.cancelRequested;
        this.errorMessage = builder.errorMessage;
        this.result = builder.result;
        this.progress = builder.progress;
        this.currentStep = builder.currentStep;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String key() {
        return key;
    }

    public TaskKind kind() {
        return kind;
    }

    public String params() {
        return params;
    }

    public TaskState state() {
        return state;
    }

    public long seq() {
        return seq;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String result() {
        return result;
    }

    public int progress() {
        return progress;
    }

    public String currentStep() {
        return currentStep;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** Check if another attempt fits in the retry budget */
    public boolean canRetry() {
        return attemptCount < maxAttempts;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .key(key)
                .kind(kind)
                .params(params)
                .state(state)
                .seq(seq)
                .attemptCount(attemptCount)
                .maxAttempts(maxAttempts)
                .cancelRequested(cancelRequested)
                .errorMessage(errorMessage)
                .result(result)
                .progress(progress)
                .currentStep(currentStep)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String key;
        private TaskKind kind;
        private String params;
        private TaskState state = TaskState.PENDING;
        private long seq;
        private int attemptCount = 0;
        private int maxAttempts = 3;
        private boolean cancelRequested;
        private String errorMessage;
        private String result;
        private int progress;
        private String currentStep;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder params(String params) {
            this.params = params;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder seq(long seq) {
            this.seq = seq;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            this.attemptCount = attemptCount;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', kind=" + kind + ", key='" + key + "', state=" + state
                + ", attempts=" + attemptCount + "/" + maxAttempts + "}";
    }
}
