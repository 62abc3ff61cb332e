package aiadmin.queue.worker;

import aiadmin.queue.config.QueueConfig;

import java.time.Duration;

/**
 * Exponential backoff between attempts: {@code min(base * 2^(attempt-1), max)}.
 */
public final class RetryPolicy {

    private final Duration base;
    private final Duration max;

    public RetryPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
        this.base = base;
        this.max = max;
    }

    public static RetryPolicy from(QueueConfig config) {
        return new RetryPolicy(config.backoffBase(), config.backoffMax());
    }

    /**
     * Delay before the attempt that follows {@code completedAttempt}.
     *
     * @param completedAttempt 1-based number of the attempt that just failed
     */
    public Duration delayAfter(int completedAttempt) {
        int exponent = Math.max(0, completedAttempt - 1);
        long baseMillis = base.toMillis();
        if (baseMillis == 0) {
            return Duration.ZERO;
        }
        // 2^exponent overflows long beyond 62; clamp early
        if (exponent >= 62 || baseMillis > (Long.MAX_VALUE >> exponent)) {
            return max;
        }
        long delay = baseMillis << exponent;
        return delay >= max.toMillis() ? max : Duration.ofMillis(delay);
    }
}
