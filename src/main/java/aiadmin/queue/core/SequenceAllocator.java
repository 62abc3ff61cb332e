package aiadmin.queue.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out increasing queue sequence numbers. Submissions and retries both draw from it,
 * so a retried task lands behind everything already queued for its key.
 */
public final class SequenceAllocator {

    private final AtomicLong last;

    private SequenceAllocator(long start) {
        this.last = new AtomicLong(start);
    }

    /**
     * @param highest largest sequence already persisted
     */
    public static SequenceAllocator startingAfter(long highest) {
        return new SequenceAllocator(Math.max(0L, highest));
    }

    public long next() {
        return last.incrementAndGet();
    }
}
