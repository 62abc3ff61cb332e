package aiadmin.queue.core;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * In-memory scheduling order of PENDING tasks plus the per-key lock table.
 * <p>
 * Tasks are grouped in per-key buckets ordered by sequence number. A task is selectable
 * only when it is the head of its bucket, its key is not locked by a running task and its
 * backoff delay has elapsed. Among selectable heads the lowest sequence wins.
 * <p>
 * Workers block in {@link #take()} on a condition that is signalled on enqueue, key
 * release, resume and close; when the only blocker is a backoff delay the wait is timed to
 * the earliest eligibility instant. Times come from a monotonic nanosecond clock.
 */
public final class KeyedPendingQueue {

    /**
     * A task handed to a worker. The worker owns {@code key} until it calls
     * {@link #release(String)}.
     */
    public record Claim(String taskId, String key) {
    }

    private record Entry(String taskId, String key, long seq, long eligibleAtNanos) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, ArrayDeque<Entry>> buckets = new HashMap<>();
    private final Map<String, String> keyByTask = new HashMap<>();
    private final Set<String> lockedKeys = new HashSet<>();
    private final LongSupplier nanoClock;

    private boolean paused;
    private boolean closed;

    public KeyedPendingQueue() {
        this(System::nanoTime);
    }

    public KeyedPendingQueue(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * Append a task that is eligible immediately.
     */
    public void enqueue(String taskId, String key, long seq) {
        enqueue(taskId, key, seq, 0L);
    }

    /**
     * Add a task to its key bucket, eligible after {@code delayNanos}.
     * Buckets stay sorted by sequence, so recovery may enqueue in any order.
     */
    public void enqueue(String taskId, String key, long seq, long delayNanos) {
        lock.lock();
        try {
            if (keyByTask.containsKey(taskId)) {
                return;
            }
            long eligibleAt = nanoClock.getAsLong() + Math.max(0L, delayNanos);
            Entry entry = new Entry(taskId, key, seq, eligibleAt);
            ArrayDeque<Entry> bucket = buckets.computeIfAbsent(key, k -> new ArrayDeque<>());
            if (bucket.isEmpty() || bucket.peekLast().seq() < seq) {
                bucket.addLast(entry);
            } else {
                insertSorted(bucket, entry);
            }
            keyByTask.put(taskId, key);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a task from the queue.
     *
     * @return true if the task was queued and is now removed
     */
    public boolean remove(String taskId) {
        lock.lock();
        try {
            String key = keyByTask.remove(taskId);
            if (key == null) {
                return false;
            }
            ArrayDeque<Entry> bucket = buckets.get(key);
            if (bucket != null) {
                bucket.removeIf(e -> e.taskId().equals(taskId));
                if (bucket.isEmpty()) {
                    buckets.remove(key);
                }
            }
            // The removed task may have been blocking its bucket with a backoff delay
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until a task is selectable, then remove it and lock its key.
     *
     * @return the claim, or empty once the queue is closed
     */
    public Optional<Claim> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed) {
                long now = nanoClock.getAsLong();
                Selection selection = select(now);
                if (selection.entry() != null) {
                    return Optional.of(claim(selection.entry()));
                }
                if (selection.nextEligibleInNanos() > 0) {
                    changed.awaitNanos(selection.nextEligibleInNanos());
                } else {
                    changed.await();
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code timeout} for a selectable task.
     */
    public Optional<Claim> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed) {
                Selection selection = select(nanoClock.getAsLong());
                if (selection.entry() != null) {
                    return Optional.of(claim(selection.entry()));
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }
                long wait = selection.nextEligibleInNanos() > 0
                        ? Math.min(remaining, selection.nextEligibleInNanos())
                        : remaining;
                long before = System.nanoTime();
                changed.awaitNanos(wait);
                remaining -= System.nanoTime() - before;
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unlock a key taken by {@link #take()} and wake waiting workers.
     */
    public void release(String key) {
        lock.lock();
        try {
            lockedKeys.remove(key);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-queue a task and release its key in one step, so no other worker can observe the
     * key free while the task is missing from its bucket.
     */
    public void requeueAndRelease(String taskId, String key, long seq, long delayNanos) {
        lock.lock();
        try {
            enqueue(taskId, key, seq, delayNanos);
            lockedKeys.remove(key);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Stop handing out tasks; queued tasks stay queued. */
    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /** Wake all waiting workers and make {@link #take()} return empty from now on. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return keyByTask.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String key) {
        lock.lock();
        try {
            return lockedKeys.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return keyByTask.size();
        } finally {
            lock.unlock();
        }
    }

    public int lockedKeyCount() {
        lock.lock();
        try {
            return lockedKeys.size();
        } finally {
            lock.unlock();
        }
    }

    // -- caller holds lock --

    private Selection select(long now) {
        if (paused) {
            return new Selection(null, 0L);
        }
        Entry best = null;
        long nextEligibleIn = 0L;
        for (Map.Entry<String, ArrayDeque<Entry>> bucket : buckets.entrySet()) {
            if (lockedKeys.contains(bucket.getKey())) {
                continue;
            }
            Entry head = bucket.getValue().peekFirst();
            if (head == null) {
                continue;
            }
            long wait = head.eligibleAtNanos() - now;
            if (wait > 0) {
                if (nextEligibleIn == 0L || wait < nextEligibleIn) {
                    nextEligibleIn = wait;
                }
                continue;
            }
            if (best == null || head.seq() < best.seq()) {
                best = head;
            }
        }
        return new Selection(best, nextEligibleIn);
    }

    private Claim claim(Entry entry) {
        ArrayDeque<Entry> bucket = buckets.get(entry.key());
        bucket.pollFirst();
        if (bucket.isEmpty()) {
            buckets.remove(entry.key());
        }
        keyByTask.remove(entry.taskId());
        lockedKeys.add(entry.key());
        return new Claim(entry.taskId(), entry.key());
    }

    private static void insertSorted(ArrayDeque<Entry> bucket, Entry entry) {
        ArrayDeque<Entry> sorted = new ArrayDeque<>(bucket.size() + 1);
        boolean inserted = false;
        Iterator<Entry> it = bucket.iterator();
        while (it.hasNext()) {
            Entry current = it.next();
            if (!inserted && entry.seq() < current.seq()) {
                sorted.addLast(entry);
                inserted = true;
            }
            sorted.addLast(current);
        }
        if (!inserted) {
            sorted.addLast(entry);
        }
        bucket.clear();
        bucket.addAll(sorted);
    }

    private record Selection(Entry entry, long nextEligibleInNanos) {
    }
}
