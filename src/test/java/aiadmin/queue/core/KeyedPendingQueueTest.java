package aiadmin.queue.core;

import aiadmin.queue.core.KeyedPendingQueue.Claim;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class KeyedPendingQueueTest {

    private final AtomicLong clock = new AtomicLong(1_000_000L);
    private final KeyedPendingQueue queue = new KeyedPendingQueue(clock::get);

    private Optional<Claim> pollNow() throws InterruptedException {
        return queue.poll(0, TimeUnit.MILLISECONDS);
    }

    @Test
    void lowestSequenceAcrossKeysWins() throws Exception {
        queue.enqueue("b", "k2", 2);
        queue.enqueue("a", "k1", 1);
        queue.enqueue("c", "k3", 3);

        assertEquals("a", pollNow().orElseThrow().taskId());
        assertEquals("b", pollNow().orElseThrow().taskId());
        assertEquals("c", pollNow().orElseThrow().taskId());
        assertTrue(pollNow().isEmpty());
    }

    @Test
    void sameKeyWaitsForRelease() throws Exception {
        queue.enqueue("a", "repo:tag", 1);
        queue.enqueue("b", "repo:tag", 2);
        queue.enqueue("c", "other:tag", 3);

        Claim first = pollNow().orElseThrow();
        assertEquals("a", first.taskId());
        assertTrue(queue.isLocked("repo:tag"));

        // b is blocked by the key lock; c is free
        assertEquals("c", pollNow().orElseThrow().taskId());
        assertTrue(pollNow().isEmpty());

        queue.release("repo:tag");
        assertEquals("b", pollNow().orElseThrow().taskId());
    }

    @Test
    void bucketsStaySortedWhenEnqueuedOutOfOrder() throws Exception {
        queue.enqueue("third", "k", 30);
        queue.enqueue("first", "k", 10);
        queue.enqueue("second", "k", 20);

        assertEquals("first", pollNow().orElseThrow().taskId());
        queue.release("k");
        assertEquals("second", pollNow().orElseThrow().taskId());
        queue.release("k");
        assertEquals("third", pollNow().orElseThrow().taskId());
    }

    @Test
    void duplicateEnqueueIgnored() {
        queue.enqueue("a", "k", 1);
        queue.enqueue("a", "k", 1);
        assertEquals(1, queue.size());
    }

    @Test
    void removeDropsTask() throws Exception {
        queue.enqueue("a", "k", 1);
        queue.enqueue("b", "k", 2);

        assertTrue(queue.remove("a"));
        assertFalse(queue.remove("a"));
        assertFalse(queue.contains("a"));

        assertEquals("b", pollNow().orElseThrow().taskId());
    }

    @Test
    void delayedHeadBlocksItsKeyUntilEligible() throws Exception {
        queue.enqueue("a", "k", 1);
        Claim claim = pollNow().orElseThrow();

        // a fails and goes back with a backoff; b queued behind it
        queue.requeueAndRelease(claim.taskId(), "k", 10, TimeUnit.SECONDS.toNanos(2));
        queue.enqueue("b", "k", 11);
        queue.enqueue("x", "free", 12);

        assertFalse(queue.isLocked("k"));
        assertEquals("x", pollNow().orElseThrow().taskId());
        assertTrue(pollNow().isEmpty(), "k is backing off, b must not overtake a");

        clock.addAndGet(TimeUnit.SECONDS.toNanos(2));
        assertEquals("a", pollNow().orElseThrow().taskId());
        assertTrue(pollNow().isEmpty());
        queue.release("k");
        assertEquals("b", pollNow().orElseThrow().taskId());
    }

    @Test
    void pauseStopsSelection() throws Exception {
        queue.enqueue("a", "k", 1);
        queue.pause();

        assertTrue(queue.isPaused());
        assertTrue(pollNow().isEmpty());
        assertEquals(1, queue.size());

        queue.resume();
        assertEquals("a", pollNow().orElseThrow().taskId());
    }

    @Test
    void closeWakesBlockedTake() throws Exception {
        KeyedPendingQueue realQueue = new KeyedPendingQueue();
        CompletableFuture<Optional<Claim>> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return realQueue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        assertFalse(taken.isDone());

        realQueue.close();
        assertTrue(taken.get(2, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void blockedTakeWakesOnEnqueue() throws Exception {
        KeyedPendingQueue realQueue = new KeyedPendingQueue();
        CompletableFuture<Optional<Claim>> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return realQueue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        realQueue.enqueue("a", "k", 1);

        assertEquals("a", taken.get(2, TimeUnit.SECONDS).orElseThrow().taskId());
    }

    @Test
    void blockedTakeWakesOnRelease() throws Exception {
        KeyedPendingQueue realQueue = new KeyedPendingQueue();
        realQueue.enqueue("a", "k", 1);
        realQueue.enqueue("b", "k", 2);
        realQueue.take();

        CompletableFuture<Optional<Claim>> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return realQueue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        assertFalse(taken.isDone());

        realQueue.release("k");
        assertEquals("b", taken.get(2, TimeUnit.SECONDS).orElseThrow().taskId());
    }

    @Test
    void timedWaitForBackoffWithRealClock() throws Exception {
        KeyedPendingQueue realQueue = new KeyedPendingQueue();
        realQueue.enqueue("a", "k", 1, TimeUnit.MILLISECONDS.toNanos(150));

        long start = System.nanoTime();
        Optional<Claim> claim = realQueue.poll(2, TimeUnit.SECONDS);
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals("a", claim.orElseThrow().taskId());
        assertTrue(waitedMs >= 100, "waited " + waitedMs + "ms");
    }
}
