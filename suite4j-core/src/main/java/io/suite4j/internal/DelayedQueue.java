package io.suite4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Work items ordered by availability time, with asynchronous takers.
 *
 * <p>Entries become eligible once their availability time has passed; among eligible entries the
 * earliest inserted wins. {@link #takeNext(String)} prefers an item the requester did not hold
 * last, but falls back to the requester's own item rather than waiting for another one to show
 * up. Requests that find nothing eligible are parked and served in arrival order on the next
 * {@link #put}, on a wake-up timer for delayed entries, or resolved empty by {@link #close()}.
 *
 * <p>Not thread-safe: every method must be called on the owning event loop, which is also where
 * the wake-up timers run.
 */
public final class DelayedQueue {
    private static final Logger log = LoggerFactory.getLogger(DelayedQueue.class);

    private static final class Entry implements Comparable<Entry> {
        private final long availableAt;
        private final long sequence;
        private final WorkItem item;

        private Entry(long availableAt, long sequence, WorkItem item) {
            this.availableAt = availableAt;
            this.sequence = sequence;
            this.item = item;
        }

        @Override
        public int compareTo(Entry other) {
            int byTime = Long.compare(this.availableAt - other.availableAt, 0L);
            if (byTime != 0) {
                return byTime;
            }
            return Long.compare(this.sequence, other.sequence);
        }
    }

    private record Waiter(String requesterId, CompletableFuture<Optional<WorkItem>> future) {
    }

    private final ScheduledExecutorService loop;
    private final LongSupplier nanoClock;

    private final TreeSet<Entry> entries = new TreeSet<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();

    private long sequence;
    private boolean closed;
    private boolean dispatching;

    private ScheduledFuture<?> wakeup;
    private long wakeupAt;

    public DelayedQueue(ScheduledExecutorService loop) {
        this(loop, System::nanoTime);
    }

    DelayedQueue(ScheduledExecutorService loop, LongSupplier nanoClock) {
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
    }

    /**
     * Insert an item that becomes eligible after {@code delay}. Zero (or negative) means now.
     */
    public void put(Duration delay, WorkItem item) {
        Objects.requireNonNull(item, "item must not be null");
        long delayNanos = (delay == null || delay.isNegative()) ? 0L : delay.toNanos();
        entries.add(new Entry(nanoClock.getAsLong() + delayNanos, sequence++, item));
        if (!closed) {
            dispatch();
        }
    }

    /**
     * Resolve with the next eligible item for {@code requesterId}, or empty once the queue is closed.
     */
    public CompletableFuture<Optional<WorkItem>> takeNext(String requesterId) {
        if (closed) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CompletableFuture<Optional<WorkItem>> future = new CompletableFuture<>();
        waiters.addLast(new Waiter(requesterId, future));
        dispatch();
        return future;
    }

    /**
     * Resolve every parked request with empty; later requests resolve empty immediately.
     * Entries stay in place until {@link #drain()}.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cancelWakeup();

        Waiter waiter;
        int resolved = 0;
        while ((waiter = waiters.pollFirst()) != null) {
            if (waiter.future().complete(Optional.empty())) {
                resolved++;
            }
        }
        log.debug("queue closed remainingEntries={} resolvedWaiters={}", entries.size(), resolved);
    }

    /**
     * Remove and return every entry, eligible or not, in queue order.
     */
    public List<WorkItem> drain() {
        List<WorkItem> drained = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            drained.add(e.item);
        }
        entries.clear();
        return drained;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public int pendingRequests() {
        return waiters.size();
    }

    // Serves parked requests in arrival order. Completing a future may re-enter put/takeNext
    // from a dependent stage; the flag turns those into plain inserts that this loop picks up.
    private void dispatch() {
        if (dispatching) {
            return;
        }
        dispatching = true;
        try {
            while (!waiters.isEmpty() && !closed) {
                Waiter head = waiters.peekFirst();
                if (head.future().isDone()) {
                    waiters.pollFirst();
                    continue;
                }

                Entry picked = pickEligible(head.requesterId(), nanoClock.getAsLong());
                if (picked == null) {
                    break;
                }

                waiters.pollFirst();
                entries.remove(picked);
                if (!head.future().complete(Optional.of(picked.item))) {
                    // cancelled by the requester in the meantime
                    entries.add(picked);
                }
            }
            scheduleWakeup();
        } finally {
            dispatching = false;
        }
    }

    // One bounded pass: the first eligible entry not last held by the requester, else the first
    // eligible entry at all.
    private Entry pickEligible(String requesterId, long now) {
        Entry fallback = null;
        for (Entry e : entries) {
            if (e.availableAt - now > 0) {
                break;
            }
            if (!Objects.equals(requesterId, e.item.lastRunner())) {
                return e;
            }
            if (fallback == null) {
                fallback = e;
            }
        }
        return fallback;
    }

    private void scheduleWakeup() {
        if (closed || waiters.isEmpty() || entries.isEmpty()) {
            cancelWakeup();
            return;
        }

        long next = entries.first().availableAt;
        if (wakeup != null && !wakeup.isDone() && wakeupAt == next) {
            return;
        }
        cancelWakeup();

        long delay = Math.max(0L, next - nanoClock.getAsLong());
        wakeupAt = next;
        wakeup = loop.schedule(this::onWakeup, delay, TimeUnit.NANOSECONDS);
    }

    private void onWakeup() {
        wakeup = null;
        try {
            dispatch();
        } catch (RuntimeException e) {
            log.error("queue wake-up dispatch failed msg={}", e.getMessage(), e);
        }
    }

    private void cancelWakeup() {
        if (wakeup != null) {
            wakeup.cancel(false);
            wakeup = null;
        }
    }
}
