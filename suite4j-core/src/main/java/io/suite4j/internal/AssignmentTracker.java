package io.suite4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Live checkouts, one per class path, each with its own deadline timer.
 *
 * <p>Timers are scheduled on the owning event loop, so a deadline never runs concurrently with a
 * check-in. {@link #disarm(Checkout)} is idempotent: disarming a checkout that already fired or
 * was already disarmed does nothing.
 *
 * <p>Not thread-safe; event loop only.
 */
public final class AssignmentTracker {
    private static final Logger log = LoggerFactory.getLogger(AssignmentTracker.class);

    @FunctionalInterface
    public interface DeadlineListener {
        void onDeadline(String runnerId, String classPath);
    }

    /**
     * Token for one armed checkout.
     */
    public static final class Checkout {
        private final String runnerId;
        private final String classPath;
        private final long deadlineNanos;
        private final Instant deadline;
        private ScheduledFuture<?> timer;

        private Checkout(String runnerId, String classPath, long deadlineNanos, Instant deadline) {
            this.runnerId = runnerId;
            this.classPath = classPath;
            this.deadlineNanos = deadlineNanos;
            this.deadline = deadline;
        }

        public String runnerId() {
            return runnerId;
        }

        public String classPath() {
            return classPath;
        }

        /**
         * Deadline on the tracker's monotonic clock; this is what the timer is armed against.
         */
        public long deadlineNanos() {
            return deadlineNanos;
        }

        /**
         * Wall-clock snapshot of the deadline, for runners and reports.
         */
        public Instant deadline() {
            return deadline;
        }

        @Override
        public String toString() {
            return "Checkout{runnerId=" + runnerId + ", classPath=" + classPath + ", deadline=" + deadline + "}";
        }
    }

    private final ScheduledExecutorService loop;
    private final DeadlineListener listener;
    private final LongSupplier nanoClock;
    private final Map<String, Checkout> live = new HashMap<>();

    public AssignmentTracker(ScheduledExecutorService loop, DeadlineListener listener) {
        this(loop, listener, System::nanoTime);
    }

    AssignmentTracker(ScheduledExecutorService loop, DeadlineListener listener, LongSupplier nanoClock) {
        this.loop = Objects.requireNonNull(loop, "loop must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
    }

    /**
     * Record a checkout and start its deadline timer.
     *
     * @throws IllegalStateException if the class is already checked out
     */
    public Checkout arm(String runnerId, String classPath, Duration timeout) {
        Objects.requireNonNull(runnerId, "runnerId must not be null");
        Objects.requireNonNull(classPath, "classPath must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        Checkout existing = live.get(classPath);
        if (existing != null) {
            throw new IllegalStateException("class " + classPath + " is already checked out by " + existing.runnerId);
        }

        Checkout checkout = new Checkout(runnerId, classPath, nanoClock.getAsLong() + timeout.toNanos(), Instant.now().plus(timeout));
        live.put(classPath, checkout);
        checkout.timer = loop.schedule(() -> fire(checkout), timeout.toNanos(), TimeUnit.NANOSECONDS);
        return checkout;
    }

    /**
     * Cancel the deadline and forget the checkout.
     *
     * @return true if the checkout was still live
     */
    public boolean disarm(Checkout checkout) {
        if (checkout == null || live.get(checkout.classPath) != checkout) {
            return false;
        }
        live.remove(checkout.classPath);
        if (checkout.timer != null) {
            checkout.timer.cancel(false);
        }
        return true;
    }

    /**
     * Disarm every live checkout without notifying the listener.
     */
    public List<Checkout> disarmAll() {
        List<Checkout> disarmed = new ArrayList<>(live.values());
        for (Checkout c : disarmed) {
            if (c.timer != null) {
                c.timer.cancel(false);
            }
        }
        live.clear();
        return disarmed;
    }

    public Optional<Checkout> find(String classPath) {
        return Optional.ofNullable(live.get(classPath));
    }

    public boolean isEmpty() {
        return live.isEmpty();
    }

    public int size() {
        return live.size();
    }

    // The listener decides what to do and disarms; a token that is no longer live is ignored.
    private void fire(Checkout checkout) {
        if (live.get(checkout.classPath) != checkout) {
            return;
        }
        log.debug("checkout deadline reached runnerId={} classPath={}", checkout.runnerId, checkout.classPath);
        try {
            listener.onDeadline(checkout.runnerId, checkout.classPath);
        } catch (RuntimeException e) {
            log.error("deadline handling failed runnerId={} classPath={} msg={}",
                    checkout.runnerId, checkout.classPath, e.getMessage(), e);
        }
    }
}
