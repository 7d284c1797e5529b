package io.suite4j.internal;

import io.suite4j.ReportSink;
import io.suite4j.Scheduler;
import io.suite4j.config.SchedulerProperties;
import io.suite4j.core.Assignment;
import io.suite4j.core.ClassReport;
import io.suite4j.core.DiscoveryResult;
import io.suite4j.core.FinalOutcome;
import io.suite4j.core.MethodResult;
import io.suite4j.core.RetiredReason;
import io.suite4j.core.RunEndReason;
import io.suite4j.core.RunSummary;
import io.suite4j.core.WorkItemSpec;
import io.suite4j.internal.AssignmentTracker.Checkout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory run coordinator backed by a single event-loop thread.
 *
 * <p>Per class the state machine is:
 * <pre>
 *   QUEUED -> CHECKED_OUT -> COMPLETED
 *                         -> RETIRED      (failureCount or timeoutCount reached its limit)
 *                         -> QUEUED       (failure / timeout within budget, or release)
 * </pre>
 *
 * <p>All state lives on the loop: public methods only enqueue work onto it, and deadline timers,
 * queue wake-ups and the server budget are scheduled on it too. A timeout and a check-in for the
 * same class are therefore strictly ordered, and whichever arrives second finds no live checkout
 * and is ignored.
 *
 * <p>The run ends when every class is completed or retired, when discovery fails, when the server
 * budget elapses, or on {@link #shutdown()}. The loop then lingers for the shutdown grace period
 * so in-flight replies can drain, and terminates.
 */
public class EventLoopScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

    @FunctionalInterface
    private interface SinkCall {
        void accept(ReportSink sink) throws Exception;
    }

    private final SchedulerProperties props;
    private final ReportSink reportSink;
    private final String runId;

    private final ScheduledThreadPoolExecutor loop;
    private final DelayedQueue queue;
    private final AssignmentTracker tracker;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<RunSummary> termination = new CompletableFuture<>();
    private volatile ScheduledFuture<?> serverBudget;
    private volatile Instant startedAt;

    // event loop only
    private final Map<String, WorkItem> items = new LinkedHashMap<>();
    private final Set<String> runners = new HashSet<>();
    private boolean discovered;
    private boolean ended;
    private int completed;
    private int retired;

    public EventLoopScheduler(SchedulerProperties props, ReportSink reportSink) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink must not be null");
        this.runId = resolveRunId(props.getRunId());

        this.loop = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("suite4j.eventLoop");
            t.setDaemon(true);
            return t;
        });
        this.loop.setRemoveOnCancelPolicy(true);
        this.loop.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        this.queue = new DelayedQueue(loop);
        this.tracker = new AssignmentTracker(loop, this::onDeadlineFired);
    }

    @Override
    public void start() {
        if (started.get()) {
            return;
        }

        if (props.getMaxFailures() < 1) {
            throw new IllegalArgumentException("suite4j.maxFailures must be at least 1");
        }
        if (props.getMaxTimeouts() < 1) {
            throw new IllegalArgumentException("suite4j.maxTimeouts must be at least 1");
        }
        Duration runnerTimeout = Objects.requireNonNull(props.getRunnerTimeout(), "suite4j.runnerTimeout must not be null");
        if (runnerTimeout.isZero() || runnerTimeout.isNegative()) {
            throw new IllegalArgumentException("suite4j.runnerTimeout must be a positive duration");
        }
        Duration serverTimeout = Objects.requireNonNull(props.getServerTimeout(), "suite4j.serverTimeout must not be null");
        if (serverTimeout.isNegative()) {
            throw new IllegalArgumentException("suite4j.serverTimeout must not be negative");
        }
        Duration grace = Objects.requireNonNull(props.getShutdownGrace(), "suite4j.shutdownGrace must not be null");
        if (grace.isNegative()) {
            throw new IllegalArgumentException("suite4j.shutdownGrace must not be negative");
        }
        if (props.getRequeueDelay() != null && props.getRequeueDelay().isNegative()) {
            throw new IllegalArgumentException("suite4j.requeueDelay must not be negative");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        startedAt = Instant.now();
        log.info("Scheduler starting runId={} maxFailures={} maxTimeouts={} runnerTimeout={} serverTimeout={} shutdownGrace={}",
                runId,
                props.getMaxFailures(),
                props.getMaxTimeouts(),
                runnerTimeout,
                serverTimeout,
                grace);

        if (!serverTimeout.isZero()) {
            serverBudget = loop.schedule(() -> {
                if (!ended) {
                    log.warn("server timeout elapsed runId={} serverTimeout={}", runId, serverTimeout);
                    endRun(RunEndReason.SERVER_TIMEOUT);
                }
            }, serverTimeout.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    @Override
    public void shutdown() {
        if (!started.get()) {
            return;
        }
        submit("shutdown", () -> endRun(RunEndReason.SHUTDOWN));
    }

    /**
     * Shut down and wait for the loop to terminate. Should be idempotent.
     */
    @Override
    public void stop() {
        if (!started.get()) {
            loop.shutdownNow();
            return;
        }

        shutdown();

        long waitMillis = props.getShutdownGrace().toMillis() + 5_000L;
        try {
            if (!loop.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler loop did not terminate in time runId={}; forcing", runId);
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }
    }

    @Override
    public CompletableFuture<Void> enqueueDiscovered(DiscoveryResult discovery) {
        Objects.requireNonNull(discovery, "discovery must not be null");
        return submit("enqueueDiscovered", () -> acceptDiscovery(discovery));
    }

    @Override
    public CompletableFuture<Optional<Assignment>> requestWork(String runnerId) {
        Objects.requireNonNull(runnerId, "runnerId must not be null");
        ensureStarted();

        CompletableFuture<Optional<Assignment>> result = new CompletableFuture<>();
        try {
            loop.execute(() -> takeFor(runnerId, result));
        } catch (RejectedExecutionException e) {
            result.complete(Optional.empty());
        }
        return result;
    }

    @Override
    public CompletableFuture<Void> reportResult(String runnerId, MethodResult result) {
        Objects.requireNonNull(runnerId, "runnerId must not be null");
        Objects.requireNonNull(result, "result must not be null");
        return submit("reportResult", () -> acceptResult(runnerId, result));
    }

    @Override
    public CompletableFuture<Void> checkInClass(String runnerId, String classPath, boolean timedOut) {
        Objects.requireNonNull(runnerId, "runnerId must not be null");
        Objects.requireNonNull(classPath, "classPath must not be null");
        return submit("checkInClass", () -> checkIn(runnerId, classPath, timedOut));
    }

    @Override
    public CompletableFuture<RunSummary> termination() {
        return termination.copy();
    }

    @Override
    public String runId() {
        return runId;
    }

    private void ensureStarted() {
        if (!started.get()) {
            throw new IllegalStateException("Scheduler has not been started");
        }
    }

    private CompletableFuture<Void> submit(String operation, Runnable action) {
        ensureStarted();
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    action.run();
                    done.complete(null);
                } catch (RuntimeException e) {
                    log.error("scheduler {} failed runId={} msg={}", operation, runId, e.getMessage(), e);
                    done.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("scheduler loop terminated; ignoring {} runId={}", operation, runId);
            done.complete(null);
        }
        return done;
    }

    // ---------------------------------------------------------------------------------------------
    // Everything below runs on the event loop.
    // ---------------------------------------------------------------------------------------------

    private void acceptDiscovery(DiscoveryResult discovery) {
        if (discovered) {
            throw new IllegalStateException("discovery already enqueued for run " + runId);
        }
        if (ended) {
            log.warn("run already ended; ignoring discovery runId={} discovery={}", runId, discovery);
            return;
        }

        if (discovery.isFailure()) {
            discovered = true;
            log.error("discovery failed runId={} msg={}", runId, discovery.failure().message());
            notifySink(sink -> sink.discoveryFailed(runId, discovery.failure()));
            endRun(RunEndReason.DISCOVERY_FAILED);
            return;
        }

        Set<String> seen = new HashSet<>();
        for (WorkItemSpec spec : discovery.items()) {
            if (!seen.add(spec.classPath())) {
                throw new IllegalArgumentException("duplicate classPath in discovery: " + spec.classPath());
            }
        }

        discovered = true;
        for (WorkItemSpec spec : discovery.items()) {
            WorkItem item = new WorkItem(spec);
            items.put(spec.classPath(), item);
            queue.put(Duration.ZERO, item);
        }
        log.info("enqueued discovered classes runId={} count={}", runId, items.size());

        finishIfExhausted();
    }

    private void takeFor(String runnerId, CompletableFuture<Optional<Assignment>> result) {
        if (result.isDone()) {
            return;
        }
        runners.add(runnerId);

        CompletableFuture<Optional<WorkItem>> next = queue.takeNext(runnerId);
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                next.cancel(false);
            }
        });

        // The queue only completes its futures on the loop; a cancellation completes on the caller
        // thread, which is why that branch touches no state.
        next.whenComplete((item, e) -> {
            if (e != null || item == null || item.isEmpty()) {
                result.complete(Optional.empty());
                return;
            }

            Assignment assignment;
            try {
                assignment = checkOut(runnerId, item.get());
            } catch (RuntimeException ex) {
                log.error("checkout failed runnerId={} classPath={} msg={}",
                        runnerId, item.get().classPath(), ex.getMessage(), ex);
                result.completeExceptionally(ex);
                return;
            }
            if (!result.complete(Optional.of(assignment))) {
                log.debug("request cancelled before hand-off; releasing runnerId={} classPath={}",
                        runnerId, assignment.classPath());
                tracker.find(assignment.classPath()).ifPresent(this::release);
            }
        });
    }

    private Assignment checkOut(String runnerId, WorkItem item) {
        item.checkOut(runnerId);
        Checkout checkout = tracker.arm(runnerId, item.classPath(), props.getRunnerTimeout());

        log.debug("handed out classPath={} runnerId={} attempt={} deadline={}",
                item.classPath(), runnerId, item.attempt(), checkout.deadline());

        WorkItemSpec spec = item.spec();
        return new Assignment(
                runId,
                runnerId,
                spec.classPath(),
                spec.methods(),
                spec.fixtureMethods(),
                item.attempt(),
                item.failureCount(),
                item.timeoutCount(),
                checkout.deadline()
        );
    }

    private void acceptResult(String runnerId, MethodResult result) {
        Checkout checkout = liveCheckout(runnerId, result.classPath());
        if (checkout == null) {
            log.debug("ignoring stale result runnerId={} classPath={} method={}",
                    runnerId, result.classPath(), result.method());
            return;
        }

        WorkItem item = items.get(result.classPath());
        if (!item.isKnownMethod(result.method())) {
            // a failure anywhere in the class still fails the attempt
            if (!result.outcome().isFailure()) {
                log.warn("ignoring result for unknown method runnerId={} classPath={} method={}",
                        runnerId, result.classPath(), result.method());
                return;
            }
            log.debug("failure reported for unlisted method runnerId={} classPath={} method={}",
                    runnerId, result.classPath(), result.method());
        }

        notifySink(sink -> sink.methodCompleted(runId, runnerId, result));

        if (result.outcome().isFailure()) {
            tracker.disarm(checkout);
            item.recordFailure(result);
            if (item.failureCount() >= props.getMaxFailures()) {
                retire(item, RetiredReason.MAX_FAILURES);
            } else {
                requeue(item, "failure");
            }
        } else if (item.recordPass(result)) {
            tracker.disarm(checkout);
            complete(item);
        }
    }

    private void checkIn(String runnerId, String classPath, boolean timedOut) {
        Checkout checkout = liveCheckout(runnerId, classPath);
        if (checkout == null) {
            log.debug("ignoring stale check-in runnerId={} classPath={} timedOut={}", runnerId, classPath, timedOut);
            return;
        }

        if (timedOut) {
            timeOut(checkout);
        } else {
            release(checkout);
        }
    }

    private void onDeadlineFired(String runnerId, String classPath) {
        Checkout checkout = liveCheckout(runnerId, classPath);
        if (checkout != null) {
            timeOut(checkout);
        }
    }

    private void timeOut(Checkout checkout) {
        tracker.disarm(checkout);
        WorkItem item = items.get(checkout.classPath());
        item.recordTimeout();
        log.info("checkout timed out runnerId={} classPath={} timeouts={}",
                checkout.runnerId(), checkout.classPath(), item.timeoutCount());

        if (item.timeoutCount() >= props.getMaxTimeouts()) {
            retire(item, RetiredReason.MAX_TIMEOUTS);
        } else {
            requeue(item, "timeout");
        }
    }

    // Back to the queue without touching the counters.
    private void release(Checkout checkout) {
        tracker.disarm(checkout);
        WorkItem item = items.get(checkout.classPath());
        item.requeued();
        queue.put(Duration.ZERO, item);
        log.debug("released classPath={} runnerId={}", checkout.classPath(), checkout.runnerId());
    }

    private void requeue(WorkItem item, String cause) {
        item.requeued();
        Duration delay = props.getRequeueDelay() == null ? Duration.ZERO : props.getRequeueDelay();
        queue.put(delay, item);
        log.info("requeued classPath={} cause={} failures={} timeouts={}",
                item.classPath(), cause, item.failureCount(), item.timeoutCount());
    }

    private void complete(WorkItem item) {
        item.completed();
        completed++;
        log.debug("completed classPath={} runner={}", item.classPath(), item.lastRunner());
        finalizeItem(item, FinalOutcome.COMPLETED, null);
        finishIfExhausted();
    }

    private void retire(WorkItem item, RetiredReason reason) {
        item.retired();
        retired++;
        log.warn("retired classPath={} reason={} failures={} timeouts={} lastRunner={}",
                item.classPath(), reason, item.failureCount(), item.timeoutCount(), item.lastRunner());
        finalizeItem(item, FinalOutcome.RETIRED, reason);
        finishIfExhausted();
    }

    private void finalizeItem(WorkItem item, FinalOutcome outcome, RetiredReason reason) {
        WorkItemSpec spec = item.spec();
        ClassReport report = new ClassReport(
                runId,
                spec.classPath(),
                spec.methods(),
                spec.fixtureMethods(),
                item.lastRunner(),
                item.failureCount(),
                item.timeoutCount(),
                outcome,
                reason,
                item.attemptResults(),
                Instant.now()
        );
        notifySink(sink -> sink.classFinished(report));
    }

    private Checkout liveCheckout(String runnerId, String classPath) {
        return tracker.find(classPath)
                .filter(c -> c.runnerId().equals(runnerId))
                .orElse(null);
    }

    private void finishIfExhausted() {
        if (discovered && !ended && queue.isEmpty() && tracker.isEmpty()) {
            endRun(RunEndReason.EXHAUSTED);
        }
    }

    private void endRun(RunEndReason reason) {
        if (ended) {
            return;
        }
        ended = true;

        ScheduledFuture<?> budget = serverBudget;
        if (budget != null) {
            budget.cancel(false);
        }

        queue.close();
        List<Checkout> inFlight = tracker.disarmAll();
        List<WorkItem> queued = queue.drain();

        RunSummary summary = new RunSummary(
                runId,
                reason,
                items.size(),
                completed,
                retired,
                inFlight.size() + queued.size(),
                runners.size(),
                startedAt,
                Instant.now()
        );

        log.info("run finished runId={} reason={} discovered={} completed={} retired={} abandoned={} runners={}",
                runId, reason, summary.discovered(), completed, retired, summary.abandoned(), summary.runnersSeen());

        notifySink(sink -> sink.runFinished(summary));
        termination.complete(summary);

        loop.schedule(loop::shutdown, props.getShutdownGrace().toNanos(), TimeUnit.NANOSECONDS);
    }

    private void notifySink(SinkCall call) {
        try {
            call.accept(reportSink);
        } catch (Exception e) {
            log.error("report sink failed runId={} msg={}", runId, e.getMessage(), e);
        }
    }

    private String resolveRunId(String configuredRunId) {
        if (configuredRunId != null && !configuredRunId.isBlank()) {
            return configuredRunId;
        }

        String host = "suite4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("could not resolve local host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
