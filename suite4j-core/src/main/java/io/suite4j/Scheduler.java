package io.suite4j;

import io.suite4j.core.Assignment;
import io.suite4j.core.DiscoveryResult;
import io.suite4j.core.MethodResult;
import io.suite4j.core.Outcome;
import io.suite4j.core.RunSummary;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Coordinates a test run across remote runners.
 *
 * <p>Every operation is marshalled onto a single event loop, so callers may invoke them from any
 * thread. The returned futures complete on that loop.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 * scheduler.enqueueDiscovered(DiscoveryResult.of(specs));
 *
 * // per runner
 * scheduler.requestWork("runner-1").thenAccept(next -> next.ifPresent(this::execute));
 * scheduler.reportResult("runner-1", "pkg.FooTest", "testBar", Outcome.PASS);
 *
 * scheduler.termination().join();
 * }</pre>
 */
public interface Scheduler {

    /**
     * Start the event loop and arm the overall server budget. Idempotent.
     */
    void start();

    /**
     * Request shutdown and wait for the event loop to drain. Idempotent.
     */
    void stop();

    /**
     * End the run: close the queue (pending requests resolve empty) and abandon every live
     * checkout without penalty. Does not wait.
     */
    void shutdown();

    /**
     * Feed the discovered classes (or the discovery failure) into the run. Accepted once.
     */
    CompletableFuture<Void> enqueueDiscovered(DiscoveryResult discovery);

    /**
     * Ask for the next class to run. Resolves empty once the run is over; otherwise waits until a
     * class becomes available.
     */
    CompletableFuture<Optional<Assignment>> requestWork(String runnerId);

    /**
     * Record the outcome of one method. Reports for a class the runner no longer holds are ignored.
     */
    CompletableFuture<Void> reportResult(String runnerId, MethodResult result);

    default CompletableFuture<Void> reportResult(String runnerId, String classPath, String method, Outcome outcome) {
        return reportResult(runnerId, new MethodResult(classPath, method, outcome, null));
    }

    /**
     * Explicit check-in. {@code timedOut=true} applies the timeout policy out of band;
     * {@code timedOut=false} releases the class without touching its counters.
     */
    CompletableFuture<Void> checkInClass(String runnerId, String classPath, boolean timedOut);

    /**
     * Completes with the run summary once the run has ended, whatever the reason.
     */
    CompletableFuture<RunSummary> termination();

    String runId();
}
