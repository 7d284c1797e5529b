package io.suite4j;

import io.suite4j.core.ClassReport;
import io.suite4j.core.DiscoveryFailure;
import io.suite4j.core.MethodResult;
import io.suite4j.core.RunSummary;

/**
 * Receives the outcome of a run. Called on the scheduler's event loop, so implementations should
 * not block for long.
 */
public interface ReportSink {

    /**
     * A method result accepted from the runner currently holding the class.
     */
    default void methodCompleted(String runId, String runnerId, MethodResult result) throws Exception {
    }

    /**
     * Terminal report for one class: completed, or retired after exhausting a retry budget.
     * Called at most once per class.
     */
    void classFinished(ClassReport report) throws Exception;

    default void discoveryFailed(String runId, DiscoveryFailure failure) throws Exception {
    }

    /**
     * Called once when the run ends.
     */
    default void runFinished(RunSummary summary) throws Exception {
    }
}
