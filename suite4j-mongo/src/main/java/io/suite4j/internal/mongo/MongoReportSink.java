package io.suite4j.internal.mongo;

import io.suite4j.ReportSink;
import io.suite4j.core.ClassReport;
import io.suite4j.core.DiscoveryFailure;
import io.suite4j.core.MethodResult;
import io.suite4j.core.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Persists run results to MongoDB. Store failures propagate to the caller, which logs them.
 */
public class MongoReportSink implements ReportSink {
    private static final Logger log = LoggerFactory.getLogger(MongoReportSink.class);

    private final MongoResultStore store;
    private final boolean recordMethodHistory;

    public MongoReportSink(MongoResultStore store) {
        this(store, true);
    }

    public MongoReportSink(MongoResultStore store, boolean recordMethodHistory) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.recordMethodHistory = recordMethodHistory;
    }

    @Override
    public void methodCompleted(String runId, String runnerId, MethodResult result) {
        if (recordMethodHistory) {
            store.appendMethodResult(runId, runnerId, result);
        }
    }

    @Override
    public void classFinished(ClassReport report) {
        boolean created = store.saveClassResult(report);
        log.debug("stored class result runId={} classPath={} outcome={} created={}",
                report.runId(), report.classPath(), report.outcome(), created);
    }

    @Override
    public void discoveryFailed(String runId, DiscoveryFailure failure) {
        store.saveDiscoveryFailure(runId, failure);
    }

    @Override
    public void runFinished(RunSummary summary) {
        store.saveRun(summary);
        log.info("stored run summary runId={} reason={}", summary.runId(), summary.reason());
    }
}
