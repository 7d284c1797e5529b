package io.suite4j.core;

import io.suite4j.ReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans every notification out to a fixed list of sinks. A failing sink is logged and does not
 * keep the remaining sinks from being notified.
 */
public class CompositeReportSink implements ReportSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeReportSink.class);

    private final List<ReportSink> sinks;

    public CompositeReportSink(List<? extends ReportSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public List<ReportSink> sinks() {
        return sinks;
    }

    @Override
    public void methodCompleted(String runId, String runnerId, MethodResult result) {
        for (ReportSink sink : sinks) {
            try {
                sink.methodCompleted(runId, runnerId, result);
            } catch (Exception e) {
                log.error("report sink failed on methodCompleted sink={} classPath={} method={} msg={}",
                        sink.getClass().getSimpleName(), result.classPath(), result.method(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void classFinished(ClassReport report) {
        for (ReportSink sink : sinks) {
            try {
                sink.classFinished(report);
            } catch (Exception e) {
                log.error("report sink failed on classFinished sink={} classPath={} msg={}",
                        sink.getClass().getSimpleName(), report.classPath(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void discoveryFailed(String runId, DiscoveryFailure failure) {
        for (ReportSink sink : sinks) {
            try {
                sink.discoveryFailed(runId, failure);
            } catch (Exception e) {
                log.error("report sink failed on discoveryFailed sink={} runId={} msg={}",
                        sink.getClass().getSimpleName(), runId, e.getMessage(), e);
            }
        }
    }

    @Override
    public void runFinished(RunSummary summary) {
        for (ReportSink sink : sinks) {
            try {
                sink.runFinished(summary);
            } catch (Exception e) {
                log.error("report sink failed on runFinished sink={} runId={} msg={}",
                        sink.getClass().getSimpleName(), summary.runId(), e.getMessage(), e);
            }
        }
    }
}
