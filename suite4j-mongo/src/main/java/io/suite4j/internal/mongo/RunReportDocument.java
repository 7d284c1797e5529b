package io.suite4j.internal.mongo;

import io.suite4j.core.RunEndReason;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for one run; the id is the run id.
 */
@Document(collection = "suite_runs")
public class RunReportDocument {

    @Id
    private String id;

    private RunEndReason reason;
    private int discovered;
    private int completed;
    private int retired;
    private int abandoned;
    private int runnersSeen;
    private Instant startedAt;
    private Instant finishedAt;

    private Map<String, Object> discoveryFailure;

    public RunReportDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public RunEndReason getReason() {
        return reason;
    }

    public void setReason(RunEndReason reason) {
        this.reason = reason;
    }

    public int getDiscovered() {
        return discovered;
    }

    public void setDiscovered(int discovered) {
        this.discovered = discovered;
    }

    public int getCompleted() {
        return completed;
    }

    public void setCompleted(int completed) {
        this.completed = completed;
    }

    public int getRetired() {
        return retired;
    }

    public void setRetired(int retired) {
        this.retired = retired;
    }

    public int getAbandoned() {
        return abandoned;
    }

    public void setAbandoned(int abandoned) {
        this.abandoned = abandoned;
    }

    public int getRunnersSeen() {
        return runnersSeen;
    }

    public void setRunnersSeen(int runnersSeen) {
        this.runnersSeen = runnersSeen;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public Map<String, Object> getDiscoveryFailure() {
        return discoveryFailure;
    }

    public void setDiscoveryFailure(Map<String, Object> discoveryFailure) {
        this.discoveryFailure = discoveryFailure;
    }
}
