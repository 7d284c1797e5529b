package io.suite4j.internal.mongo;

import io.suite4j.core.FinalOutcome;
import io.suite4j.core.RetiredReason;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for the result of one class within one run.
 *
 * <p>{@code history} grows with every accepted method result, across attempts; the terminal fields
 * ({@code outcome}, {@code results}, ...) are written once the class is finalized.
 */
@Document(collection = "suite_class_results")
public class ClassResultDocument {

    @Id
    private String id;

    private String runId;
    private String classPath;
    private List<String> methods;
    private List<String> fixtureMethods;
    private String lastRunner;

    private int failureCount;
    private int timeoutCount;
    private FinalOutcome outcome;
    private RetiredReason retiredReason;

    private List<Map<String, Object>> results;
    private List<Map<String, Object>> history;
    private Instant finishedAt;

    public ClassResultDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getClassPath() {
        return classPath;
    }

    public void setClassPath(String classPath) {
        this.classPath = classPath;
    }

    public List<String> getMethods() {
        return methods;
    }

    public void setMethods(List<String> methods) {
        this.methods = methods;
    }

    public List<String> getFixtureMethods() {
        return fixtureMethods;
    }

    public void setFixtureMethods(List<String> fixtureMethods) {
        this.fixtureMethods = fixtureMethods;
    }

    public String getLastRunner() {
        return lastRunner;
    }

    public void setLastRunner(String lastRunner) {
        this.lastRunner = lastRunner;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    public int getTimeoutCount() {
        return timeoutCount;
    }

    public void setTimeoutCount(int timeoutCount) {
        this.timeoutCount = timeoutCount;
    }

    public FinalOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(FinalOutcome outcome) {
        this.outcome = outcome;
    }

    public RetiredReason getRetiredReason() {
        return retiredReason;
    }

    public void setRetiredReason(RetiredReason retiredReason) {
        this.retiredReason = retiredReason;
    }

    public List<Map<String, Object>> getResults() {
        return results;
    }

    public void setResults(List<Map<String, Object>> results) {
        this.results = results;
    }

    public List<Map<String, Object>> getHistory() {
        return history;
    }

    public void setHistory(List<Map<String, Object>> history) {
        this.history = history;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }
}
