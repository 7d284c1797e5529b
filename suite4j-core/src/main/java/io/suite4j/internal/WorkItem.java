package io.suite4j.internal;

import io.suite4j.core.MethodResult;
import io.suite4j.core.WorkItemSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable scheduling state of one test class. Only touched from the event loop.
 */
public final class WorkItem {

    public enum State {
        QUEUED,
        CHECKED_OUT,
        COMPLETED,
        RETIRED;

        public boolean isTerminal() {
            return this == COMPLETED || this == RETIRED;
        }
    }

    private final WorkItemSpec spec;
    private String lastRunner;
    private int failureCount;
    private int timeoutCount;
    private State state = State.QUEUED;

    // current attempt only
    private final List<MethodResult> attemptResults = new ArrayList<>();
    private final Set<String> passedMethods = new HashSet<>();

    public WorkItem(WorkItemSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    public WorkItemSpec spec() {
        return spec;
    }

    public String classPath() {
        return spec.classPath();
    }

    public String lastRunner() {
        return lastRunner;
    }

    public int failureCount() {
        return failureCount;
    }

    public int timeoutCount() {
        return timeoutCount;
    }

    public State state() {
        return state;
    }

    public int attempt() {
        return failureCount + timeoutCount + 1;
    }

    public List<MethodResult> attemptResults() {
        return List.copyOf(attemptResults);
    }

    void checkOut(String runnerId) {
        if (state != State.QUEUED) {
            throw new IllegalStateException("cannot check out " + classPath() + " in state " + state);
        }
        state = State.CHECKED_OUT;
        lastRunner = runnerId;
        attemptResults.clear();
        passedMethods.clear();
    }

    /**
     * Records a passing result and returns true when every method of the class has now passed.
     */
    boolean recordPass(MethodResult result) {
        attemptResults.add(result);
        if (spec.methods().contains(result.method())) {
            passedMethods.add(result.method());
        }
        return passedMethods.size() == spec.methods().size();
    }

    void recordFailure(MethodResult result) {
        attemptResults.add(result);
        failureCount++;
    }

    void recordTimeout() {
        timeoutCount++;
    }

    boolean isKnownMethod(String method) {
        return spec.methods().contains(method) || spec.fixtureMethods().contains(method);
    }

    void requeued() {
        state = State.QUEUED;
    }

    void completed() {
        state = State.COMPLETED;
    }

    void retired() {
        state = State.RETIRED;
    }

    @Override
    public String toString() {
        return "WorkItem{classPath=" + classPath()
                + ", state=" + state
                + ", lastRunner=" + lastRunner
                + ", failures=" + failureCount
                + ", timeouts=" + timeoutCount + "}";
    }
}
