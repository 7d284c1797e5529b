package io.suite4j.config;

import java.time.Duration;

/**
 * Runtime configuration for the run coordinator.
 */
public class SchedulerProperties {
    private int maxFailures = 2; // per class
    private int maxTimeouts = 2; // per class
    private Duration runnerTimeout = Duration.ofMinutes(5); // per checkout
    private Duration serverTimeout = Duration.ofHours(1); // whole run; zero disables
    private Duration shutdownGrace = Duration.ofSeconds(5);
    private Duration requeueDelay = Duration.ZERO;
    private String runId;

    public int getMaxFailures() {
        return maxFailures;
    }

    public void setMaxFailures(int maxFailures) {
        this.maxFailures = maxFailures;
    }

    public int getMaxTimeouts() {
        return maxTimeouts;
    }

    public void setMaxTimeouts(int maxTimeouts) {
        this.maxTimeouts = maxTimeouts;
    }

    public Duration getRunnerTimeout() {
        return runnerTimeout;
    }

    public void setRunnerTimeout(Duration runnerTimeout) {
        this.runnerTimeout = runnerTimeout;
    }

    public Duration getServerTimeout() {
        return serverTimeout;
    }

    public void setServerTimeout(Duration serverTimeout) {
        this.serverTimeout = serverTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public Duration getRequeueDelay() {
        return requeueDelay;
    }

    public void setRequeueDelay(Duration requeueDelay) {
        this.requeueDelay = requeueDelay;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }
}
