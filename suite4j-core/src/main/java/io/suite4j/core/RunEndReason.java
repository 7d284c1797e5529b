package io.suite4j.core;

public enum RunEndReason {
    /** Every class was completed or retired. */
    EXHAUSTED,
    DISCOVERY_FAILED,
    /** The overall server budget elapsed. */
    SERVER_TIMEOUT,
    SHUTDOWN
}
