package io.suite4j.core;

/**
 * Which retry budget a retired class exhausted.
 */
public enum RetiredReason {
    MAX_FAILURES,
    MAX_TIMEOUTS
}
