package io.suite4j.core;

import java.util.Objects;

/**
 * Outcome of a single test or fixture method, as reported by a runner.
 *
 * @param message optional failure message or stack trace; null for passing methods
 */
public record MethodResult(
        String classPath,
        String method,
        Outcome outcome,
        String message
) {
    public MethodResult {
        Objects.requireNonNull(classPath, "classPath must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static MethodResult passed(String classPath, String method) {
        return new MethodResult(classPath, method, Outcome.PASS, null);
    }

    public static MethodResult failed(String classPath, String method, String message) {
        return new MethodResult(classPath, method, Outcome.FAIL, message);
    }
}
