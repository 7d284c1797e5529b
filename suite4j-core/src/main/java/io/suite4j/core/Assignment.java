package io.suite4j.core;

import java.time.Instant;
import java.util.List;

/**
 * A class handed to a runner. Snapshot taken at checkout time.
 *
 * @param attempt  1-based attempt number (previous failures + timeouts + 1)
 * @param deadline wall-clock time after which the checkout counts as timed out
 */
public record Assignment(
        String runId,
        String runnerId,
        String classPath,
        List<String> methods,
        List<String> fixtureMethods,
        int attempt,
        int failureCount,
        int timeoutCount,
        Instant deadline
) {
}
