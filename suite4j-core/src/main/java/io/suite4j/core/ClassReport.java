package io.suite4j.core;

import java.time.Instant;
import java.util.List;

/**
 * Terminal report for one class.
 *
 * <ul>
 *   <li>outcome      : COMPLETED or RETIRED</li>
 *   <li>retiredReason: exhausted budget when retired; null when completed</li>
 *   <li>results      : method results accepted during the final attempt</li>
 * </ul>
 */
public record ClassReport(
        String runId,
        String classPath,
        List<String> methods,
        List<String> fixtureMethods,
        String lastRunner,
        int failureCount,
        int timeoutCount,
        FinalOutcome outcome,
        RetiredReason retiredReason,
        List<MethodResult> results,
        Instant finishedAt
) {
    public boolean isCompleted() {
        return outcome == FinalOutcome.COMPLETED;
    }
}
