package io.suite4j.core;

import java.time.Instant;

/**
 * End-of-run counters.
 *
 * discovered : classes accepted from discovery
 * completed  : classes whose methods all passed
 * retired    : classes dropped after exhausting a retry budget
 * abandoned  : classes still queued or checked out when the run ended
 */
public record RunSummary(
        String runId,
        RunEndReason reason,
        int discovered,
        int completed,
        int retired,
        int abandoned,
        int runnersSeen,
        Instant startedAt,
        Instant finishedAt
) {
}
