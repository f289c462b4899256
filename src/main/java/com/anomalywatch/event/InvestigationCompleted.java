package com.anomalywatch.event;

import java.time.Instant;

/**
 * Event published when an execution completed successfully.
 *
 * resultCount is the reconciled counter: it equals the number of stored results
 * of the execution at the moment the execution became terminal.
 */
public record InvestigationCompleted(
    String investigatorId,
    Long executionId,
    long resultCount,
    Instant timestamp
) {
    public InvestigationCompleted {
        if (investigatorId == null || investigatorId.isBlank()) {
            throw new IllegalArgumentException("Investigator ID cannot be null or empty");
        }
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        if (resultCount < 0) {
            throw new IllegalArgumentException("Result count cannot be negative");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
