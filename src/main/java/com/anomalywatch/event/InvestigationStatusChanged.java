package com.anomalywatch.event;

import com.anomalywatch.model.ExecutionStatus;

import java.time.Instant;

/**
 * Event published when an execution reaches a terminal status.
 */
public record InvestigationStatusChanged(
    String investigatorId,
    Long executionId,
    ExecutionStatus status,
    Instant timestamp
) {
    public InvestigationStatusChanged {
        if (investigatorId == null || investigatorId.isBlank()) {
            throw new IllegalArgumentException("Investigator ID cannot be null or empty");
        }
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
