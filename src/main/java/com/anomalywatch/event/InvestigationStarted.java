package com.anomalywatch.event;

import java.time.Instant;

/**
 * Event published when an investigator starts a run.
 *
 * Always published before any InvestigationResultAdded of the same execution.
 */
public record InvestigationStarted(
    String investigatorId,    // InvestigatorInstance id (also the Kafka key)
    Long executionId,
    Instant timestamp
) {
    public InvestigationStarted {
        if (investigatorId == null || investigatorId.isBlank()) {
            throw new IllegalArgumentException("Investigator ID cannot be null or empty");
        }
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
