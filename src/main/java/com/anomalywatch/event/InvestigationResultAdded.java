package com.anomalywatch.event;

import com.anomalywatch.model.ResultSeverity;

import java.time.Instant;

/**
 * Event published after a finding has been stored.
 *
 * Carries the stored result (with its database id) so dashboards can render it
 * without reading the database.
 */
public record InvestigationResultAdded(
    String investigatorId,
    Long executionId,
    Long resultId,
    ResultSeverity severity,
    String message,
    String entityType,        // Optional: "Invoice" / "Waybill"
    Long entityId,            // Optional: id of the investigated entity
    String payload,           // Optional JSON
    Instant timestamp
) {
    public InvestigationResultAdded {
        if (investigatorId == null || investigatorId.isBlank()) {
            throw new IllegalArgumentException("Investigator ID cannot be null or empty");
        }
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
