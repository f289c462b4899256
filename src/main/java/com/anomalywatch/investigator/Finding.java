package com.anomalywatch.investigator;

import com.anomalywatch.model.ResultSeverity;

import java.time.Instant;

/**
 * A finding emitted by an investigator, before it is stored.
 *
 * entityType and entityId optionally reference the record the finding is about.
 * payload is an optional JSON document.
 */
public record Finding(
    ResultSeverity severity,
    String message,
    String payload,
    String entityType,
    Long entityId,
    Instant timestamp
) {
    public Finding {
        if (severity == null) {
            throw new IllegalArgumentException("Severity cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message cannot be null or empty");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static Finding info(String message, Instant timestamp) {
        return new Finding(ResultSeverity.INFO, message, null, null, null, timestamp);
    }

    public static Finding info(String message, String payload, Instant timestamp) {
        return new Finding(ResultSeverity.INFO, message, payload, null, null, timestamp);
    }

    public static Finding anomaly(String message, String payload, String entityType, Long entityId, Instant timestamp) {
        return new Finding(ResultSeverity.ANOMALY, message, payload, entityType, entityId, timestamp);
    }

    public static Finding critical(String message, String payload, String entityType, Long entityId, Instant timestamp) {
        return new Finding(ResultSeverity.CRITICAL, message, payload, entityType, entityId, timestamp);
    }
}
