package com.anomalywatch.model;

/**
 * Severity of a stored investigation result.
 */
public enum ResultSeverity {
    INFO,      // Lifecycle and summary messages
    ANOMALY,   // A record broke a business rule
    CRITICAL   // A record broke a rule that needs immediate attention (e.g. overdue delivery)
}
