package com.anomalywatch.investigator;

/**
 * One rule that fired for one record, with a human readable reason.
 */
public record RuleViolation<R extends Enum<R>>(R rule, String reason) {

    public RuleViolation {
        if (rule == null) {
            throw new IllegalArgumentException("Rule cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Reason cannot be null or empty");
        }
    }
}
