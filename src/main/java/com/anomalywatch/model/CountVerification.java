package com.anomalywatch.model;

import java.time.Instant;

/**
 * Report comparing an execution's stored result counter with the real number of
 * result rows.
 *
 * A non-zero discrepancy is drift. Drift is not an error: it is reported here and
 * repaired by the correction operations.
 */
public record CountVerification(
    Long executionId,
    long reportedCount,   // Value of investigation_executions.result_count
    long actualCount,     // COUNT(*) of investigation_results for the execution
    boolean accurate,
    long discrepancy,     // actualCount - reportedCount
    Instant verifiedAt
) {
    public CountVerification {
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        if (verifiedAt == null) {
            verifiedAt = Instant.now();
        }
    }

    public static CountVerification of(Long executionId, long reportedCount, long actualCount, Instant verifiedAt) {
        long discrepancy = actualCount - reportedCount;
        return new CountVerification(executionId, reportedCount, actualCount, discrepancy == 0, discrepancy, verifiedAt);
    }

    public boolean hasDrift() {
        return !accurate;
    }
}
