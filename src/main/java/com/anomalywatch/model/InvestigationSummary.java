package com.anomalywatch.model;

import java.time.Instant;

/**
 * Dashboard figures across all investigators.
 */
public record InvestigationSummary(
    long totalInvestigators,
    long activeInvestigators,
    long runningExecutions,
    long totalResults,
    Instant generatedAt
) {
}
