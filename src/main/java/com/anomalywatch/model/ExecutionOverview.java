package com.anomalywatch.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Read view of one execution for listings and detail pages.
 *
 * anomalyCount is the number of ANOMALY and CRITICAL results; resultCount is the
 * stored counter. duration is null while the execution is RUNNING.
 */
public record ExecutionOverview(
    Long executionId,
    String investigatorId,
    String investigatorName,
    ExecutionStatus status,
    Instant startedAt,
    Instant completedAt,
    Duration duration,
    int resultCount,
    long anomalyCount,
    String errorMessage
) {
    public static ExecutionOverview of(InvestigationExecution execution, String investigatorName, long anomalyCount) {
        Duration duration = execution.getCompletedAt() == null
                ? null
                : Duration.between(execution.getStartedAt(), execution.getCompletedAt());
        return new ExecutionOverview(
                execution.getId(),
                execution.getInvestigatorId(),
                investigatorName,
                execution.getStatus(),
                execution.getStartedAt(),
                execution.getCompletedAt(),
                duration,
                execution.getResultCount(),
                anomalyCount,
                execution.getErrorMessage());
    }
}
