package com.anomalywatch.producer;

import com.anomalywatch.model.ExecutionStatus;
import com.anomalywatch.model.InvestigationResult;

import java.time.Instant;

/**
 * Receives investigation lifecycle notifications.
 *
 * Implementations must return quickly and must never throw: a notification
 * failure can never fail an investigation or a stored finding.
 */
public interface InvestigationNotifier {

    void investigationStarted(String investigatorId, Long executionId, Instant timestamp);

    /**
     * Called after a finding has been stored. A null result is logged and ignored.
     */
    void resultAdded(String investigatorId, InvestigationResult result);

    void statusChanged(String investigatorId, Long executionId, ExecutionStatus status);

    /**
     * Called once per successful execution, after the counter has been reconciled.
     */
    void investigationCompleted(String investigatorId, Long executionId, long resultCount, Instant timestamp);
}
