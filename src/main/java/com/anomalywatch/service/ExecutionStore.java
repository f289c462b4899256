package com.anomalywatch.service;

import com.anomalywatch.exception.InvestigationNotFoundException;
import com.anomalywatch.investigator.Finding;
import com.anomalywatch.model.CountVerification;
import com.anomalywatch.model.ExecutionStatus;
import com.anomalywatch.model.InvestigationExecution;
import com.anomalywatch.model.InvestigationResult;
import com.anomalywatch.repository.InvestigationExecutionRepository;
import com.anomalywatch.repository.InvestigationResultRepository;
import com.anomalywatch.repository.InvestigatorInstanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Transactional persistence steps of the investigation lifecycle.
 *
 * Each public method is one database transaction. InvestigationManager calls them
 * from investigator and result-writer threads; every call gets its own transaction
 * and pooled connection, so a slow or failing save never affects another one.
 *
 * COUNTER PROTOCOL:
 * =================
 * appendResult   INSERT result; UPDATE counter = counter + 1       (same transaction)
 * closeExecution UPDATE status WHERE status = RUNNING; reconcile   (same transaction)
 * correct        UPDATE counter = (SELECT COUNT(*) ...)            (single statement)
 *
 * The counter is never loaded, modified in memory and saved back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionStore {

    private final InvestigatorInstanceRepository instanceRepository;
    private final InvestigationExecutionRepository executionRepository;
    private final InvestigationResultRepository resultRepository;
    private final Clock clock;

    /**
     * Create a RUNNING execution with a zero counter and stamp the instance's last
     * execution time.
     *
     * @return The new execution, or empty if the instance no longer exists
     */
    @Transactional
    public Optional<InvestigationExecution> openExecution(String investigatorId, Instant startedAt) {
        // Row lock on the instance: a concurrent delete either finishes first or waits for us
        if (instanceRepository.updateLastExecutedAt(investigatorId, startedAt) == 0) {
            return Optional.empty();
        }

        InvestigationExecution execution = new InvestigationExecution();
        execution.setInvestigatorId(investigatorId);
        execution.setStartedAt(startedAt);
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setResultCount(0);
        return Optional.of(executionRepository.save(execution));
    }

    /**
     * Store a finding as a new result row and atomically add one to the counter.
     *
     * @throws InvestigationNotFoundException if the execution does not exist; the
     *         inserted row is rolled back with the transaction
     */
    @Transactional
    public InvestigationResult appendResult(Long executionId, Finding finding) {
        InvestigationResult result = new InvestigationResult();
        result.setExecutionId(executionId);
        result.setTimestamp(finding.timestamp());
        result.setSeverity(finding.severity());
        result.setMessage(truncate(finding.message(), InvestigationResult.MAX_MESSAGE_LENGTH));
        result.setEntityType(finding.entityType());
        result.setEntityId(finding.entityId());
        result.setPayload(finding.payload());

        InvestigationResult saved = resultRepository.save(result);

        if (executionRepository.incrementResultCount(executionId, 1) == 0) {
            throw InvestigationNotFoundException.execution(executionId);
        }
        return saved;
    }

    /**
     * Move the execution from RUNNING to a terminal status and reconcile its counter.
     *
     * The counter is reconciled even when the execution already left RUNNING, so a
     * run finishing after the watchdog failed it still leaves an accurate counter.
     *
     * @return The reconciled result count if this call performed the transition,
     *         empty if the execution is missing or was already terminal
     */
    @Transactional
    public Optional<Long> closeExecution(Long executionId, ExecutionStatus status, String errorMessage, Instant completedAt) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Execution can only be closed with a terminal status, got " + status);
        }
        int transitioned = executionRepository.markTerminal(
                executionId, status, completedAt, truncate(errorMessage, 1000), ExecutionStatus.RUNNING);

        reconcile(executionId);

        if (transitioned == 0) {
            return Optional.empty();
        }
        return executionRepository.findResultCountById(executionId).map(Integer::longValue);
    }

    @Transactional(readOnly = true)
    public Optional<CountVerification> verify(Long executionId) {
        return executionRepository.findResultCountById(executionId)
                .map(reported -> CountVerification.of(
                        executionId,
                        reported,
                        resultRepository.countByExecutionId(executionId),
                        clock.instant()));
    }

    /**
     * Overwrite a drifted counter with the true number of results.
     *
     * @return true if the counter was corrected, false if it was accurate or the
     *         execution does not exist
     */
    @Transactional
    public boolean correct(Long executionId) {
        return reconcile(executionId);
    }

    /**
     * Delete an instance with all its executions and results.
     *
     * Order matters: the instance row goes first so no new execution can be opened,
     * then the executions so no concurrent save can increment a counter (and thereby
     * commit its result), then every result of those executions.
     *
     * @return false if the instance does not exist
     */
    @Transactional
    public boolean deleteInvestigatorCascade(String investigatorId) {
        if (instanceRepository.deleteInstance(investigatorId) == 0) {
            return false;
        }
        List<Long> executionIds = executionRepository.findIdsByInvestigatorId(investigatorId);
        int executions = executionRepository.deleteAllByInvestigatorId(investigatorId);
        int results = executionIds.isEmpty() ? 0 : resultRepository.deleteAllByExecutionIdIn(executionIds);

        log.info("Deleted investigator {} with {} executions and {} results", investigatorId, executions, results);
        return true;
    }

    /**
     * Delete one execution with all its results.
     *
     * The execution row goes first, so a save still in flight finds no counter to
     * increment and rolls back its result.
     *
     * @return false if the execution does not exist
     */
    @Transactional
    public boolean deleteExecution(Long executionId) {
        if (executionRepository.deleteExecution(executionId) == 0) {
            return false;
        }
        int results = resultRepository.deleteAllByExecutionIdIn(List.of(executionId));

        log.info("Deleted execution {} with {} results", executionId, results);
        return true;
    }

    private boolean reconcile(Long executionId) {
        Optional<CountVerification> verification = verify(executionId);
        if (verification.isEmpty() || verification.get().accurate()) {
            return false;
        }
        CountVerification drift = verification.get();
        if (executionRepository.synchronizeResultCount(executionId) == 0) {
            // Deleted between the count and the update
            return false;
        }
        log.warn("Corrected result count drift on execution {}: reported={}, actual={}, discrepancy={}",
                executionId, drift.reportedCount(), drift.actualCount(), drift.discrepancy());
        return true;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
