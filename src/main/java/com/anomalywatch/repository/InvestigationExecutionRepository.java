package com.anomalywatch.repository;

import com.anomalywatch.model.ExecutionStatus;
import com.anomalywatch.model.InvestigationExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for investigation executions.
 *
 * COUNTER UPDATES
 * ===============
 * The result counter is only ever written by incrementResultCount and
 * synchronizeResultCount. Both are a single UPDATE statement, so the database
 * row lock serializes concurrent writers and no increment can be lost.
 *
 * Modifying queries return the number of rows touched. Zero means the execution
 * does not exist (or, for markTerminal, is no longer RUNNING).
 */
@Repository
public interface InvestigationExecutionRepository extends JpaRepository<InvestigationExecution, Long> {

    /**
     * Atomically add delta to the result counter.
     *
     * @return Rows updated (0 if the execution is gone)
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE InvestigationExecution e SET e.resultCount = e.resultCount + :delta WHERE e.id = :executionId")
    int incrementResultCount(@Param("executionId") Long executionId, @Param("delta") int delta);

    /**
     * Overwrite the counter with the true number of stored results, in one statement.
     *
     * @return Rows updated (0 if the execution is gone)
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE investigation_executions SET result_count = "
                 + "(SELECT COUNT(*) FROM investigation_results r WHERE r.execution_id = :executionId) "
                 + "WHERE id = :executionId",
           nativeQuery = true)
    int synchronizeResultCount(@Param("executionId") Long executionId);

    /**
     * Move a RUNNING execution to a terminal status.
     * Executions that already left RUNNING are not touched.
     *
     * @return 1 if this call performed the transition, 0 otherwise
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE InvestigationExecution e SET e.status = :status, e.completedAt = :completedAt, "
         + "e.errorMessage = :errorMessage WHERE e.id = :executionId AND e.status = :running")
    int markTerminal(@Param("executionId") Long executionId,
                     @Param("status") ExecutionStatus status,
                     @Param("completedAt") Instant completedAt,
                     @Param("errorMessage") String errorMessage,
                     @Param("running") ExecutionStatus running);

    /**
     * Read the stored counter without loading the entity.
     */
    @Query("SELECT e.resultCount FROM InvestigationExecution e WHERE e.id = :executionId")
    Optional<Integer> findResultCountById(@Param("executionId") Long executionId);

    List<InvestigationExecution> findByInvestigatorIdOrderByStartedAtDesc(String investigatorId);

    /**
     * Find executions stuck in a status since before the given time.
     * Used by the watchdog with status RUNNING.
     */
    List<InvestigationExecution> findByStatusAndStartedAtBefore(ExecutionStatus status, Instant before);

    @Query("SELECT e.id FROM InvestigationExecution e WHERE e.investigatorId = :investigatorId")
    List<Long> findIdsByInvestigatorId(@Param("investigatorId") String investigatorId);

    @Query("SELECT e.id FROM InvestigationExecution e ORDER BY e.id ASC")
    List<Long> findAllIds();

    /**
     * Delete a single execution row.
     *
     * @return Rows deleted
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM InvestigationExecution e WHERE e.id = :executionId")
    int deleteExecution(@Param("executionId") Long executionId);

    long countByStatus(ExecutionStatus status);

    List<InvestigationExecution> findByStatusInOrderByStartedAtDesc(Collection<ExecutionStatus> statuses);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM InvestigationExecution e WHERE e.investigatorId = :investigatorId")
    int deleteAllByInvestigatorId(@Param("investigatorId") String investigatorId);
}
