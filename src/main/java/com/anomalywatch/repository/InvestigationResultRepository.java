package com.anomalywatch.repository;

import com.anomalywatch.model.InvestigationResult;
import com.anomalywatch.model.ResultSeverity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Repository for investigation results.
 *
 * Results are only ever inserted (save) and bulk-deleted with their execution.
 */
@Repository
public interface InvestigationResultRepository extends JpaRepository<InvestigationResult, Long> {

    /**
     * True number of results stored for an execution.
     * This is the reference value the execution counter is verified against.
     */
    long countByExecutionId(Long executionId);

    /**
     * Most recent results first.
     *
     * @param pageable Use PageRequest.of(0, limit) to cap the result size
     */
    List<InvestigationResult> findByExecutionIdOrderByTimestampDescIdDesc(Long executionId, Pageable pageable);

    /**
     * Number of results of an execution with one of the given severities.
     */
    long countByExecutionIdAndSeverityIn(Long executionId, Collection<ResultSeverity> severities);

    /**
     * Per-execution count of results with one of the given severities.
     * Executions without such results are absent from the list.
     */
    @Query("SELECT r.executionId AS executionId, COUNT(r) AS resultCount FROM InvestigationResult r "
         + "WHERE r.executionId IN :executionIds AND r.severity IN :severities GROUP BY r.executionId")
    List<ExecutionResultCount> countByExecutionIdsAndSeverityIn(@Param("executionIds") Collection<Long> executionIds,
                                                               @Param("severities") Collection<ResultSeverity> severities);

    interface ExecutionResultCount {
        Long getExecutionId();

        long getResultCount();
    }

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM InvestigationResult r WHERE r.executionId IN :executionIds")
    int deleteAllByExecutionIdIn(@Param("executionIds") Collection<Long> executionIds);
}
