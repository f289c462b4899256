package com.anomalywatch.repository;

import com.anomalywatch.model.InvestigatorInstance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface InvestigatorInstanceRepository extends JpaRepository<InvestigatorInstance, String> {

    List<InvestigatorInstance> findAllByOrderByCreatedAtDesc();

    long countByActiveTrue();

    /**
     * Stamp the last execution time.
     *
     * @return Rows updated (0 if the instance does not exist)
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE InvestigatorInstance i SET i.lastExecutedAt = :executedAt WHERE i.id = :id")
    int updateLastExecutedAt(@Param("id") String id, @Param("executedAt") Instant executedAt);

    /**
     * Delete the instance row with a single statement.
     * The row lock taken here blocks a concurrent start of the same instance until
     * the surrounding delete transaction ends.
     *
     * @return Rows deleted
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM InvestigatorInstance i WHERE i.id = :id")
    int deleteInstance(@Param("id") String id);
}
