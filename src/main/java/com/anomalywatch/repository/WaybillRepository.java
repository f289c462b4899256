package com.anomalywatch.repository;

import com.anomalywatch.model.Waybill;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Read access to waybills for the waybill investigator.
 */
@Repository
public interface WaybillRepository extends JpaRepository<Waybill, Long> {

    /**
     * Waybills that have not been delivered yet, in id order.
     * Delivered waybills can no longer be late and are never investigated.
     */
    List<Waybill> findByDeliveredAtIsNullOrderByIdAsc();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Waybill w SET w.hasAnomalies = :hasAnomalies, w.lastInvestigatedAt = :investigatedAt "
         + "WHERE w.id IN :ids")
    int markInvestigated(@Param("ids") Collection<Long> ids,
                         @Param("hasAnomalies") boolean hasAnomalies,
                         @Param("investigatedAt") Instant investigatedAt);
}
