package com.anomalywatch.repository;

import com.anomalywatch.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;

/**
 * Read access to invoices for the invoice investigator.
 * The only write is the investigation flag write-back.
 */
@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Invoice i SET i.hasAnomalies = :hasAnomalies, i.lastInvestigatedAt = :investigatedAt "
         + "WHERE i.id IN :ids")
    int markInvestigated(@Param("ids") Collection<Long> ids,
                         @Param("hasAnomalies") boolean hasAnomalies,
                         @Param("investigatedAt") Instant investigatedAt);
}
