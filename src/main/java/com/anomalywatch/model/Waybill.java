package com.anomalywatch.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Waybill as seen by the waybill investigator.
 *
 * Older waybills were created before due dates existed; for those dueDate is null
 * and the goods issue date is used instead.
 */
@Entity
@Table(name = "waybills",
       indexes = @Index(name = "idx_waybill_due_date", columnList = "dueDate"))
@Data
@NoArgsConstructor
public class Waybill {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 200)
    private String recipientName;

    @Column(nullable = false)
    private Instant goodsIssueDate;

    private Instant dueDate;

    private Instant deliveredAt;

    @Column(nullable = false)
    private Boolean hasAnomalies = false;

    private Instant lastInvestigatedAt;

    public boolean isDelivered() {
        return deliveredAt != null;
    }
}
