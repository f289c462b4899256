package com.anomalywatch.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Invoice as seen by the invoice investigator.
 *
 * Invoices are maintained by another part of the system; investigations only read
 * them and write back the two investigation flags.
 */
@Entity
@Table(name = "invoices")
@Data
@NoArgsConstructor
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 200)
    private String recipientName;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal totalTax;

    @Column(nullable = false)
    private Instant issueDate;

    @Column(nullable = false)
    private Boolean hasAnomalies = false;

    private Instant lastInvestigatedAt;
}
