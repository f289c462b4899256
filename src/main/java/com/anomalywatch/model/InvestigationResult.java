package com.anomalywatch.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One finding emitted by an investigator during an execution.
 *
 * Results are append-only: every saveResult call inserts a brand new row and no
 * code path ever updates an existing one, so result rows never contend with each other.
 */
@Entity
@Table(name = "investigation_results",
       indexes = @Index(name = "idx_result_execution", columnList = "executionId"))
@Data
@NoArgsConstructor
public class InvestigationResult {

    public static final int MAX_MESSAGE_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long executionId;  // Owning InvestigationExecution (simplified foreign key)

    @Column(nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ResultSeverity severity;

    @Column(nullable = false, length = MAX_MESSAGE_LENGTH)
    private String message;

    @Column(length = 50)
    private String entityType;

    private Long entityId;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        if (severity == null) {
            severity = ResultSeverity.INFO;
        }
    }
}
