package com.anomalywatch.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One run of an investigator instance.
 *
 * RESULT COUNTER
 * ==============
 * resultCount must equal the number of InvestigationResult rows of this execution
 * once the execution is terminal. While the run is in flight, many threads store
 * results at the same time, so the counter is NEVER changed through this entity
 * (load, set, save). It is only changed by the single-statement updates in
 * InvestigationExecutionRepository:
 * - incrementResultCount: result_count = result_count + delta
 * - synchronizeResultCount: result_count = (SELECT COUNT(*) ...)
 *
 * Loading the entity, incrementing the field and saving it back lets two writers read
 * the same value and lose one update. That is how a run once reported 8 results when
 * 100 had been stored.
 */
@Entity
@Table(name = "investigation_executions",
       indexes = {
           @Index(name = "idx_execution_investigator", columnList = "investigatorId"),
           @Index(name = "idx_execution_status_started", columnList = "status, startedAt")
       })
@Data
@NoArgsConstructor
public class InvestigationExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String investigatorId;  // Owning InvestigatorInstance (simplified foreign key)

    @Column(nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExecutionStatus status;

    @Column(nullable = false)
    private Integer resultCount = 0;

    @Column(length = 1000)
    private String errorMessage;

    @PrePersist
    protected void onCreate() {
        if (startedAt == null) {
            startedAt = Instant.now();
        }
        if (status == null) {
            status = ExecutionStatus.RUNNING;
        }
        if (resultCount == null) {
            resultCount = 0;
        }
    }
}
