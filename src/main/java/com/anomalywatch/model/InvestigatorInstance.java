package com.anomalywatch.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Formula;

import java.time.Instant;

/**
 * A configured investigator created by an administrator.
 *
 * The instance references its type by code (foreign key kept simple, the same way
 * executions reference their instance by id).
 *
 * totalResultCount is not stored: it is the sum of the result counters of all
 * executions of this instance, computed by the database whenever the row is loaded.
 */
@Entity
@Table(name = "investigator_instances",
       indexes = @Index(name = "idx_instance_type_code", columnList = "typeCode"))
@Data
@NoArgsConstructor
public class InvestigatorInstance {

    @Id
    private String id;

    @Column(nullable = false, length = 50)
    private String typeCode;

    @Column(length = 200)
    private String customName;

    @Column(nullable = false)
    private Boolean active = true;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant lastExecutedAt;

    /**
     * Optional JSON object overriding rule thresholds for this instance only.
     * Applied on top of the type's default configuration.
     */
    @Column(columnDefinition = "TEXT")
    private String customConfiguration;

    @Formula("(select coalesce(sum(e.result_count), 0) from investigation_executions e where e.investigator_id = id)")
    private Long totalResultCount;

    public boolean isEnabled() {
        return Boolean.TRUE.equals(active);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (active == null) {
            active = true;
        }
    }
}
