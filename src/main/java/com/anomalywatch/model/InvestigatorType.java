package com.anomalywatch.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Catalog entry describing a kind of investigator ("invoice", "waybill").
 *
 * This is static reference data: it is seeded at startup and read far more often
 * than it is written, which is why lookups by code are cached in Redis.
 *
 * The default configuration is an optional JSON object whose fields override the
 * rule thresholds from application.yml for every instance of this type.
 */
@Entity
@Table(name = "investigator_types")
@Data
@NoArgsConstructor
public class InvestigatorType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(nullable = false, length = 200)
    private String displayName;

    @Column(length = 500)
    private String description;

    @Column(columnDefinition = "TEXT")
    private String defaultConfiguration;

    @Column(nullable = false)
    private Boolean active = true;

    @Column(nullable = false)
    private Instant createdAt;

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
