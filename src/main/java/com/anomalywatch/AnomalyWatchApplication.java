package com.anomalywatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the Anomaly Watch investigation service.
 *
 * The service runs pluggable investigators (invoice, waybill) that scan business
 * records for rule-based anomalies and stores every finding they emit.
 *
 * Architecture flow:
 * Admin API -> InvestigationManager -> Investigator run (background) -> FindingChannel
 *           -> saveResult (row insert + atomic counter increment) -> Kafka notifications
 *
 * Key points:
 * - Starting an investigator returns immediately, the run happens on a worker pool
 * - Each finding is persisted in its own transaction
 * - The execution result counter is only ever changed with a single UPDATE statement
 * - Counters are reconciled against the stored rows before completion is announced
 */
@SpringBootApplication
@EnableScheduling  // Execution watchdog
public class AnomalyWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyWatchApplication.class, args);
    }
}
