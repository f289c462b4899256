package com.anomalywatch.config;

import com.anomalywatch.investigator.InvoiceRuleSettings;
import com.anomalywatch.investigator.WaybillRuleSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings bound from the investigation.* section of application.yml.
 *
 * The invoice and waybill sections are the base layer of rule thresholds.
 * Type defaults and instance overrides stored in the database are applied on top
 * (see RuleSettingsResolver).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "investigation")
public class InvestigationProperties {

    @Valid
    @NotNull
    private InvoiceRuleSettings invoice = new InvoiceRuleSettings();

    @Valid
    @NotNull
    private WaybillRuleSettings waybill = new WaybillRuleSettings();

    @Valid
    @NotNull
    private Execution execution = new Execution();

    @Valid
    @NotNull
    private Notifications notifications = new Notifications();

    @Data
    public static class Execution {

        /** Executions RUNNING longer than this are failed by the watchdog. */
        @NotNull
        private Duration timeout = Duration.ofHours(2);

        @Min(1000)
        private long watchdogIntervalMs = 60000;

        /** Concurrent investigator runs. */
        @Min(1)
        private int runnerThreads = 4;

        @Min(1)
        private int runnerQueueCapacity = 50;

        /** Threads storing findings. Keep below the connection pool size. */
        @Min(1)
        private int writerThreads = 8;

        @Min(1)
        private int writerQueueCapacity = 1000;
    }

    @Data
    public static class Notifications {

        /** Upper bound for a blocking KafkaTemplate.send while broker metadata is unavailable. */
        @Min(0)
        private long maxBlockMs = 5000;

        /**
         * Events waiting for the dispatch thread. When full, new notifications are
         * dropped and logged instead of piling up while the broker is unreachable.
         */
        @Min(1)
        private int queueCapacity = 10000;
    }
}
