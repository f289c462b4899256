package com.anomalywatch.investigator;

import com.anomalywatch.producer.InvestigationNotifier;

import java.time.Clock;
import java.util.List;

/**
 * Everything an investigator is bound to for one execution.
 *
 * @param investigatorId        InvestigatorInstance id
 * @param executionId           InvestigationExecution the findings belong to
 * @param channel               Receives every finding
 * @param notifier              Optional, may be null
 * @param clock                 Source of "now" for rules and timestamps
 * @param configurationOverlays JSON objects applied over the rule defaults, in order
 *                              (type default configuration, then instance configuration)
 */
public record InvestigatorContext(
    String investigatorId,
    Long executionId,
    FindingChannel channel,
    InvestigationNotifier notifier,
    Clock clock,
    List<String> configurationOverlays
) {
    public InvestigatorContext {
        if (investigatorId == null || investigatorId.isBlank()) {
            throw new IllegalArgumentException("Investigator ID cannot be null or empty");
        }
        if (executionId == null) {
            throw new IllegalArgumentException("Execution ID cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("Finding channel cannot be null");
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
        configurationOverlays = configurationOverlays == null ? List.of() : List.copyOf(configurationOverlays);
    }
}
