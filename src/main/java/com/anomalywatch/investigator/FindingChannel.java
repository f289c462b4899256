package com.anomalywatch.investigator;

/**
 * Where an investigator sends its findings.
 *
 * The production channel stores every finding as an InvestigationResult of the
 * current execution. Implementations must be safe to call from the investigator
 * thread while earlier findings are still being stored.
 */
@FunctionalInterface
public interface FindingChannel {

    void publish(Finding finding);
}
