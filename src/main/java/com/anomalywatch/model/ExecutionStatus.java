package com.anomalywatch.model;

/**
 * Lifecycle of a single investigation execution.
 * Transitions only go forward: RUNNING -> COMPLETED or RUNNING -> FAILED.
 */
public enum ExecutionStatus {
    RUNNING,    // Investigator is scanning, results may still arrive
    COMPLETED,  // Scan finished and every result was stored
    FAILED;     // Scan threw, a result could not be stored, or the watchdog gave up

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
