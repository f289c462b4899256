package com.anomalywatch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails executions that have been RUNNING for longer than
 * investigation.execution.timeout, so a hung run does not stay RUNNING forever.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExecutionWatchdog {

    private final InvestigationManager investigationManager;

    @Scheduled(fixedDelayString = "${investigation.execution.watchdog-interval-ms:60000}",
               initialDelayString = "${investigation.execution.watchdog-interval-ms:60000}")
    public void expireStaleExecutions() {
        try {
            int expired = investigationManager.expireStaleExecutions();
            if (expired > 0) {
                log.warn("Watchdog failed {} stale executions", expired);
            } else {
                log.debug("Watchdog found no stale executions");
            }
        } catch (Exception e) {
            log.error("Error in execution watchdog", e);
        }
    }
}
