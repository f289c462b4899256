package com.anomalywatch.controller;

import com.anomalywatch.exception.InvestigationNotFoundException;
import com.anomalywatch.model.CountVerification;
import com.anomalywatch.model.ExecutionOverview;
import com.anomalywatch.model.InvestigationResult;
import com.anomalywatch.service.InvestigationManager;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for executions, their results and result count maintenance.
 */
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
@Slf4j
public class ExecutionController {

    private final InvestigationManager investigationManager;

    /**
     * Finished executions, most recent first, with result and anomaly counts.
     */
    @GetMapping
    public List<ExecutionOverview> listFinishedExecutions() {
        return investigationManager.listFinishedExecutions();
    }

    @GetMapping("/{executionId}")
    public ExecutionOverview getExecution(@PathVariable Long executionId) {
        return investigationManager.getExecutionOverview(executionId)
                .orElseThrow(() -> InvestigationNotFoundException.execution(executionId));
    }

    @DeleteMapping("/{executionId}")
    public ResponseEntity<Void> deleteExecution(@PathVariable Long executionId) {
        if (!investigationManager.deleteExecution(executionId)) {
            throw InvestigationNotFoundException.execution(executionId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /api/executions/{id}/results?limit=100
     */
    @GetMapping("/{executionId}/results")
    public List<InvestigationResult> getResults(@PathVariable Long executionId,
                                                @RequestParam(defaultValue = "100") int limit) {
        return investigationManager.getResults(executionId, limit)
                .orElseThrow(() -> InvestigationNotFoundException.execution(executionId));
    }

    /**
     * Compare the stored result count with the stored results. Does not change anything.
     */
    @GetMapping("/{executionId}/verification")
    public CountVerification verifyResultCount(@PathVariable Long executionId) {
        return investigationManager.verifyResultCount(executionId)
                .orElseThrow(() -> InvestigationNotFoundException.execution(executionId));
    }

    @PostMapping("/{executionId}/correction")
    public CorrectionResponse correctResultCount(@PathVariable Long executionId) {
        if (investigationManager.getExecution(executionId).isEmpty()) {
            throw InvestigationNotFoundException.execution(executionId);
        }
        boolean corrected = investigationManager.correctResultCount(executionId);
        log.info("Result count correction requested for execution {}: corrected={}", executionId, corrected);

        CorrectionResponse response = new CorrectionResponse();
        response.setCorrected(corrected ? 1 : 0);
        return response;
    }

    /**
     * Repair the result count of every execution.
     */
    @PostMapping("/corrections")
    public CorrectionResponse correctAllResultCounts() {
        log.info("Result count sweep requested");
        CorrectionResponse response = new CorrectionResponse();
        response.setCorrected(investigationManager.correctAllResultCounts());
        return response;
    }

    @Data
    public static class CorrectionResponse {
        private int corrected;
    }
}
