package com.anomalywatch.controller;

import com.anomalywatch.exception.InvestigationNotFoundException;
import com.anomalywatch.model.InvestigationExecution;
import com.anomalywatch.model.InvestigationSummary;
import com.anomalywatch.model.InvestigatorInstance;
import com.anomalywatch.model.InvestigatorType;
import com.anomalywatch.service.InvestigationManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for administering investigators.
 *
 * Starting an investigator returns as soon as the run is scheduled. Progress is
 * visible through the executions endpoint and the Kafka notification topics.
 */
@RestController
@RequestMapping("/api/investigators")
@RequiredArgsConstructor
@Slf4j
public class InvestigatorController {

    private final InvestigationManager investigationManager;

    @GetMapping
    public List<InvestigatorInstance> listInvestigators() {
        return investigationManager.listInvestigators();
    }

    @GetMapping("/types")
    public List<InvestigatorType> listTypes() {
        return investigationManager.listTypes();
    }

    /**
     * Totals for the dashboard: investigators, active investigators, running executions, results.
     */
    @GetMapping("/summary")
    public InvestigationSummary getSummary() {
        return investigationManager.getSummary();
    }

    @GetMapping("/{investigatorId}")
    public ResponseEntity<InvestigatorInstance> getInvestigator(@PathVariable String investigatorId) {
        return investigationManager.getInvestigator(investigatorId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> InvestigationNotFoundException.investigator(investigatorId));
    }

    /**
     * Create an investigator.
     *
     * POST /api/investigators
     *
     * Example request:
     * {
     *   "typeCode": "invoice",
     *   "customName": "Monthly invoice audit",
     *   "customConfiguration": "{\"maxTaxRatio\": 0.3}"
     * }
     */
    @PostMapping
    public ResponseEntity<CreateResponse> createInvestigator(@Valid @RequestBody CreateRequest request) {
        log.info("Received request to create {} investigator", request.getTypeCode());

        String investigatorId = investigationManager.createInvestigator(
                request.getTypeCode(),
                request.getCustomName(),
                request.getCustomConfiguration()
        );

        CreateResponse response = new CreateResponse();
        response.setInvestigatorId(investigatorId);
        response.setMessage("Investigator created");
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{investigatorId}")
    public ResponseEntity<InvestigatorInstance> updateInvestigator(@PathVariable String investigatorId,
                                                                   @Valid @RequestBody UpdateRequest request) {
        return investigationManager.updateInvestigator(
                        investigatorId,
                        request.getCustomName(),
                        request.getActive(),
                        request.getCustomConfiguration())
                .map(ResponseEntity::ok)
                .orElseThrow(() -> InvestigationNotFoundException.investigator(investigatorId));
    }

    @DeleteMapping("/{investigatorId}")
    public ResponseEntity<Void> deleteInvestigator(@PathVariable String investigatorId) {
        if (!investigationManager.deleteInvestigator(investigatorId)) {
            throw InvestigationNotFoundException.investigator(investigatorId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Start a run.
     *
     * POST /api/investigators/{id}/start
     *
     * 202 when the run was scheduled, 409 when the investigator exists but cannot
     * run (inactive, unknown type, too many runs in progress), 404 when it does not exist.
     */
    @PostMapping("/{investigatorId}/start")
    public ResponseEntity<StartResponse> startInvestigator(@PathVariable String investigatorId) {
        if (investigationManager.getInvestigator(investigatorId).isEmpty()) {
            throw InvestigationNotFoundException.investigator(investigatorId);
        }

        boolean started = investigationManager.startInvestigator(investigatorId);

        StartResponse response = new StartResponse();
        response.setInvestigatorId(investigatorId);
        response.setStarted(started);
        if (started) {
            response.setMessage("Investigation started");
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        }
        response.setMessage("Investigator cannot be started");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @GetMapping("/{investigatorId}/executions")
    public List<InvestigationExecution> getExecutions(@PathVariable String investigatorId) {
        return investigationManager.getExecutions(investigatorId)
                .orElseThrow(() -> InvestigationNotFoundException.investigator(investigatorId));
    }

    // ==================== DTOs ====================

    @Data
    public static class CreateRequest {
        @NotBlank(message = "Type code is required")
        @Size(max = 50)
        private String typeCode;

        @Size(max = 200)
        private String customName;

        private String customConfiguration;
    }

    @Data
    public static class UpdateRequest {
        @Size(min = 1, max = 200)
        private String customName;

        private Boolean active;

        private String customConfiguration;
    }

    @Data
    public static class CreateResponse {
        private String investigatorId;
        private String message;
    }

    @Data
    public static class StartResponse {
        private String investigatorId;
        private boolean started;
        private String message;
    }
}
