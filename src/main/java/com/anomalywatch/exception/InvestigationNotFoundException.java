package com.anomalywatch.exception;

/**
 * Thrown when an investigator instance or execution does not exist (any more).
 */
public class InvestigationNotFoundException extends InvestigationException {

    public InvestigationNotFoundException(String message) {
        super(message);
    }

    public static InvestigationNotFoundException execution(Long executionId) {
        return new InvestigationNotFoundException("Execution not found: " + executionId);
    }

    public static InvestigationNotFoundException investigator(String investigatorId) {
        return new InvestigationNotFoundException("Investigator not found: " + investigatorId);
    }
}
