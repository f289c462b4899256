package com.anomalywatch.exception;

/**
 * Thrown when a request to create or update an investigator is invalid.
 */
public class InvestigationValidationException extends InvestigationException {

    public InvestigationValidationException(String message) {
        super(message);
    }

    public InvestigationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
