package com.anomalywatch.exception;

/**
 * Base class for failures of the investigation engine.
 */
public class InvestigationException extends RuntimeException {

    public InvestigationException(String message) {
        super(message);
    }

    public InvestigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
