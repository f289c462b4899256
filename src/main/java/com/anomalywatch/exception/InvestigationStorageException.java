package com.anomalywatch.exception;

/**
 * Thrown when the database rejects or fails an investigation write.
 * The cause carries the underlying Spring DataAccessException.
 */
public class InvestigationStorageException extends InvestigationException {

    public InvestigationStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
