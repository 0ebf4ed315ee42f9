package uk.gegc.examimport.shared.exception;

/**
 * Raised when uploaded content breaks a rule that the importer enforces.
 * The message is meant to be shown to the administrator as is.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
