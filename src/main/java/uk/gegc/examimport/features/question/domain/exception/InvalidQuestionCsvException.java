package uk.gegc.examimport.features.question.domain.exception;

import uk.gegc.examimport.shared.exception.ValidationException;

/**
 * Uploaded question file was rejected. {@link #getDetail()} carries the underlying parser message.
 */
public class InvalidQuestionCsvException extends ValidationException {

    public InvalidQuestionCsvException(String message) {
        super(message);
    }

    public InvalidQuestionCsvException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getDetail() {
        return getCause() != null ? String.valueOf(getCause().getMessage()) : getMessage();
    }
}
