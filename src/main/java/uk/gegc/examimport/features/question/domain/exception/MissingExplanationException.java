package uk.gegc.examimport.features.question.domain.exception;

import lombok.Getter;
import uk.gegc.examimport.features.question.domain.model.QuestionPool;
import uk.gegc.examimport.shared.exception.ValidationException;

/**
 * A data row has an empty {@code explanation} cell. The row number counts the header as row 1.
 */
@Getter
public class MissingExplanationException extends ValidationException {

    private final QuestionPool pool;
    private final int rowNumber;

    public MissingExplanationException(QuestionPool pool, int rowNumber) {
        super(String.format("CSV %s: pembahasan wajib diisi (baris %d).", pool.label(), rowNumber));
        this.pool = pool;
        this.rowNumber = rowNumber;
    }
}
