package uk.gegc.examimport.features.csv.domain;

import lombok.Getter;

/**
 * Thrown by the strict parser when a record has a different number of fields than the header.
 */
@Getter
public class RecordLengthMismatchException extends RuntimeException {

    private final long lineNumber;
    private final int expectedFields;
    private final int actualFields;

    public RecordLengthMismatchException(long lineNumber, int expectedFields, int actualFields) {
        super(String.format("Invalid record length: expect %d, got %d on line %d",
                expectedFields, actualFields, lineNumber));
        this.lineNumber = lineNumber;
        this.expectedFields = expectedFields;
        this.actualFields = actualFields;
    }
}
