package uk.gegc.examimport.features.question.domain.model;

/**
 * Multiple-choice option read from one {@code option_*} slot.
 *
 * @param label     option text, never blank
 * @param imageUrl  optional image, {@code null} when the cell is empty
 * @param isCorrect whether the option counts as a right answer
 */
public record ParsedOption(
        String label,
        String imageUrl,
        boolean isCorrect
) {
    public ParsedOption {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Option label must not be blank");
        }
    }
}
