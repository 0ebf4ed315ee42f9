package uk.gegc.examimport.features.question.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.csv.domain.ColumnSchema;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.question.domain.exception.MissingExplanationException;
import uk.gegc.examimport.features.question.domain.model.ParsedQuestion;
import uk.gegc.examimport.features.question.domain.model.QuestionPool;

import java.math.BigDecimal;

/**
 * Maps a header-keyed row to a {@link ParsedQuestion}.
 *
 * <p>Field rules, with {@code position} the 0-based index of the row among the data rows:
 * <ul>
 *     <li>explanation: required, otherwise {@link MissingExplanationException} for file row {@code position + 2}</li>
 *     <li>explanation image: {@code explanationImageUrl}, then legacy {@code explanation_image}, then none</li>
 *     <li>order: the {@code order} cell when it is a whole number, otherwise {@code position + 1}</li>
 *     <li>prompt: the {@code prompt} cell, otherwise {@code "Soal " + (position + 1)}</li>
 *     <li>image: {@code prompt_image}, otherwise none</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class QuestionAssembler {

    private final OptionExtractor optionExtractor;

    public ParsedQuestion assemble(RawRow row, int position, QuestionPool pool) {
        String explanation = text(row, ColumnSchema.EXPLANATION);
        if (explanation.isEmpty()) {
            throw new MissingExplanationException(pool, position + 2);
        }

        String explanationImageUrl = firstNonEmpty(
                text(row, ColumnSchema.EXPLANATION_IMAGE_URL),
                text(row, ColumnSchema.LEGACY_EXPLANATION_IMAGE));
        String prompt = text(row, ColumnSchema.PROMPT);

        return new ParsedQuestion(
                prompt.isEmpty() ? "Soal " + (position + 1) : prompt,
                firstNonEmpty(text(row, ColumnSchema.PROMPT_IMAGE)),
                explanation,
                explanationImageUrl,
                parseOrder(row.get(ColumnSchema.ORDER), position + 1),
                optionExtractor.extract(row)
        );
    }

    static int parseOrder(String value, int defaultOrder) {
        if (value == null || value.isBlank()) {
            return defaultOrder;
        }
        try {
            return new BigDecimal(value.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            return defaultOrder;
        }
    }

    private static String text(RawRow row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
