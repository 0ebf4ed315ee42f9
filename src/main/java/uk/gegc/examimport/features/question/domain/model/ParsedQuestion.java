package uk.gegc.examimport.features.question.domain.model;

import java.util.List;

/**
 * One exam question assembled from a CSV row.
 */
public record ParsedQuestion(
        String prompt,
        String imageUrl,
        String explanation,
        String explanationImageUrl,
        int order,
        List<ParsedOption> options
) {
    public ParsedQuestion {
        if (explanation == null || explanation.isBlank()) {
            throw new IllegalArgumentException("Explanation must not be blank");
        }
        options = options != null ? List.copyOf(options) : List.of();
    }
}
