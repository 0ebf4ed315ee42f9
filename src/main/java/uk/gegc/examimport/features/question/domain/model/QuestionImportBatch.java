package uk.gegc.examimport.features.question.domain.model;

import java.util.List;

/**
 * Questions accepted from one uploaded file, tagged with the pool they will be stored under.
 */
public record QuestionImportBatch(
        QuestionPool pool,
        List<ParsedQuestion> questions
) {
    public QuestionImportBatch {
        questions = List.copyOf(questions);
    }

    public int totalQuestions() {
        return questions.size();
    }
}
