package uk.gegc.examimport.features.question.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examimport.features.csv.application.CsvRowReader;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.question.domain.model.ParsedQuestion;
import uk.gegc.examimport.features.question.domain.model.QuestionPool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a question CSV file into an ordered list of questions for the tryout or practice pool.
 * Each call is independent and only reads the given file.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExamCsvParser {

    private final CsvRowReader csvRowReader;
    private final QuestionAssembler questionAssembler;

    public List<ParsedQuestion> parseTryoutCsv(Path file) {
        return parse(file, QuestionPool.TRYOUT);
    }

    public List<ParsedQuestion> parsePracticeCsv(Path file) {
        return parse(file, QuestionPool.PRACTICE);
    }

    /**
     * @throws uk.gegc.examimport.features.question.domain.exception.MissingExplanationException if a row has no explanation
     * @throws java.io.UncheckedIOException if the file cannot be read or is not parseable CSV
     */
    public List<ParsedQuestion> parse(Path file, QuestionPool pool) {
        List<RawRow> rows = csvRowReader.readRows(file);
        List<ParsedQuestion> questions = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            questions.add(questionAssembler.assemble(rows.get(i), i, pool));
        }
        log.debug("Parsed {} {} questions from {}", questions.size(), pool.label(), file.getFileName());
        return List.copyOf(questions);
    }
}
