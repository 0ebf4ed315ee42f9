package uk.gegc.examimport.features.question.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.question.application.ExamCsvParser;
import uk.gegc.examimport.features.question.domain.model.ParsedQuestion;
import uk.gegc.examimport.features.question.domain.model.QuestionPool;

import java.nio.file.Path;
import java.util.List;

/**
 * Dry run for content administrators: parses {@code exam.import.preview.file} at startup
 * and logs the resulting questions as JSON without storing anything.
 */
@Component
@ConditionalOnProperty(prefix = "exam.import.preview", name = "file")
@RequiredArgsConstructor
@Slf4j
public class ExamCsvPreviewRunner implements ApplicationRunner {

    private final ExamCsvParser examCsvParser;
    private final ObjectMapper objectMapper;

    @Value("${exam.import.preview.file}")
    private Path file;

    @Value("${exam.import.preview.pool:TRYOUT}")
    private QuestionPool pool;

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        List<ParsedQuestion> questions;
        try {
            questions = examCsvParser.parse(file, pool);
        } catch (RuntimeException ex) {
            log.error("Preview of {} failed: {}", file, ex.getMessage());
            throw ex;
        }
        log.info("Preview of {} ({} pool, {} questions):\n{}", file, pool.label(), questions.size(),
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(questions));
    }
}
