package uk.gegc.examimport.features.question.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examimport.features.csv.config.CsvImportProperties;
import uk.gegc.examimport.features.question.domain.exception.InvalidQuestionCsvException;
import uk.gegc.examimport.features.question.domain.model.ParsedQuestion;
import uk.gegc.examimport.features.question.domain.model.QuestionImportBatch;
import uk.gegc.examimport.features.question.domain.model.QuestionPool;
import uk.gegc.examimport.shared.exception.ValidationException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Checks an uploaded question file before and after parsing, the way the admin screens expect:
 * CSV only, within the size limit, parseable and not empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionCsvImportService {

    static final String NOT_CSV_MESSAGE = "File soal harus berformat CSV.";
    static final String INVALID_CSV_MESSAGE =
            "CSV soal tidak valid. Gunakan template terbaru dan pastikan format kolom sesuai.";
    static final String EMPTY_CSV_MESSAGE = "CSV soal kosong atau tidak valid.";

    private static final String CSV_EXTENSION = ".csv";
    private static final String CSV_MIME_TYPE = "text/csv";

    private final ExamCsvParser examCsvParser;
    private final CsvImportProperties properties;

    /**
     * @param file         uploaded file already stored on disk
     * @param originalName file name as sent by the browser, may be {@code null}
     * @param contentType  MIME type as sent by the browser, may be {@code null}
     * @param pool         pool the questions are imported into
     */
    public QuestionImportBatch importQuestions(Path file, String originalName, String contentType, QuestionPool pool) {
        if (file == null) {
            throw new ValidationException("Question file is required");
        }
        if (pool == null) {
            throw new IllegalArgumentException("QuestionPool is required");
        }
        if (!isCsv(originalName, contentType)) {
            throw new ValidationException(NOT_CSV_MESSAGE);
        }
        checkSize(file);

        List<ParsedQuestion> questions;
        try {
            questions = examCsvParser.parse(file, pool);
        } catch (RuntimeException ex) {
            log.debug("Rejected {} question file {}: {}", pool.label(), originalName, ex.getMessage());
            throw new InvalidQuestionCsvException(INVALID_CSV_MESSAGE, ex);
        }
        if (questions.isEmpty()) {
            throw new InvalidQuestionCsvException(EMPTY_CSV_MESSAGE);
        }

        log.info("Accepted {} {} questions from {}", questions.size(), pool.label(), originalName);
        return new QuestionImportBatch(pool, questions);
    }

    boolean isCsv(String originalName, String contentType) {
        if (contentType != null && CSV_MIME_TYPE.equalsIgnoreCase(contentType.trim())) {
            return true;
        }
        return originalName != null && originalName.toLowerCase(Locale.ROOT).endsWith(CSV_EXTENSION);
    }

    private void checkSize(Path file) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read size of " + file, ex);
        }
        long limit = properties.getMaxFileSize().toBytes();
        if (size > limit) {
            throw new ValidationException(String.format(
                    "Ukuran file soal melebihi batas %d MB.", properties.getMaxFileSize().toMegabytes()));
        }
    }
}
