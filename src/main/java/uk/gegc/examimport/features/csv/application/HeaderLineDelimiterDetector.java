package uk.gegc.examimport.features.csv.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.csv.config.CsvImportProperties;
import uk.gegc.examimport.features.csv.domain.DelimiterDetector;

/**
 * Picks the delimiter from the header line only. Semicolon wins when it outnumbers commas
 * and appears at least {@code exam.import.csv.semicolon-min-count} times; comma otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeaderLineDelimiterDetector implements DelimiterDetector {

    private final CsvImportProperties properties;

    @Override
    public char detect(String content) {
        String headerLine = CsvText.firstNonBlankLine(content);
        int commas = CsvText.count(headerLine, COMMA);
        int semicolons = CsvText.count(headerLine, SEMICOLON);

        char delimiter = semicolons > commas && semicolons >= properties.getSemicolonMinCount()
                ? SEMICOLON
                : COMMA;
        log.debug("Header line has {} commas and {} semicolons, using '{}'", commas, semicolons, delimiter);
        return delimiter;
    }
}
