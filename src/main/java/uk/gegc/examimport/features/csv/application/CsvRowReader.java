package uk.gegc.examimport.features.csv.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.examimport.features.conversion.application.ByteDecoder;
import uk.gegc.examimport.features.csv.domain.DelimiterDetector;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.csv.domain.RecordLengthMismatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a CSV file into header-keyed rows: decode, pick the delimiter, parse strictly and
 * fall back to the realigning parser only on a record length mismatch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvRowReader {

    private final ByteDecoder byteDecoder;
    private final DelimiterDetector delimiterDetector;
    private final StrictRowParser strictRowParser;
    private final FallbackRowParser fallbackRowParser;

    public List<RawRow> readRows(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read CSV file " + file, ex);
        }
        return readRows(bytes);
    }

    public List<RawRow> readRows(byte[] bytes) {
        String content = CellNormalizer.stripBom(byteDecoder.decode(bytes));
        char delimiter = delimiterDetector.detect(content);
        try {
            return strictRowParser.parse(content, delimiter);
        } catch (RecordLengthMismatchException ex) {
            log.debug("Strict CSV parsing failed ({}), re-reading with fallback parser", ex.getMessage());
            List<String> headers = fallbackRowParser.extractHeaders(content, delimiter);
            return fallbackRowParser.parse(content, delimiter, headers);
        }
    }
}
