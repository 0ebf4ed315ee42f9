package uk.gegc.examimport.features.csv.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.csv.domain.RecordLengthMismatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Quote-aware CSV parser backed by Apache Commons CSV. The first record is the header and
 * every following record must have exactly as many fields.
 */
@Component
@Slf4j
public class StrictRowParser {

    /**
     * @throws RecordLengthMismatchException when a record's field count differs from the header's
     * @throws UncheckedIOException as raised by Commons CSV for any other malformed content,
     *                              such as an unterminated quote
     */
    public List<RawRow> parse(String content, char delimiter) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote('"')
                .setIgnoreEmptyLines(true)
                .setIgnoreSurroundingSpaces(true)
                .setTrim(true)
                .build();

        try (CSVParser parser = CSVParser.parse(content, format)) {
            Iterator<CSVRecord> records = parser.iterator();
            List<String> headers = null;
            List<RawRow> rows = new ArrayList<>();

            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (isBlank(record)) {
                    continue;
                }
                List<String> values = normalize(record);
                if (headers == null) {
                    headers = values;
                    continue;
                }
                if (values.size() != headers.size()) {
                    throw new RecordLengthMismatchException(
                            parser.getCurrentLineNumber(), headers.size(), values.size());
                }
                rows.add(RawRow.of(headers, values));
            }

            log.debug("Strict parser produced {} rows", rows.size());
            return rows;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private boolean isBlank(CSVRecord record) {
        return record.size() == 1 && record.get(0).isBlank();
    }

    private List<String> normalize(CSVRecord record) {
        List<String> values = new ArrayList<>(record.size());
        for (String value : record) {
            values.add(CellNormalizer.normalize(value));
        }
        return values;
    }
}
