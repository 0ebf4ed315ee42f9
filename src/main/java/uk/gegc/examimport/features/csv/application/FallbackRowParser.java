package uk.gegc.examimport.features.csv.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.csv.domain.ColumnSchema;
import uk.gegc.examimport.features.csv.domain.RawRow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recovery parser for files whose authors typed raw delimiters inside unquoted text.
 *
 * <p>Every line is split on each delimiter occurrence and tokens are handed out to the header
 * columns left to right. The last column takes whatever is left. A text-capable column (see
 * {@link ColumnSchema#isTextCapable(String)}) keeps taking tokens until the tokens left equal
 * the columns left, so surplus tokens end up in the first text column that can absorb them
 * instead of shifting every later column. Any other column takes exactly one token.
 *
 * <p>The result is a best guess: when two text columns both contain stray delimiters the
 * earlier one receives all the surplus.
 */
@Component
@Slf4j
public class FallbackRowParser {

    public List<RawRow> parse(String content, char delimiter) {
        List<String> headers = extractHeaders(content, delimiter);
        return parse(content, delimiter, headers);
    }

    /**
     * Re-splits every non-blank line after the first using the given header names.
     */
    public List<RawRow> parse(String content, char delimiter, List<String> headers) {
        List<String> lines = CsvText.lines(content).stream()
                .map(line -> CellNormalizer.stripBom(line).trim())
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.isEmpty()) {
            return List.of();
        }

        List<RawRow> rows = new ArrayList<>(lines.size() - 1);
        for (String line : lines.subList(1, lines.size())) {
            rows.add(realign(line, delimiter, headers));
        }
        log.debug("Fallback parser produced {} rows for {} columns", rows.size(), headers.size());
        return rows;
    }

    /**
     * Header names from the first non-blank line, or {@link ColumnSchema#DEFAULT_HEADERS}
     * when that line has no usable name.
     */
    public List<String> extractHeaders(String content, char delimiter) {
        String headerLine = CsvText.firstNonBlankLine(content);
        if (headerLine.isBlank()) {
            return ColumnSchema.DEFAULT_HEADERS;
        }
        List<String> headers = split(headerLine, delimiter).stream()
                .map(CellNormalizer::normalize)
                .toList();
        boolean anyNamed = headers.stream().anyMatch(header -> !header.isEmpty());
        return anyNamed ? headers : ColumnSchema.DEFAULT_HEADERS;
    }

    RawRow realign(String line, char delimiter, List<String> headers) {
        List<String> tokens = split(line, delimiter);
        String separator = String.valueOf(delimiter);
        List<String> values = new ArrayList<>(headers.size());
        int tokenIndex = 0;

        for (int headerIndex = 0; headerIndex < headers.size(); headerIndex++) {
            String header = headers.get(headerIndex);
            int remainingColumns = headers.size() - headerIndex - 1;

            if (remainingColumns == 0) {
                List<String> rest = tokenIndex < tokens.size()
                        ? tokens.subList(tokenIndex, tokens.size())
                        : List.of();
                values.add(CellNormalizer.normalize(String.join(separator, rest)));
                tokenIndex = tokens.size();
            } else if (ColumnSchema.isTextCapable(header)) {
                List<String> chunk = new ArrayList<>();
                while (tokenIndex < tokens.size()) {
                    chunk.add(tokens.get(tokenIndex++));
                    if (tokens.size() - tokenIndex <= remainingColumns) {
                        break;
                    }
                }
                values.add(CellNormalizer.normalize(String.join(separator, chunk)));
            } else {
                String token = tokenIndex < tokens.size() ? tokens.get(tokenIndex) : null;
                tokenIndex++;
                values.add(CellNormalizer.normalize(token));
            }
        }
        return RawRow.of(headers, values);
    }

    private List<String> split(String line, char delimiter) {
        return Arrays.asList(line.split(Pattern.quote(String.valueOf(delimiter)), -1));
    }
}
