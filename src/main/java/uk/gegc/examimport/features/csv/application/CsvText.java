package uk.gegc.examimport.features.csv.application;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line level helpers shared by delimiter detection and the fallback parser.
 */
final class CsvText {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private CsvText() {
    }

    static List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(LINE_BREAK.split(content, -1));
    }

    /**
     * First line with non-whitespace content, BOM stripped, or an empty string.
     */
    static String firstNonBlankLine(String content) {
        return lines(content).stream()
                .filter(line -> !line.isBlank())
                .findFirst()
                .map(CellNormalizer::stripBom)
                .orElse("");
    }

    static int count(String line, char character) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == character) {
                count++;
            }
        }
        return count;
    }
}
