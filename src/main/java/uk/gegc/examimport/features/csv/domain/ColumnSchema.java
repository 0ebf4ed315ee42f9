package uk.gegc.examimport.features.csv.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Column names of the question CSV template.
 */
public final class ColumnSchema {

    public static final String PROMPT = "prompt";
    public static final String PROMPT_IMAGE = "prompt_image";
    public static final String EXPLANATION = "explanation";
    public static final String EXPLANATION_IMAGE_URL = "explanationImageUrl";
    public static final String LEGACY_EXPLANATION_IMAGE = "explanation_image";
    public static final String ORDER = "order";

    public static final String OPTION_PREFIX = "option_";
    public static final String IMAGE_SUFFIX = "_image";
    public static final String CORRECT_SUFFIX = "_correct";

    public static final List<String> OPTION_LETTERS = List.of("a", "b", "c", "d", "e");

    /** option_a .. option_e */
    public static final List<String> FIXED_OPTION_COLUMNS = OPTION_LETTERS.stream()
            .map(letter -> OPTION_PREFIX + letter)
            .toList();

    /** Header assumed when a file does not provide one. */
    public static final List<String> DEFAULT_HEADERS = buildDefaultHeaders();

    private static final Set<String> TEXT_COLUMNS = buildTextColumns();

    private ColumnSchema() {
    }

    /**
     * Free-text columns where an author may have typed a raw delimiter: prompt, explanation,
     * image URLs and the template's option labels and option images. Names match exactly.
     */
    public static boolean isTextCapable(String column) {
        return column != null && TEXT_COLUMNS.contains(column);
    }

    /**
     * True for every {@code option_*} column that is not a {@code _correct} flag,
     * e.g. {@code option_a}, {@code option_f} or {@code option_a_image}.
     */
    public static boolean isOptionColumn(String column) {
        if (column == null) {
            return false;
        }
        String lower = column.toLowerCase(Locale.ROOT);
        return lower.startsWith(OPTION_PREFIX) && !lower.endsWith(CORRECT_SUFFIX);
    }

    private static Set<String> buildTextColumns() {
        Set<String> columns = new HashSet<>(List.of(
                PROMPT, PROMPT_IMAGE, EXPLANATION, EXPLANATION_IMAGE_URL, LEGACY_EXPLANATION_IMAGE));
        for (String option : FIXED_OPTION_COLUMNS) {
            columns.add(option);
            columns.add(option + IMAGE_SUFFIX);
        }
        return Set.copyOf(columns);
    }

    private static List<String> buildDefaultHeaders() {
        List<String> headers = new ArrayList<>(List.of(PROMPT, PROMPT_IMAGE, EXPLANATION, EXPLANATION_IMAGE_URL, ORDER));
        for (String option : FIXED_OPTION_COLUMNS) {
            headers.add(option);
            headers.add(option + IMAGE_SUFFIX);
            headers.add(option + CORRECT_SUFFIX);
        }
        return List.copyOf(headers);
    }
}
