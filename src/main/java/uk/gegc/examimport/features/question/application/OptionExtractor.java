package uk.gegc.examimport.features.question.application;

import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.csv.domain.ColumnSchema;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.question.domain.model.ParsedOption;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the multiple-choice options of a row. Slots a..e come first, then every other
 * {@code option_*} column that is not a {@code _correct} flag, in header order.
 * Empty labels mean "no option here".
 */
@Component
public class OptionExtractor {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "y");

    public List<ParsedOption> extract(RawRow row) {
        List<ParsedOption> options = new ArrayList<>();
        for (String column : optionColumns(row)) {
            String label = trimmed(row.get(column));
            if (label.isEmpty()) {
                continue;
            }
            String imageUrl = trimmed(row.get(column + ColumnSchema.IMAGE_SUFFIX));
            boolean correct = isTrue(row.get(column + ColumnSchema.CORRECT_SUFFIX));
            options.add(new ParsedOption(label, imageUrl.isEmpty() ? null : imageUrl, correct));
        }
        return options;
    }

    List<String> optionColumns(RawRow row) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> columns = new ArrayList<>();
        for (String column : ColumnSchema.FIXED_OPTION_COLUMNS) {
            if (seen.add(column.toLowerCase(Locale.ROOT))) {
                columns.add(column);
            }
        }
        for (String column : row.columnNames()) {
            if (ColumnSchema.isOptionColumn(column) && seen.add(column.toLowerCase(Locale.ROOT))) {
                columns.add(column);
            }
        }
        return columns;
    }

    static boolean isTrue(String value) {
        if (value == null) {
            return false;
        }
        return TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
