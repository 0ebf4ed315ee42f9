package uk.gegc.examimport.features.csv.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One parsed CSV line keyed by header name, in header order.
 */
@EqualsAndHashCode
@ToString
public final class RawRow {

    private final Map<String, String> cells;

    private RawRow(Map<String, String> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    /**
     * Builds a row from parallel header and value lists. A repeated header keeps its first value.
     */
    public static RawRow of(List<String> headers, List<String> values) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = i < values.size() ? values.get(i) : "";
            cells.putIfAbsent(headers.get(i), value == null ? "" : value);
        }
        return new RawRow(cells);
    }

    public List<String> columnNames() {
        return List.copyOf(cells.keySet());
    }

    /**
     * Returns the cell for the column, matching the name exactly first and ignoring case second.
     *
     * @return the cell value, or {@code null} when the row has no such column
     */
    public String get(String column) {
        String key = resolveKey(column);
        return key != null ? cells.get(key) : null;
    }

    private String resolveKey(String column) {
        if (column == null) {
            return null;
        }
        if (cells.containsKey(column)) {
            return column;
        }
        for (String key : cells.keySet()) {
            if (key.equalsIgnoreCase(column)) {
                return key;
            }
        }
        return null;
    }
}
