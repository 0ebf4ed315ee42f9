package uk.gegc.examimport.features.csv.application;

import java.util.regex.Pattern;

/**
 * Cleans a single header or cell value the same way for every parsing path.
 */
public final class CellNormalizer {

    static final char BOM = '\uFEFF';

    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^\"+|\"+$");

    private CellNormalizer() {
    }

    /**
     * Missing becomes empty, then the leading BOM, leading and trailing runs of double quotes
     * and surrounding whitespace are removed. Inner quotes are left alone.
     */
    public static String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return SURROUNDING_QUOTES.matcher(stripBom(value)).replaceAll("").trim();
    }

    public static String stripBom(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.charAt(0) == BOM ? value.substring(1) : value;
    }
}
