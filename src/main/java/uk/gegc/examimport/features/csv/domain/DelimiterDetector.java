package uk.gegc.examimport.features.csv.domain;

/**
 * Chooses the field delimiter of a decoded CSV document.
 */
public interface DelimiterDetector {

    char COMMA = ',';
    char SEMICOLON = ';';

    char detect(String content);
}
