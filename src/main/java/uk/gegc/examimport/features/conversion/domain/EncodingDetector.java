package uk.gegc.examimport.features.conversion.domain;

import java.util.Optional;

/**
 * Guesses the character encoding of a raw byte buffer.
 * Strategy interface so decoding can be tested against fixed detector answers.
 */
public interface EncodingDetector {

    /**
     * Detects the most likely charset of the given bytes.
     *
     * @param bytes the raw file content
     * @return the charset name as reported by the detector, or empty if nothing matched
     */
    Optional<String> detect(byte[] bytes);
}
