package uk.gegc.examimport.features.conversion.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.conversion.domain.EncodingDetector;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Decodes uploaded bytes into text using the detected source encoding.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ByteDecoder {

    private final EncodingDetector encodingDetector;

    /**
     * Decodes the bytes with the charset reported by the {@link EncodingDetector}.
     * UTF-8 is used when nothing is detected.
     *
     * @param bytes the raw file content
     * @return the decoded text
     * @throws java.nio.charset.UnsupportedCharsetException if the detected name is unknown to the JVM
     * @throws java.nio.charset.IllegalCharsetNameException if the detected name is not a legal charset name
     */
    public String decode(byte[] bytes) {
        String detected = encodingDetector.detect(bytes).orElse("UTF-8");
        Charset charset = resolveCharset(detected);
        log.debug("Decoding {} bytes as {}", bytes.length, charset.name());
        return new String(bytes, charset);
    }

    Charset resolveCharset(String detected) {
        String normalized = detected.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("UTF8") || normalized.equals("UTF-8")) {
            return StandardCharsets.UTF_8;
        }
        return Charset.forName(detected.trim());
    }
}
