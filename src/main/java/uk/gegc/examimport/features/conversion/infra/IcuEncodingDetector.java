package uk.gegc.examimport.features.conversion.infra;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examimport.features.conversion.domain.EncodingDetector;

import java.util.Optional;

/**
 * ICU4J backed encoding detector.
 */
@Component
@Slf4j
public class IcuEncodingDetector implements EncodingDetector {

    @Override
    public Optional<String> detect(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }

        CharsetDetector detector = new CharsetDetector();
        detector.setText(bytes);
        CharsetMatch match = detector.detect();
        if (match == null) {
            log.debug("No charset match for {} bytes", bytes.length);
            return Optional.empty();
        }

        log.debug("Detected charset {} with confidence {}", match.getName(), match.getConfidence());
        return Optional.ofNullable(match.getName());
    }
}
