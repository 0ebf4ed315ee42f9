package uk.gegc.examimport.features.question.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.question.domain.model.ParsedOption;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OptionExtractor")
class OptionExtractorTest {

    private final OptionExtractor extractor = new OptionExtractor();

    @Test
    @DisplayName("extract lists fixed slots a..e in letter order")
    void extract_fixedSlotsInLetterOrder() {
        RawRow row = RawRow.of(
                List.of("option_c", "option_b", "option_a", "option_a_correct"),
                List.of("Tiga", "Dua", "Satu", "1"));

        List<ParsedOption> options = extractor.extract(row);

        assertThat(options).extracting(ParsedOption::label).containsExactly("Satu", "Dua", "Tiga");
        assertThat(options).extracting(ParsedOption::isCorrect).containsExactly(true, false, false);
    }

    @Test
    @DisplayName("extract skips slots with empty labels")
    void extract_emptyLabel_skipped() {
        RawRow row = RawRow.of(
                List.of("option_a", "option_a_correct", "option_b", "option_b_correct", "option_c"),
                List.of("", "true", "Dua", "y", "  "));

        List<ParsedOption> options = extractor.extract(row);

        assertThat(options).containsExactly(new ParsedOption("Dua", null, true));
    }

    @Test
    @DisplayName("extract reads option images")
    void extract_imageUrl() {
        RawRow row = RawRow.of(
                List.of("option_a", "option_a_image", "option_b", "option_b_image"),
                List.of("Satu", "/uploads/a.png", "Dua", ""));

        List<ParsedOption> options = extractor.extract(row);

        assertThat(options).extracting(ParsedOption::imageUrl).startsWith("/uploads/a.png", null);
    }

    @Test
    @DisplayName("extract treats a filled option image column as an option of its own")
    void extract_imageColumnDiscoveredAsOption() {
        RawRow row = RawRow.of(
                List.of("option_a", "option_a_image", "option_a_correct"),
                List.of("Satu", "/uploads/a.png", "1"));

        List<ParsedOption> options = extractor.extract(row);

        assertThat(options).containsExactly(
                new ParsedOption("Satu", "/uploads/a.png", true),
                new ParsedOption("/uploads/a.png", null, false));
    }

    @Test
    @DisplayName("extract appends other option columns after the fixed slots in header order")
    void extract_customOptionColumns() {
        RawRow row = RawRow.of(
                List.of("option_f", "option_f_image", "option_f_correct", "option_a", "option_a_image", "option_e"),
                List.of("Enam", "", "TRUE", "Satu", "", "Lima"));

        List<ParsedOption> options = extractor.extract(row);

        assertThat(options).extracting(ParsedOption::label).containsExactly("Satu", "Lima", "Enam");
        assertThat(options.get(2)).isEqualTo(new ParsedOption("Enam", null, true));
    }

    @Test
    @DisplayName("optionColumns lists every option_* column except _correct flags")
    void optionColumns_excludeOnlyCorrectFlags() {
        RawRow row = RawRow.of(
                List.of("prompt", "option_f", "option_f_image", "option_f_correct", "option_a_image"),
                List.of("Soal", "", "", "", ""));

        assertThat(extractor.optionColumns(row)).containsExactly(
                "option_a", "option_b", "option_c", "option_d", "option_e",
                "option_f", "option_f_image", "option_a_image");
    }

    @Test
    @DisplayName("extract allows several correct options")
    void extract_multipleCorrect() {
        RawRow row = RawRow.of(
                List.of("option_a", "option_a_correct", "option_b", "option_b_correct"),
                List.of("Satu", "1", "Dua", "Y"));

        assertThat(extractor.extract(row)).allMatch(ParsedOption::isCorrect);
    }

    @Test
    @DisplayName("extract matches header names ignoring case")
    void extract_caseInsensitiveHeaders() {
        RawRow row = RawRow.of(
                List.of("Option_A", "OPTION_A_CORRECT"),
                List.of("Satu", "true"));

        assertThat(extractor.extract(row)).containsExactly(new ParsedOption("Satu", null, true));
    }

    @Test
    @DisplayName("isTrue accepts true, 1 and y only")
    void isTrue_values() {
        assertThat(OptionExtractor.isTrue("true")).isTrue();
        assertThat(OptionExtractor.isTrue(" TRUE ")).isTrue();
        assertThat(OptionExtractor.isTrue("1")).isTrue();
        assertThat(OptionExtractor.isTrue("Y")).isTrue();
        assertThat(OptionExtractor.isTrue("yes")).isFalse();
        assertThat(OptionExtractor.isTrue("0")).isFalse();
        assertThat(OptionExtractor.isTrue("false")).isFalse();
        assertThat(OptionExtractor.isTrue("")).isFalse();
        assertThat(OptionExtractor.isTrue(null)).isFalse();
    }
}
