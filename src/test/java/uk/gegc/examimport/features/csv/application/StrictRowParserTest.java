package uk.gegc.examimport.features.csv.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.examimport.features.csv.domain.RawRow;
import uk.gegc.examimport.features.csv.domain.RecordLengthMismatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StrictRowParser")
class StrictRowParserTest {

    private final StrictRowParser parser = new StrictRowParser();

    @Test
    @DisplayName("parse keys rows by header")
    void parse_keysRowsByHeader() {
        List<RawRow> rows = parser.parse("prompt,explanation\nApa?,Karena\nLagi?,Sebab\n", ',');

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).columnNames()).containsExactly("prompt", "explanation");
        assertThat(rows.get(0).get("prompt")).isEqualTo("Apa?");
        assertThat(rows.get(1).get("explanation")).isEqualTo("Sebab");
    }

    @Test
    @DisplayName("parse honours quoted delimiters and doubled quotes")
    void parse_quotedFields() {
        String content = "prompt,explanation\n\"Apa, ini?\",\"Disebut \"\"kuis\"\" di sini\"\n";

        List<RawRow> rows = parser.parse(content, ',');

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("prompt")).isEqualTo("Apa, ini?");
        assertThat(rows.get(0).get("explanation")).isEqualTo("Disebut \"kuis\" di sini");
    }

    @Test
    @DisplayName("parse keeps newlines inside quoted fields")
    void parse_quotedNewline() {
        List<RawRow> rows = parser.parse("prompt,explanation\n\"baris satu\nbaris dua\",ok\n", ',');

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("prompt")).isEqualTo("baris satu\nbaris dua");
    }

    @Test
    @DisplayName("parse skips blank and whitespace-only lines")
    void parse_blankLinesSkipped() {
        List<RawRow> rows = parser.parse("a,b\r\n\r\n1,2\r\n   \r\n3,4\r\n", ',');

        assertThat(rows).extracting(row -> row.get("a")).containsExactly("1", "3");
    }

    @Test
    @DisplayName("parse normalizes header names and cells")
    void parse_normalizesValues() {
        List<RawRow> rows = parser.parse("\uFEFFprompt , explanation\n  Apa?  ,  Karena  \n", ',');

        assertThat(rows.get(0).columnNames()).containsExactly("prompt", "explanation");
        assertThat(rows.get(0).get("prompt")).isEqualTo("Apa?");
        assertThat(rows.get(0).get("explanation")).isEqualTo("Karena");
    }

    @Test
    @DisplayName("parse uses the given delimiter")
    void parse_semicolonDelimiter() {
        List<RawRow> rows = parser.parse("prompt;explanation\nApa, ini?;Karena, itu\n", ';');

        assertThat(rows.get(0).get("prompt")).isEqualTo("Apa, ini?");
        assertThat(rows.get(0).get("explanation")).isEqualTo("Karena, itu");
    }

    @Test
    @DisplayName("parse keeps the first value of a repeated header")
    void parse_duplicateHeader_firstWins() {
        List<RawRow> rows = parser.parse("option_a,option_a\nsatu,dua\n", ',');

        assertThat(rows.get(0).get("option_a")).isEqualTo("satu");
        assertThat(rows.get(0).columnNames()).containsExactly("option_a");
    }

    @Test
    @DisplayName("parse returns no rows for empty or header-only content")
    void parse_noDataRows() {
        assertThat(parser.parse("", ',')).isEmpty();
        assertThat(parser.parse("prompt,explanation\n", ',')).isEmpty();
    }

    @Test
    @DisplayName("parse reports extra fields as a record length mismatch")
    void parse_extraField_throwsRecordLengthMismatch() {
        assertThatThrownBy(() -> parser.parse("a,b\n1,2\n3,4,5\n", ','))
                .isInstanceOf(RecordLengthMismatchException.class)
                .hasMessageContaining("Invalid record length")
                .satisfies(ex -> {
                    RecordLengthMismatchException mismatch = (RecordLengthMismatchException) ex;
                    assertThat(mismatch.getExpectedFields()).isEqualTo(2);
                    assertThat(mismatch.getActualFields()).isEqualTo(3);
                });
    }

    @Test
    @DisplayName("parse reports missing fields as a record length mismatch")
    void parse_missingField_throwsRecordLengthMismatch() {
        assertThatThrownBy(() -> parser.parse("a,b,c\n1,2\n", ','))
                .isInstanceOf(RecordLengthMismatchException.class);
    }

    @Test
    @DisplayName("parse lets the Commons CSV error for an unterminated quote through")
    void parse_unterminatedQuote_propagatesCommonsCsvError() {
        assertThatThrownBy(() -> parser.parse("a,b\n\"open,2\n", ','))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("EOF reached before encapsulated token finished")
                .hasCauseInstanceOf(IOException.class);
    }
}
