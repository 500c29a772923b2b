package com.graphload.core.service.csv;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvFileParserTest {

    private final CsvFileParser parser = new CsvFileParser(new CsvParserFactory(), new ColumnTypeDetector(100));

    @Test
    @DisplayName("Should read rows with file row numbers and trimmed values")
    void shouldReadRows() {
        var csv = parse("id,name,age\n1, Alice ,30\n\n2,\"Bob, Jr.\",\n");

        assertThat(csv.rowCount()).isEqualTo(2);
        assertThat(csv.rows().get(0).rowNumber()).isEqualTo(2);
        assertThat(csv.rows().get(0).get("name")).isEqualTo("Alice");
        assertThat(csv.rows().get(1).rowNumber()).isEqualTo(4);
        assertThat(csv.rows().get(1).get("name")).isEqualTo("Bob, Jr.");
        assertThat(csv.rows().get(1).isEmpty("age")).isTrue();
    }

    @Test
    @DisplayName("Should infer column types from non-empty values")
    void shouldInferColumnTypes() {
        var csv = parse("id,score,active,joined,notes\n1,1.5,true,2024-01-15,\n2,2,no,2024-02-01,\n");

        assertThat(csv.dataTypes()).containsExactly(
                Map.entry("id", DataType.INTEGER),
                Map.entry("score", DataType.FLOAT),
                Map.entry("active", DataType.BOOLEAN),
                Map.entry("joined", DataType.DATE),
                Map.entry("notes", DataType.UNKNOWN));
        assertThat(csv.sampleValues()).containsEntry("score", "1.5").containsEntry("notes", null);
        assertThat(csv.column("joined").format()).isEqualTo(TemporalFormat.ISO_DATE);
    }

    @Test
    @DisplayName("Should pad short rows with nulls")
    void shouldPadShortRows() {
        var csv = parse("id,name\n1\n");

        assertThat(csv.rows().get(0).values()).containsEntry("id", "1").containsEntry("name", null);
    }

    @Test
    @DisplayName("Should keep the header of a file without data rows")
    void shouldParseHeaderOnlyFile() {
        var csv = parse("source_id,target_id\n");

        assertThat(csv.rowCount()).isZero();
        assertThat(csv.columnNames()).containsExactly("source_id", "target_id");
    }

    @Test
    @DisplayName("Should fail when the file has no header row")
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> parse(""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no header row");
    }

    private ParsedCsv parse(String content) {
        return parser.parse(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }
}
