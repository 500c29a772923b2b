package com.graphload.core.service.csv;

import com.graphload.core.service.task.FileKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvValidatorTest {

    private final CsvValidator validator = new CsvValidator(new CsvParserFactory(), 10000);

    // ==================== Structure ====================

    @Test
    @DisplayName("Should accept a well-formed node file")
    void shouldAcceptNodeFile() {
        var result = validate("id,name\n1,Alice\n2,Bob\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.kind()).isEqualTo(FileKind.NODE);
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("Should classify a file with source_id and target_id as relationships")
    void shouldDetectRelationshipFile() {
        var result = validate("SOURCE_ID , target_id,since\n1,2,2020\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.kind()).isEqualTo(FileKind.RELATIONSHIP);
    }

    @Test
    @DisplayName("Should report an empty file")
    void shouldRejectEmptyFile() {
        var result = validate("");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Empty file");
    }

    @Test
    @DisplayName("Should require a header without blank cells")
    void shouldRejectBlankHeaderCell() {
        var result = validate("id,,name\n1,x,y\n");

        assertThat(result.errors()).containsExactly("First row MUST contain column headers (property names)");
    }

    @Test
    @DisplayName("Should require an id column in node files")
    void shouldRequireIdColumn() {
        var result = validate("name,age\nAlice,30\n");

        assertThat(result.errors()).containsExactly("For node files required fields: id");
    }

    @Test
    @DisplayName("Should require both endpoint columns in relationship files")
    void shouldRequireBothEndpoints() {
        var result = validate("source_id,since\n1,2020\n");

        assertThat(result.kind()).isEqualTo(FileKind.RELATIONSHIP);
        assertThat(result.errors()).containsExactly("For relationship files required fields: target_id");
    }

    @Test
    @DisplayName("Should report duplicate columns case-insensitively")
    void shouldRejectDuplicateColumns() {
        var result = validate("id,Name,name\n1,a,b\n");

        assertThat(result.errors()).containsExactly("Duplicate columns: name");
    }

    @Test
    @DisplayName("Should report rows whose column count differs from the header")
    void shouldRejectRowCountMismatch() {
        var result = validate("id,name\n1,Alice\n2\n3,Carol,extra\n");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly(
                "Row 3: All rows must have the same number of columns (1 vs 2)",
                "Row 4: All rows must have the same number of columns (3 vs 2)");
    }

    @Test
    @DisplayName("Should report invalid UTF-8 as a parsing error")
    void shouldRejectInvalidEncoding() {
        byte[] content = {'i', 'd', '\n', (byte) 0xC3, (byte) 0x28, '\n'};

        var result = validator.validate(new ByteArrayInputStream(content));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).singleElement().asString().startsWith("CSV parsing error:");
    }

    // ==================== Warnings ====================

    @Test
    @DisplayName("Should warn about empty identifiers without failing")
    void shouldWarnAboutEmptyIdentifiers() {
        var result = validate("source_id,target_id\n,2\n1,\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly("Row 2: Empty 'source_id'", "Row 3: Empty 'target_id'");
    }

    @Test
    @DisplayName("Should warn about self-referencing relationships")
    void shouldWarnAboutSelfReference() {
        var result = validate("source_id,target_id\n1,1\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "Row 2: The source and target IDs are the same. This creates a self-referencing relationship.");
    }

    @Test
    @DisplayName("Should warn about a stray quote but not about properly quoted values")
    void shouldWarnAboutUnescapedQuotes() {
        var result = validate("id,note\n1,\"hello, world\"\n2,5\" tall\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "Row 3, Column 2: Possible unescaped quote - Proper CSV escaping for special characters required");
    }

    @Test
    @DisplayName("Should warn about a line break inside a cell value")
    void shouldWarnAboutEmbeddedNewline() {
        var result = validate("id,note\n1,\"first line\nsecond line\"\n2,plain\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "Row 2, Column 2: Newline detected - Proper CSV escaping for special characters required");
    }

    @Test
    @DisplayName("Should ignore blank lines and warn when there are no data rows")
    void shouldWarnWithoutDataRows() {
        var result = validate("id,name\n\n\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly("No data rows found");
    }

    @Test
    @DisplayName("Should stop validating rows past the configured limit")
    void shouldCapValidatedRows() {
        var limited = new CsvValidator(new CsvParserFactory(), 2);

        var result = limited.validate(stream("id,name\n1,a\n2,b\n3\n4\n"));

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).containsExactly(
                "File has more than 2 rows. Validation limited to first 2 rows.");
    }

    @Test
    @DisplayName("Should ignore a byte order mark before the header")
    void shouldIgnoreByteOrderMark() {
        var result = validate("\uFEFFid,name\n1,Alice\n");

        assertThat(result.valid()).isTrue();
        assertThat(result.kind()).isEqualTo(FileKind.NODE);
    }

    // ==================== File Entry Points ====================

    @Test
    @DisplayName("Should throw with the full result when a file is invalid")
    void shouldThrowFromRequireValid(@TempDir Path dir) throws IOException {
        var file = Files.writeString(dir.resolve("bad.csv"), "name\nAlice\n");

        assertThatThrownBy(() -> validator.requireValid(file))
                .isInstanceOf(CsvValidationException.class)
                .satisfies(e -> assertThat(((CsvValidationException) e).getErrors())
                        .containsExactly("For node files required fields: id"));
    }

    @Test
    @DisplayName("Should return the result of a valid file")
    void shouldReturnFromRequireValid(@TempDir Path dir) throws IOException {
        var file = Files.writeString(dir.resolve("good.csv"), "id\n1\n");

        assertThat(validator.requireValid(file).valid()).isTrue();
    }

    private ValidationResult validate(String content) {
        return validator.validate(stream(content));
    }

    private static ByteArrayInputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
