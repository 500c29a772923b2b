package com.graphload.core.service.csv;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ValueConverterTest {

    @Test
    @DisplayName("Should convert values to their column type")
    void shouldConvertTypedValues() {
        assertThat(ValueConverter.convert("42", ColumnMetadata.of(DataType.INTEGER, "42"))).isEqualTo(42L);
        assertThat(ValueConverter.convert("2.5", ColumnMetadata.of(DataType.FLOAT, "2.5"))).isEqualTo(2.5d);
        assertThat(ValueConverter.convert("Yes", ColumnMetadata.of(DataType.BOOLEAN, "Yes"))).isEqualTo(true);
        assertThat(ValueConverter.convert("0", ColumnMetadata.of(DataType.BOOLEAN, "0"))).isEqualTo(false);
        assertThat(ValueConverter.convert("Alice", ColumnMetadata.of(DataType.STRING, "Alice"))).isEqualTo("Alice");
    }

    @Test
    @DisplayName("Should parse temporal values with the detected layout")
    void shouldConvertTemporalValues() {
        var date = new ColumnMetadata(DataType.DATE, "15/01/2024", TemporalFormat.EUROPEAN_DATE);
        var dateTime = new ColumnMetadata(DataType.DATETIME, "2024-01-15T10:30:00", TemporalFormat.ISO_DATETIME);

        assertThat(ValueConverter.convert("15/01/2024", date)).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(ValueConverter.convert("2024-01-15T10:30:00", dateTime))
                .isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 30));
    }

    @Test
    @DisplayName("Should keep values the column type cannot represent as text")
    void shouldKeepUnconvertibleValues() {
        var integer = ColumnMetadata.of(DataType.INTEGER, "1");
        var date = new ColumnMetadata(DataType.DATE, "2024-01-15", TemporalFormat.ISO_DATE);

        assertThat(ValueConverter.convert("n/a", integer)).isEqualTo("n/a");
        assertThat(ValueConverter.convert("yesterday", date)).isEqualTo("yesterday");
    }

    @Test
    @DisplayName("Should return null for empty values")
    void shouldReturnNullForEmpty() {
        assertThat(ValueConverter.convert("", ColumnMetadata.of(DataType.STRING, "x"))).isNull();
        assertThat(ValueConverter.convert(null, ColumnMetadata.of(DataType.STRING, "x"))).isNull();
    }

    @Test
    @DisplayName("Should coerce whole-number identifiers to longs")
    void shouldCoerceIdentifiers() {
        assertThat(IdentifierCoercion.coerce(" 17 ")).isEqualTo(17L);
        assertThat(IdentifierCoercion.coerce("-3")).isEqualTo(-3L);
        assertThat(IdentifierCoercion.coerce("P-17")).isEqualTo("P-17");
        assertThat(IdentifierCoercion.coerce("1.0")).isEqualTo("1.0");
        assertThat(IdentifierCoercion.coerce("99999999999999999999")).isEqualTo("99999999999999999999");
        assertThat(IdentifierCoercion.coerce("  ")).isNull();
    }
}
