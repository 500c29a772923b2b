package com.graphload.core.service.ingest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RowWarningsTest {

    @Test
    void shouldRetainDistinctWarningsUpToTheLimit() {
        var warnings = new RowWarnings(2);

        warnings.add("Row 2: Empty 'id' value");
        warnings.add("Row 2: Empty 'id' value");
        warnings.add("Row 3: Empty 'id' value");
        warnings.add("Row 4: Empty 'id' value");

        assertThat(warnings.retained()).containsExactly("Row 2: Empty 'id' value", "Row 3: Empty 'id' value");
        assertThat(warnings.total()).isEqualTo(3);
    }

    @Test
    void shouldCountSkippedRowsBeyondTheLimit() {
        var warnings = new RowWarnings(1);

        warnings.skip("Row 2: Missing source_id or target_id");
        warnings.skip("Row 3: Missing source_id or target_id");

        assertThat(warnings.skippedRows()).isEqualTo(2);
        assertThat(warnings.retained()).hasSize(1);
    }
}
