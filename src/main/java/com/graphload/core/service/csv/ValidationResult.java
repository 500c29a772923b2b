package com.graphload.core.service.csv;

import com.graphload.core.service.task.FileKind;

import java.util.List;

/**
 * Outcome of validating one CSV file.
 *
 * @param kind kind detected from the header, null when the header could not be read
 */
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        FileKind kind
) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings, FileKind kind) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, kind);
    }
}
