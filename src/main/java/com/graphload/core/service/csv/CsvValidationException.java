package com.graphload.core.service.csv;

import java.util.List;

/**
 * Thrown when a CSV file fails structural validation.
 */
public class CsvValidationException extends RuntimeException {

    private final transient ValidationResult result;

    public CsvValidationException(ValidationResult result) {
        super(result.errors().isEmpty() ? "CSV validation failed" : result.errors().get(0));
        this.result = result;
    }

    public List<String> getErrors() {
        return result.errors();
    }

    public List<String> getWarnings() {
        return result.warnings();
    }

    public ValidationResult getResult() {
        return result;
    }
}
