package com.graphload.core.service.resolve;

import java.util.List;

/**
 * Thrown when a relationship file refers to node labels the dataset does not have.
 */
public class LabelResolutionException extends RuntimeException {

    private final List<String> missingLabels;

    public LabelResolutionException(String message, List<String> missingLabels) {
        super(message);
        this.missingLabels = List.copyOf(missingLabels);
    }

    public static LabelResolutionException labelsNotAvailable(List<String> missingLabels) {
        return new LabelResolutionException(String.join(", ", missingLabels)
                + " node(s) not available in dataset. Please upload the corresponding node file(s) first.",
                missingLabels);
    }

    public static LabelResolutionException noNodeLabels() {
        return new LabelResolutionException(
                "No node labels available in dataset. Please upload the corresponding node file(s) first.",
                List.of());
    }

    public List<String> getMissingLabels() {
        return missingLabels;
    }
}
