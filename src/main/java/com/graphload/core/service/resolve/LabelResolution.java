package com.graphload.core.service.resolve;

import java.util.List;

/**
 * Resolved endpoint labels with the strategy that produced each side.
 *
 * @param warnings low-confidence notes to keep on the task
 */
public record LabelResolution(
        String sourceLabel,
        String targetLabel,
        ResolutionStrategy sourceStrategy,
        ResolutionStrategy targetStrategy,
        List<String> warnings
) {

    public LabelResolution {
        warnings = List.copyOf(warnings);
    }

    public boolean isLowConfidence() {
        return sourceStrategy == ResolutionStrategy.DEFAULT || targetStrategy == ResolutionStrategy.DEFAULT;
    }
}
