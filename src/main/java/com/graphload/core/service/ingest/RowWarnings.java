package com.graphload.core.service.ingest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Warnings collected while ingesting one file, retaining the first
 * {@code limit} distinct messages and counting skipped rows separately.
 */
public class RowWarnings {

    private final int limit;
    private final Set<String> retained = new LinkedHashSet<>();
    private int total;
    private int skippedRows;

    public RowWarnings(int limit) {
        this.limit = limit;
    }

    public void add(String warning) {
        if (retained.contains(warning)) {
            return;
        }
        total++;
        if (retained.size() < limit) {
            retained.add(warning);
        }
    }

    public void addAll(Collection<String> warnings) {
        warnings.forEach(this::add);
    }

    /**
     * Records a skipped row with its reason.
     */
    public void skip(String reason) {
        skippedRows++;
        add(reason);
    }

    public List<String> retained() {
        return new ArrayList<>(retained);
    }

    public int total() {
        return total;
    }

    public int skippedRows() {
        return skippedRows;
    }
}
