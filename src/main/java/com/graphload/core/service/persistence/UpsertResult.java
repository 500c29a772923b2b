package com.graphload.core.service.persistence;

/**
 * Counts reported by the graph store for one upsert batch.
 *
 * @param submitted rows sent to the store
 * @param written rows the store matched or merged
 * @param created entities newly created, as reported by the store's counters
 */
public record UpsertResult(int submitted, long written, long created) {

    public static UpsertResult empty() {
        return new UpsertResult(0, 0, 0);
    }
}
