package com.graphload.core.service.task;

/**
 * Piecewise progress scale of one file: 0-10% preparing, 10-90% batches, 100% done.
 */
public final class ProgressCalculator {

    public static final int VALIDATING = 5;
    public static final int PARSING = 10;
    public static final int SYNCING = 12;
    public static final int COMPLETE = 100;

    private static final int BATCH_START = 10;
    private static final int BATCH_SPAN = 80;

    private ProgressCalculator() {
    }

    /**
     * Percentage after {@code processed} of {@code total} rows went through the batches.
     */
    public static int batchPercentage(int processed, int total) {
        if (total <= 0) {
            return BATCH_START + BATCH_SPAN;
        }
        int bounded = Math.min(Math.max(processed, 0), total);
        return BATCH_START + (int) ((long) bounded * BATCH_SPAN / total);
    }
}
