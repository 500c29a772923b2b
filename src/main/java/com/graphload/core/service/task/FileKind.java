package com.graphload.core.service.task;

/**
 * What an uploaded CSV file describes.
 */
public enum FileKind {

    /** One entity per row, keyed by an {@code id} column. */
    NODE,

    /** One edge per row, keyed by {@code source_id} and {@code target_id} columns. */
    RELATIONSHIP
}
