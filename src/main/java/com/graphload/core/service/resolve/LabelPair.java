package com.graphload.core.service.resolve;

/**
 * Endpoint labels of a relationship type.
 */
public record LabelPair(String source, String target) {
}
