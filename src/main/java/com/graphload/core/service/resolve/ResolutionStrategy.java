package com.graphload.core.service.resolve;

/**
 * How an endpoint label was determined, from most to least reliable.
 */
public enum ResolutionStrategy {
    HEADER_DECLARED,
    NAME_PATTERN,
    SINGLE_LABEL,
    EXISTENCE_LOOKUP,
    DEFAULT
}
