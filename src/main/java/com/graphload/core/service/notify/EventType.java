package com.graphload.core.service.notify;

/**
 * Kinds of task update published to subscribers.
 */
public enum EventType {
    STATUS,
    PROGRESS,
    ERROR
}
