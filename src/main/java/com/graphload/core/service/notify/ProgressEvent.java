package com.graphload.core.service.notify;

import java.time.Instant;
import java.util.Map;

/**
 * A task update as delivered to subscribers.
 */
public record ProgressEvent(
        long taskId,
        EventType type,
        Map<String, Object> data,
        Instant timestamp
) {

    public ProgressEvent {
        data = Map.copyOf(data);
    }

    public Object percentage() {
        return data.get("percentage");
    }
}
