package com.shlokmestry.gateway.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SecurityEvent(
        String id,
        SecurityEventType type,
        Severity severity,
        String clientIdentity,
        String route,
        String method,
        Instant timestamp,
        Map<String, Object> details
) {

    public SecurityEvent {
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
