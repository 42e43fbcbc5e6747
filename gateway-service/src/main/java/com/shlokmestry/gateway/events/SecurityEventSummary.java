package com.shlokmestry.gateway.events;

import java.util.List;
import java.util.Map;

public record SecurityEventSummary(
        int totalEvents,
        Map<SecurityEventType, Long> eventsByType,
        Map<Severity, Long> eventsBySeverity,
        List<SecurityEvent> recentEvents,
        List<String> suspiciousClients
) {}
