package com.shlokmestry.gateway.api;

import java.util.List;
import java.util.Locale;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gateway.events.SecurityEvent;
import com.shlokmestry.gateway.events.SecurityEventLogger;
import com.shlokmestry.gateway.events.SecurityEventType;

@RestController
@RequestMapping("/api/admin/security")
public class SecurityEventsController {

    static final int MAX_LIMIT = 500;

    private final SecurityEventLogger events;

    public SecurityEventsController(SecurityEventLogger events) {
        this.events = events;
    }

    /**
     * Without filters returns the most recent events and the summary; with {@code type}
     * or {@code ip} only the matching events.
     */
    @GetMapping("/events")
    public SecurityEventsResponse events(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String ip,
            @RequestParam(defaultValue = "50") int limit
    ) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }

        boolean byClient = ip != null && !ip.isBlank();
        if (type != null && !type.isBlank()) {
            SecurityEventType t = parseType(type);
            List<SecurityEvent> matched = events.byType(t, byClient ? SecurityEventLogger.DEFAULT_CAPACITY : limit);
            if (byClient) {
                matched = matched.stream().filter(e -> ip.equals(e.clientIdentity())).limit(limit).toList();
            }
            return new SecurityEventsResponse(matched, null);
        }
        if (byClient) {
            return new SecurityEventsResponse(events.byClient(ip, limit), null);
        }
        return new SecurityEventsResponse(events.recent(limit), events.summary());
    }

    private static SecurityEventType parseType(String raw) {
        String value = raw.trim();
        for (SecurityEventType t : SecurityEventType.values()) {
            if (t.code().equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new InvalidRequestException("Unknown event type: " + value.toLowerCase(Locale.ROOT));
    }
}
