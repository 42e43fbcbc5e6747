package com.shlokmestry.gateway.events;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shlokmestry.gateway.config.DeploymentEnvironment;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Best-effort sink for {@link SecurityEvent}s.
 *
 * <p>Each event is written as one line to the {@code security.events} logger, counted in
 * Micrometer and kept in a bounded in-memory buffer (newest first) for the admin events
 * endpoint. In development a readable rendering is also written to
 * {@code security.console}.
 *
 * <p>Recording never throws and never influences the request that triggered it: if any
 * part of it fails the event is dropped.
 */
public class SecurityEventLogger {

    public static final int DEFAULT_CAPACITY = 1000;

    private static final Logger log = LoggerFactory.getLogger(SecurityEventLogger.class);
    private static final Logger events = LoggerFactory.getLogger("security.events");
    private static final Logger console = LoggerFactory.getLogger("security.console");

    private static final int SUMMARY_RECENT = 10;
    private static final int SUMMARY_SUSPICIOUS = 20;

    private final DeploymentEnvironment environment;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int capacity;

    private final Deque<SecurityEvent> buffer = new ArrayDeque<>();

    public SecurityEventLogger(DeploymentEnvironment environment, Clock clock, MeterRegistry meterRegistry) {
        this(environment, clock, meterRegistry, DEFAULT_CAPACITY);
    }

    public SecurityEventLogger(DeploymentEnvironment environment, Clock clock, MeterRegistry meterRegistry, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.environment = environment;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.capacity = capacity;
    }

    /**
     * Stamps an id and timestamp on a new event and records it.
     */
    public void record(SecurityEventType type, Severity severity, RequestOrigin origin, Map<String, Object> details) {
        try {
            logEvent(new SecurityEvent(
                    "sec_" + UUID.randomUUID(),
                    type,
                    severity,
                    origin.clientIdentity(),
                    origin.route(),
                    origin.method(),
                    Instant.now(clock),
                    details
            ));
        } catch (RuntimeException e) {
            log.debug("security event dropped type={}", type, e);
        }
    }

    public void logEvent(SecurityEvent event) {
        try {
            synchronized (buffer) {
                buffer.addFirst(event);
                while (buffer.size() > capacity) {
                    buffer.removeLast();
                }
            }

            Counter.builder("security.events.total")
                    .description("Recorded security events")
                    .tag("type", event.type().code())
                    .tag("severity", event.severity().name().toLowerCase())
                    .register(meterRegistry)
                    .increment();

            writeLine(event);

            if (environment.isDevelopment()) {
                writeConsole(event);
            }
        } catch (RuntimeException e) {
            log.debug("security event dropped id={}", event == null ? null : event.id(), e);
        }
    }

    public List<SecurityEvent> recent(int limit) {
        return select(e -> true, limit);
    }

    public List<SecurityEvent> byType(SecurityEventType type, int limit) {
        return select(e -> e.type() == type, limit);
    }

    public List<SecurityEvent> byClient(String clientIdentity, int limit) {
        return select(e -> clientIdentity.equals(e.clientIdentity()), limit);
    }

    public SecurityEventSummary summary() {
        List<SecurityEvent> snapshot = snapshot();

        Map<SecurityEventType, Long> byType = new EnumMap<>(SecurityEventType.class);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Set<String> suspicious = new LinkedHashSet<>();

        for (SecurityEvent e : snapshot) {
            byType.merge(e.type(), 1L, Long::sum);
            bySeverity.merge(e.severity(), 1L, Long::sum);
            if (e.clientIdentity() != null && e.severity().atLeast(Severity.HIGH)
                    && suspicious.size() < SUMMARY_SUSPICIOUS) {
                suspicious.add(e.clientIdentity());
            }
        }

        return new SecurityEventSummary(
                snapshot.size(),
                byType,
                bySeverity,
                List.copyOf(snapshot.subList(0, Math.min(SUMMARY_RECENT, snapshot.size()))),
                List.copyOf(suspicious)
        );
    }

    private List<SecurityEvent> select(Predicate<SecurityEvent> filter, int limit) {
        List<SecurityEvent> out = new ArrayList<>();
        synchronized (buffer) {
            Iterator<SecurityEvent> it = buffer.iterator();
            while (it.hasNext() && out.size() < limit) {
                SecurityEvent e = it.next();
                if (filter.test(e)) {
                    out.add(e);
                }
            }
        }
        return out;
    }

    private List<SecurityEvent> snapshot() {
        synchronized (buffer) {
            return new ArrayList<>(buffer);
        }
    }

    private static void writeLine(SecurityEvent e) {
        if (e.severity().atLeast(Severity.HIGH)) {
            events.warn("security_event id={} type={} severity={} client={} method={} route={} details={}",
                    e.id(), e.type().code(), e.severity(), e.clientIdentity(), e.method(), e.route(), e.details());
        } else {
            events.info("security_event id={} type={} severity={} client={} method={} route={} details={}",
                    e.id(), e.type().code(), e.severity(), e.clientIdentity(), e.method(), e.route(), e.details());
        }
    }

    private static void writeConsole(SecurityEvent e) {
        StringBuilder sb = new StringBuilder()
                .append("SECURITY EVENT").append('\n')
                .append("   Type: ").append(e.type().code()).append('\n')
                .append("   Severity: ").append(e.severity()).append('\n')
                .append("   Client: ").append(e.clientIdentity() == null ? "unknown" : e.clientIdentity()).append('\n')
                .append("   Route: ").append(e.method()).append(' ').append(e.route()).append('\n')
                .append("   Time: ").append(e.timestamp());
        if (!e.details().isEmpty()) {
            sb.append('\n').append("   Details: ").append(e.details());
        }
        console.info(sb.toString());
    }
}
