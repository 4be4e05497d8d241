package com.correlationsentinel.core;

import com.correlationsentinel.core.model.RawEvent;
import com.correlationsentinel.core.model.RiskLevel;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SecurityEventType;
import com.correlationsentinel.core.model.SecurityFinding;

import java.time.Instant;
import java.util.List;

/**
 * Fixture factory shared by the unit tests.
 */
public final class TestEvents {

    /** A Tuesday, 10:00 UTC: weekday business hours, aligned to a 30-minute bucket. */
    public static final Instant BASE = Instant.parse("2024-03-12T10:00:00Z");

    private TestEvents() {
    }

    public static RawEvent raw(String id, String channel, int eventId, String actor, String host, Instant at) {
        return RawEvent.builder()
                .id(id)
                .channel(channel)
                .eventId(eventId)
                .actor(actor)
                .host(host)
                .timestamp(at)
                .message("event " + id)
                .build();
    }

    /** Security/4625 failed logon by alice on ws-01. */
    public static RawEvent failedLogon(String id, Instant at) {
        return raw(id, "Security", 4625, "alice", "ws-01", at);
    }

    public static SecurityFinding finding(SecurityEventType type, RiskLevel risk, int confidence,
            String... techniques) {
        return SecurityFinding.builder()
                .eventType(type)
                .riskLevel(risk)
                .confidence(confidence)
                .summary(type.displayName() + " observed")
                .techniqueIds(List.of(techniques))
                .build();
    }

    public static SecurityEvent event(String id, SecurityEventType type, String host, Instant at,
            String... techniques) {
        RawEvent raw = raw(id, "Security", 4688, "alice", host, at);
        return new SecurityEvent(raw, type, List.of(techniques), type.displayName() + " on " + host);
    }
}
