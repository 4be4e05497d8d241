package com.correlationsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One matched step of an {@link AttackChain}.
 *
 * @since 1.0.0
 */
public final class AttackStage {

    private final int sequence;
    private final String name;
    private final String eventId;
    private final Instant timestamp;
    private final String description;
    private final String technique;

    public AttackStage(int sequence, String name, String eventId, Instant timestamp,
            String description, String technique) {
        this.sequence = sequence;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.description = description != null ? description : "";
        this.technique = technique;
    }

    public int getSequence() {
        return sequence;
    }

    public String getName() {
        return name;
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    /** @return technique id of the stage event, or {@code null} */
    public String getTechnique() {
        return technique;
    }

    @Override
    public String toString() {
        return "AttackStage{" + sequence + ":" + name + " event=" + eventId + '}';
    }
}
