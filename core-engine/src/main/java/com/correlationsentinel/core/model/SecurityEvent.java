package com.correlationsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A {@link RawEvent} paired with the classification an upstream detector gave
 * it.
 *
 * <p>
 * This is the unit retained in the event history and consumed by the batch
 * detectors. Events that arrive without a finding are classified as
 * {@link SecurityEventType#UNKNOWN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SecurityEvent {

    private final RawEvent raw;
    private final SecurityEventType type;
    private final List<String> techniqueIds;
    private final String summary;

    public SecurityEvent(RawEvent raw, SecurityEventType type, List<String> techniqueIds, String summary) {
        this.raw = Objects.requireNonNull(raw, "raw event must not be null");
        this.type = type != null ? type : SecurityEventType.UNKNOWN;
        this.techniqueIds = techniqueIds != null ? List.copyOf(techniqueIds) : List.of();
        this.summary = summary != null ? summary : raw.getMessage();
    }

    /**
     * Classify a raw event with an optional finding.
     *
     * @param raw     the observed event; must not be {@code null}
     * @param finding detector finding, or {@code null} if none was produced
     * @return the classified event
     */
    public static SecurityEvent of(RawEvent raw, SecurityFinding finding) {
        if (finding == null) {
            return new SecurityEvent(raw, SecurityEventType.UNKNOWN, List.of(), raw.getMessage());
        }
        return new SecurityEvent(raw, finding.getEventType(), finding.getTechniqueIds(), finding.getSummary());
    }

    public RawEvent getRaw() {
        return raw;
    }

    public String getId() {
        return raw.getId();
    }

    public SecurityEventType getType() {
        return type;
    }

    public String getHost() {
        return raw.getHost();
    }

    public Instant getTimestamp() {
        return raw.getTimestamp();
    }

    public List<String> getTechniqueIds() {
        return techniqueIds;
    }

    /** @return the first technique id, or {@code null} when there is none */
    public String primaryTechnique() {
        return techniqueIds.isEmpty() ? null : techniqueIds.get(0);
    }

    public String getSummary() {
        return summary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SecurityEvent that))
            return false;
        return raw.equals(that.raw) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, type);
    }

    @Override
    public String toString() {
        return "SecurityEvent{id='" + getId() + "', type=" + type + ", host='" + getHost()
                + "', timestamp=" + getTimestamp() + '}';
    }
}
