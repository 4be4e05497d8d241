package com.correlationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single observed, timestamped security log entry.
 *
 * <p>
 * Instances are produced by the ingestion pipeline and are immutable. When no
 * {@code id} is supplied a random UUID is assigned so that every event can be
 * referenced from a {@link Correlation}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code channel} and {@code timestamp} are
 * required; omitting either throws {@link NullPointerException} at build
 * time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawEvent {

    private final String id;
    private final String channel;
    private final int eventId;
    private final String actor;
    private final String host;
    private final Instant timestamp;
    private final String message;

    @JsonCreator
    RawEvent(@JsonProperty("id") String id,
            @JsonProperty("channel") String channel,
            @JsonProperty("eventId") int eventId,
            @JsonProperty("actor") String actor,
            @JsonProperty("host") String host,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("message") String message) {
        this.id = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.eventId = eventId;
        this.actor = actor != null ? actor : "";
        this.host = host != null ? host : "";
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.message = message != null ? message : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RawEvent}.
     */
    public static class Builder {
        private String id;
        private String channel;
        private int eventId;
        private String actor;
        private String host;
        private Instant timestamp;
        private String message;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder eventId(int eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public RawEvent build() {
            return new RawEvent(id, channel, eventId, actor, host, timestamp, message);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getChannel() {
        return channel;
    }

    /** Numeric event-type id as emitted by the log source (e.g. 4625). */
    public int getEventId() {
        return eventId;
    }

    /** User or account that performed the action; empty when unknown. */
    public String getActor() {
        return actor;
    }

    public String getHost() {
        return host;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawEvent that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "RawEvent{" +
                "id='" + id + '\'' +
                ", channel='" + channel + '\'' +
                ", eventId=" + eventId +
                ", actor='" + actor + '\'' +
                ", host='" + host + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
