package com.correlationsentinel.core.history;

import com.correlationsentinel.core.model.RawEvent;

import java.util.Objects;

/**
 * Grouping identity of the event history: {@code channel}, numeric event id
 * and actor.
 *
 * <p>
 * Two events share a key when they come from the same log channel, carry
 * the same event id and were performed by the same actor, e.g.
 * {@code Security_4625_alice}.
 * </p>
 *
 * @since 1.0.0
 */
public final class HistoryKey {

    private final String channel;
    private final int eventId;
    private final String actor;

    public HistoryKey(String channel, int eventId, String actor) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.eventId = eventId;
        this.actor = actor != null ? actor : "";
    }

    public static HistoryKey of(RawEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        return new HistoryKey(event.getChannel(), event.getEventId(), event.getActor());
    }

    public String getChannel() {
        return channel;
    }

    public int getEventId() {
        return eventId;
    }

    public String getActor() {
        return actor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HistoryKey that))
            return false;
        return eventId == that.eventId
                && channel.equals(that.channel)
                && actor.equals(that.actor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, eventId, actor);
    }

    @Override
    public String toString() {
        return channel + "_" + eventId + "_" + actor;
    }
}
