package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.model.SecurityEvent;

import java.time.Instant;
import java.util.List;

/**
 * Read access to persisted, classified events for the periodic batch
 * analysis.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSource {

    /**
     * @param start inclusive lower bound
     * @param end   exclusive upper bound
     * @return events with a timestamp in {@code [start, end)}
     */
    List<SecurityEvent> eventsBetween(Instant start, Instant end);
}
