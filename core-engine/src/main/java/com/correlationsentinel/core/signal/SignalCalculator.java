package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.model.SecurityEvent;

import java.time.Instant;

/**
 * Contract for the streaming signal scorers.
 * <p>
 * Implementations read the shared
 * {@link com.correlationsentinel.core.history.EventHistoryStore} and must be
 * called <strong>after</strong> the event has been recorded there. Scores are
 * in {@code [0, 1]}.
 * </p>
 */
public interface SignalCalculator {

    /**
     * Score a single event.
     *
     * @param event the event just recorded in the history
     * @param now   reference instant for every window computation
     * @return a score in {@code [0, 1]}
     */
    double score(SecurityEvent event, Instant now);

    /**
     * @return short name used in logs
     */
    String getName();
}
