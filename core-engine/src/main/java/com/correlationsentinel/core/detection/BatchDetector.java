package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.SecurityEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Contract for the batch pattern detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: every call works only on
 * the event list it is given and never reads the streaming history, so one
 * instance can serve concurrent batch runs.
 * </p>
 */
public interface BatchDetector {

    /**
     * Detect patterns in a batch of events.
     *
     * @param events immutable snapshot of the events to analyse
     * @param window detector time window
     * @param now    timestamp assigned to produced correlations
     * @return detected correlations, possibly empty
     */
    List<Correlation> detect(List<SecurityEvent> events, Duration window, Instant now);

    /**
     * @return short name used in logs
     */
    String getName();
}
