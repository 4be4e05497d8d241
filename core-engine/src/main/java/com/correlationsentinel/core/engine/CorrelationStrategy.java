package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.SecurityEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pluggable, typically learned, correlation detector consulted on the
 * streaming path next to the declarative rules.
 *
 * <p>
 * Implementations must be thread-safe: {@link #detect} is called
 * concurrently from every thread that analyses events.
 * </p>
 *
 * @since 1.0.0
 */
public interface CorrelationStrategy {

    /**
     * @param event  the new event, already recorded in the history
     * @param recent retained events inside the correlation window, oldest
     *               first, including {@code event}
     * @param now    reference instant
     * @return a correlation, or empty when the strategy sees nothing
     */
    Optional<Correlation> detect(SecurityEvent event, List<SecurityEvent> recent, Instant now);

    /**
     * Feed analyst-confirmed correlations back to the strategy. The default
     * does nothing.
     *
     * @param confirmed confirmed correlations
     */
    default void train(List<Correlation> confirmed) {
    }
}
