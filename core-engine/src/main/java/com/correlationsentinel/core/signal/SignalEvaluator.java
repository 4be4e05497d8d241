package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SignalScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Runs the three signal calculators for one event and bundles the result.
 *
 * @since 1.0.0
 */
public class SignalEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SignalEvaluator.class);

    private final SignalCalculator correlation;
    private final SignalCalculator burst;
    private final SignalCalculator anomaly;

    public SignalEvaluator(SignalCalculator correlation, SignalCalculator burst, SignalCalculator anomaly) {
        this.correlation = Objects.requireNonNull(correlation, "correlation calculator must not be null");
        this.burst = Objects.requireNonNull(burst, "burst calculator must not be null");
        this.anomaly = Objects.requireNonNull(anomaly, "anomaly calculator must not be null");
    }

    /**
     * Wire the default calculators against a shared history.
     */
    public static SignalEvaluator forHistory(EventHistoryStore history, Pattern serviceAccountPattern) {
        return new SignalEvaluator(
                new CorrelationScoreCalculator(history),
                new BurstScoreCalculator(history),
                new AnomalyScoreCalculator(history, serviceAccountPattern));
    }

    public SignalScores evaluate(SecurityEvent event, Instant now) {
        SignalScores scores = new SignalScores(
                correlation.score(event, now),
                burst.score(event, now),
                anomaly.score(event, now));
        LOG.debug("Signals for event {}: {}", event.getId(), scores);
        return scores;
    }
}
