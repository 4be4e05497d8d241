package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.history.HistoryKey;
import com.correlationsentinel.core.model.SecurityEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Scores how much an event repeats recent activity of the same key.
 *
 * <p>
 * {@code 0} while fewer than two events are retained for the key; otherwise
 * one tenth of the two-minute count (capped at 1) plus {@code 0.3} when the
 * key holds more than five events, capped at 1.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationScoreCalculator implements SignalCalculator {

    static final Duration RECENT_WINDOW = Duration.ofMinutes(2);

    private final EventHistoryStore history;

    public CorrelationScoreCalculator(EventHistoryStore history) {
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public double score(SecurityEvent event, Instant now) {
        HistoryKey key = HistoryKey.of(event.getRaw());
        int bucketSize = history.size(key);
        if (bucketSize < 2) {
            return 0.0;
        }

        int recent = history.recentCount(key, RECENT_WINDOW, now);
        double score = Math.min(1.0, recent / 10.0);
        if (bucketSize > 5) {
            score += 0.3;
        }
        return Math.min(1.0, score);
    }

    @Override
    public String getName() {
        return "correlation";
    }
}
