package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.history.HistoryKey;
import com.correlationsentinel.core.model.SecurityEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Step score over the number of same-key events in the last minute.
 *
 * <table>
 * <caption>Steps</caption>
 * <tr><th>events in 1 min</th><th>score</th></tr>
 * <tr><td>&ge; 10</td><td>1.0</td></tr>
 * <tr><td>&ge; 5</td><td>0.8</td></tr>
 * <tr><td>&ge; 3</td><td>0.5</td></tr>
 * <tr><td>&ge; 2</td><td>0.2</td></tr>
 * <tr><td>otherwise</td><td>0.0</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public class BurstScoreCalculator implements SignalCalculator {

    static final Duration BURST_WINDOW = Duration.ofMinutes(1);

    private final EventHistoryStore history;

    public BurstScoreCalculator(EventHistoryStore history) {
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    @Override
    public double score(SecurityEvent event, Instant now) {
        int count = history.recentCount(HistoryKey.of(event.getRaw()), BURST_WINDOW, now);
        return stepFor(count);
    }

    static double stepFor(int count) {
        if (count >= 10) {
            return 1.0;
        }
        if (count >= 5) {
            return 0.8;
        }
        if (count >= 3) {
            return 0.5;
        }
        if (count >= 2) {
            return 0.2;
        }
        return 0.0;
    }

    @Override
    public String getName() {
        return "burst";
    }
}
