package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.model.SecurityEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.correlationsentinel.core.TestEvents.BASE;
import static com.correlationsentinel.core.TestEvents.failedLogon;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BurstScoreCalculator}.
 */
class BurstScoreCalculatorTest {

    @Test
    @DisplayName("Step function should map counts to the documented scores")
    void stepValues() {
        assertThat(BurstScoreCalculator.stepFor(0)).isEqualTo(0.0);
        assertThat(BurstScoreCalculator.stepFor(1)).isEqualTo(0.0);
        assertThat(BurstScoreCalculator.stepFor(2)).isEqualTo(0.2);
        assertThat(BurstScoreCalculator.stepFor(3)).isEqualTo(0.5);
        assertThat(BurstScoreCalculator.stepFor(4)).isEqualTo(0.5);
        assertThat(BurstScoreCalculator.stepFor(5)).isEqualTo(0.8);
        assertThat(BurstScoreCalculator.stepFor(9)).isEqualTo(0.8);
        assertThat(BurstScoreCalculator.stepFor(10)).isEqualTo(1.0);
        assertThat(BurstScoreCalculator.stepFor(50)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Score should never decrease as the count grows")
    void monotonic() {
        double previous = 0.0;
        for (int count = 0; count <= 20; count++) {
            double score = BurstScoreCalculator.stepFor(count);
            assertThat(score).isGreaterThanOrEqualTo(previous)
                    .isIn(0.0, 0.2, 0.5, 0.8, 1.0);
            previous = score;
        }
    }

    @Test
    @DisplayName("Should count only same-key events of the last minute")
    void countsLastMinute() {
        EventHistoryStore history = new EventHistoryStore(Duration.ofMinutes(5));
        BurstScoreCalculator calculator = new BurstScoreCalculator(history);

        record(history, "old", BASE);
        SecurityEvent last = null;
        for (int i = 0; i < 5; i++) {
            last = record(history, "e" + i, BASE.plusSeconds(100 + i * 5L));
        }

        assertThat(calculator.score(last, BASE.plusSeconds(120))).isEqualTo(0.8);
    }

    private static SecurityEvent record(EventHistoryStore history, String id, Instant at) {
        SecurityEvent event = SecurityEvent.of(failedLogon(id, at), null);
        history.record(event, at);
        return event;
    }
}
