package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.model.SecurityEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.correlationsentinel.core.TestEvents.BASE;
import static com.correlationsentinel.core.TestEvents.failedLogon;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CorrelationScoreCalculator}.
 */
class CorrelationScoreCalculatorTest {

    private EventHistoryStore history;
    private CorrelationScoreCalculator calculator;

    @BeforeEach
    void setUp() {
        history = new EventHistoryStore(Duration.ofMinutes(5));
        calculator = new CorrelationScoreCalculator(history);
    }

    @Test
    @DisplayName("A single retained event should score zero")
    void singleEventScoresZero() {
        SecurityEvent event = record("e1", BASE);

        assertThat(calculator.score(event, BASE)).isZero();
    }

    @Test
    @DisplayName("Score should be a tenth of the two-minute count")
    void scalesWithRecentCount() {
        SecurityEvent last = null;
        for (int i = 0; i < 3; i++) {
            last = record("e" + i, BASE.plusSeconds(i * 10L));
        }

        assertThat(calculator.score(last, BASE.plusSeconds(20))).isCloseTo(0.3, within(1e-9));
    }

    @Test
    @DisplayName("A bucket with more than five events should add 0.3, capped at 1.0")
    void largeBucketBonusIsCapped() {
        SecurityEvent last = null;
        for (int i = 0; i < 8; i++) {
            last = record("e" + i, BASE.plusSeconds(i * 5L));
        }

        assertThat(calculator.score(last, BASE.plusSeconds(35))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Only the last two minutes should count towards the base score")
    void onlyRecentEventsCount() {
        for (int i = 0; i < 4; i++) {
            record("old" + i, BASE.plusSeconds(i * 10L));
        }
        record("new0", BASE.plusSeconds(230));
        SecurityEvent last = record("new1", BASE.plusSeconds(240));

        // 2 recent events -> 0.2, plus 0.3 for six retained events
        assertThat(calculator.score(last, BASE.plusSeconds(240))).isCloseTo(0.5, within(1e-9));
    }

    private SecurityEvent record(String id, Instant at) {
        SecurityEvent event = SecurityEvent.of(failedLogon(id, at), null);
        history.record(event, at);
        return event;
    }
}
