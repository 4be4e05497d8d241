package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SecurityEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.correlationsentinel.core.TestEvents.BASE;
import static com.correlationsentinel.core.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

class BatchAnalyzerTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);
    private static final Instant NOW = BASE.plus(Duration.ofHours(1));
    private static final List<SecurityEvent> EVENTS =
            List.of(event("e1", SecurityEventType.PROCESS_CREATION, "ws-01", BASE));

    @Test
    @DisplayName("Should concatenate stage results in stage order")
    void runsStagesInOrder() {
        BatchAnalyzer analyzer = new BatchAnalyzer(List.of(
                new FixedDetector("first", CorrelationType.TEMPORAL_BURST),
                new FixedDetector("second", CorrelationType.ATTACK_CHAIN)));

        List<Correlation> result = analyzer.analyze(EVENTS, WINDOW, NOW, () -> false);

        assertThat(result).extracting(Correlation::getPattern).containsExactly("first", "second");
    }

    @Test
    @DisplayName("A failing stage should be skipped while the others still run")
    void failingStageIsIsolated() {
        BatchAnalyzer analyzer = new BatchAnalyzer(List.of(
                new FailingDetector(),
                new FixedDetector("survivor", CorrelationType.LATERAL_MOVEMENT)));

        List<Correlation> result = analyzer.analyze(EVENTS, WINDOW, NOW, () -> false);

        assertThat(result).extracting(Correlation::getPattern).containsExactly("survivor");
    }

    @Test
    @DisplayName("Cancellation should skip the remaining stages and keep partial results")
    void cancellationKeepsPartialResults() {
        AtomicInteger checks = new AtomicInteger();
        BatchAnalyzer analyzer = new BatchAnalyzer(List.of(
                new FixedDetector("first", CorrelationType.TEMPORAL_BURST),
                new FixedDetector("second", CorrelationType.ATTACK_CHAIN)));

        List<Correlation> result = analyzer.analyze(EVENTS, WINDOW, NOW, () -> checks.incrementAndGet() > 1);

        assertThat(result).extracting(Correlation::getPattern).containsExactly("first");
    }

    @Test
    @DisplayName("An empty batch should yield nothing without running stages")
    void emptyBatch() {
        FixedDetector detector = new FixedDetector("never", CorrelationType.TEMPORAL_BURST);

        assertThat(new BatchAnalyzer(List.of(detector)).analyze(List.of(), WINDOW, NOW, () -> false)).isEmpty();
        assertThat(detector.calls).isZero();
    }

    @Test
    @DisplayName("Default stages should find bursts and the brute-force chain")
    void defaultStages() {
        List<SecurityEvent> events = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            events.add(event("f" + i, SecurityEventType.AUTHENTICATION_FAILURE, "ws-01",
                    BASE.plusSeconds(15L * i), "T1110"));
        }
        events.add(event("s", SecurityEventType.AUTHENTICATION_SUCCESS, "ws-01", BASE.plusSeconds(90), "T1078"));

        List<Correlation> result = new BatchAnalyzer(LateralMovementDetector.DEFAULT_BUCKET_WIDTH)
                .analyze(events, WINDOW, NOW, () -> false);

        assertThat(result).filteredOn(c -> c.getType() == CorrelationType.TEMPORAL_BURST).hasSize(3);
        assertThat(result).filteredOn(c -> c.getType() == CorrelationType.ATTACK_CHAIN)
                .singleElement()
                .satisfies(c -> assertThat(c.getMetadata()).containsEntry("attackType", "Brute Force Attack"));
    }

    private static final class FixedDetector implements BatchDetector {
        private final String name;
        private final CorrelationType type;
        private int calls;

        FixedDetector(String name, CorrelationType type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public List<Correlation> detect(List<SecurityEvent> events, Duration window, Instant now) {
            calls++;
            return List.of(Correlation.builder()
                    .type(type)
                    .confidence(0.9)
                    .pattern(name)
                    .eventIds(List.of(events.get(0).getId()))
                    .detectedAt(now)
                    .build());
        }

        @Override
        public String getName() {
            return name;
        }
    }

    private static final class FailingDetector implements BatchDetector {
        @Override
        public List<Correlation> detect(List<SecurityEvent> events, Duration window, Instant now) {
            throw new IllegalStateException("boom");
        }

        @Override
        public String getName() {
            return "failing";
        }
    }
}
