package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.RiskLevel;
import com.correlationsentinel.core.model.SecurityEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.correlationsentinel.core.TestEvents.BASE;
import static com.correlationsentinel.core.TestEvents.event;
import static com.correlationsentinel.core.model.SecurityEventType.AUTHENTICATION_SUCCESS;
import static com.correlationsentinel.core.model.SecurityEventType.NETWORK_CONNECTION;
import static com.correlationsentinel.core.model.SecurityEventType.PROCESS_CREATION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LateralMovementDetectorTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);
    private static final Instant NOW = BASE.plus(Duration.ofHours(2));

    private final LateralMovementDetector detector = new LateralMovementDetector();

    @Test
    @DisplayName("Should flag the same access type on three hosts in one bucket")
    void detectsThreeHosts() {
        List<SecurityEvent> events = List.of(
                event("n1", NETWORK_CONNECTION, "ws-01", BASE.plusSeconds(60)),
                event("n2", NETWORK_CONNECTION, "ws-02", BASE.plusSeconds(120)),
                event("n3", NETWORK_CONNECTION, "ws-03", BASE.plusSeconds(180)));

        List<Correlation> result = detector.detect(events, WINDOW, NOW);

        assertThat(result).hasSize(1);
        Correlation c = result.get(0);
        assertThat(c.getType()).isEqualTo(CorrelationType.LATERAL_MOVEMENT);
        assertThat(c.getPattern()).isEqualTo("Lateral Movement");
        assertThat(c.getConfidence()).isCloseTo(0.75, within(1e-9));
        assertThat(c.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(c.getEventIds()).containsExactly("n1", "n2", "n3");
        assertThat(c.getTimeWindow()).isEqualTo(Duration.ofMinutes(30));
        assertThat(c.getSummary()).isEqualTo("Similar NetworkConnection events across 3 machines");
        assertThat(c.getMetadata())
                .containsEntry("affectedHosts", List.of("ws-01", "ws-02", "ws-03"))
                .containsEntry("eventType", "NetworkConnection");
    }

    @Test
    @DisplayName("Repeated events on two hosts should not count as three")
    void requiresDistinctHosts() {
        List<SecurityEvent> events = List.of(
                event("s1", AUTHENTICATION_SUCCESS, "ws-01", BASE.plusSeconds(10)),
                event("s2", AUTHENTICATION_SUCCESS, "ws-01", BASE.plusSeconds(20)),
                event("s3", AUTHENTICATION_SUCCESS, "ws-02", BASE.plusSeconds(30)),
                event("s4", AUTHENTICATION_SUCCESS, "ws-02", BASE.plusSeconds(40)));

        assertThat(detector.detect(events, WINDOW, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Types other than network connection and logon success should be ignored")
    void ignoresOtherTypes() {
        List<SecurityEvent> events = List.of(
                event("p1", PROCESS_CREATION, "ws-01", BASE),
                event("p2", PROCESS_CREATION, "ws-02", BASE),
                event("p3", PROCESS_CREATION, "ws-03", BASE));

        assertThat(detector.detect(events, WINDOW, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Different types should be bucketed separately")
    void separatesTypes() {
        List<SecurityEvent> events = List.of(
                event("n1", NETWORK_CONNECTION, "ws-01", BASE),
                event("n2", NETWORK_CONNECTION, "ws-02", BASE),
                event("s3", AUTHENTICATION_SUCCESS, "ws-03", BASE));

        assertThat(detector.detect(events, WINDOW, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Events straddling a bucket boundary should not be combined")
    void bucketBoundary() {
        List<SecurityEvent> events = List.of(
                event("n1", NETWORK_CONNECTION, "ws-01", BASE.plus(Duration.ofMinutes(29))),
                event("n2", NETWORK_CONNECTION, "ws-02", BASE.plus(Duration.ofSeconds(29 * 60 + 30))),
                event("n3", NETWORK_CONNECTION, "ws-03", BASE.plus(Duration.ofMinutes(31))));

        assertThat(detector.detect(events, WINDOW, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Confidence should grow with host count up to 1.0")
    void confidenceGrows() {
        assertThat(LateralMovementDetector.confidenceFor(5)).isCloseTo(0.85, within(1e-9));
        assertThat(LateralMovementDetector.confidenceFor(20)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Non-positive bucket widths should be rejected")
    void rejectsZeroWidth() {
        assertThatThrownBy(() -> new LateralMovementDetector(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
