package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.AttackChain;
import com.correlationsentinel.core.model.AttackStage;
import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.correlationsentinel.core.TestEvents.BASE;
import static org.assertj.core.api.Assertions.assertThat;

class AttackChainConverterTest {

    @Test
    @DisplayName("Should map stages, span and metadata onto the correlation")
    void convertsChain() {
        List<AttackStage> stages = List.of(
                new AttackStage(1, "ProcessCreation", "e1", BASE, "spawned", "T1059"),
                new AttackStage(2, "NetworkConnection", "e2", BASE.plusSeconds(90), "connected", null),
                new AttackStage(3, "DataExfiltration", "e3", BASE.plusSeconds(300), "uploaded", "T1041"));
        AttackChain chain = new AttackChain("ProcessCreation -> NetworkConnection -> DataExfiltration",
                stages, 0.85, "Remote Execution", RiskLevel.HIGH, List.of("ws-01", "db-01"));
        Instant detectedAt = BASE.plusSeconds(600);

        Correlation c = AttackChainConverter.toCorrelation(chain, detectedAt);

        assertThat(c.getType()).isEqualTo(CorrelationType.ATTACK_CHAIN);
        assertThat(c.getPattern()).isEqualTo(chain.getName());
        assertThat(c.getConfidence()).isEqualTo(0.85);
        assertThat(c.getEventIds()).containsExactly("e1", "e2", "e3");
        assertThat(c.getTimeWindow()).isEqualTo(Duration.ofMinutes(5));
        assertThat(c.getTechniqueIds()).containsExactly("T1059", "T1041");
        assertThat(c.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(c.getSummary()).isEqualTo("Attack chain detected: " + chain.getName());
        assertThat(c.getRecommendedActions()).isNotEmpty();
        assertThat(c.getMetadata())
                .containsEntry("attackType", "Remote Execution")
                .containsEntry("stageCount", 3)
                .containsEntry("affectedHosts", List.of("ws-01", "db-01"));
        assertThat(c.getDetectedAt()).isEqualTo(detectedAt);
    }
}
