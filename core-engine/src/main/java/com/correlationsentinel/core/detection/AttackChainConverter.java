package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.AttackChain;
import com.correlationsentinel.core.model.AttackStage;
import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.rules.CorrelationPlaybook;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps an {@link AttackChain} to the uniform {@link Correlation} shape.
 *
 * <p>
 * Event ids keep stage order, the time window spans first to last stage and
 * the chain's techniques carry over unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class AttackChainConverter {

    private AttackChainConverter() {
        // utility class — not instantiable
    }

    public static Correlation toCorrelation(AttackChain chain, Instant detectedAt) {
        Objects.requireNonNull(chain, "chain must not be null");

        List<String> eventIds = new ArrayList<>(chain.getStages().size());
        for (AttackStage stage : chain.getStages()) {
            eventIds.add(stage.getEventId());
        }

        return Correlation.builder()
                .type(CorrelationType.ATTACK_CHAIN)
                .confidence(chain.getConfidence())
                .pattern(chain.getName())
                .eventIds(eventIds)
                .timeWindow(Duration.between(chain.getStartTime(), chain.getEndTime()))
                .techniqueIds(chain.getTechniqueIds())
                .riskLevel(chain.getRiskLevel())
                .summary("Attack chain detected: " + chain.getName())
                .recommendedActions(CorrelationPlaybook.actionsFor(CorrelationType.ATTACK_CHAIN))
                .metadata("attackType", chain.getAttackType())
                .metadata("stageCount", chain.getStages().size())
                .metadata("affectedHosts", chain.getAffectedHosts())
                .detectedAt(detectedAt)
                .build();
    }
}
