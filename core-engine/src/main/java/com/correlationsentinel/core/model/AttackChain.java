package com.correlationsentinel.core.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An ordered multi-stage sequence matching a known attack pattern.
 *
 * <p>
 * Produced only by the batch attack-chain detector and always converted to a
 * {@link Correlation} before storage.
 * </p>
 *
 * @since 1.0.0
 */
public final class AttackChain {

    private final String id = UUID.randomUUID().toString();
    private final String name;
    private final List<AttackStage> stages;
    private final double confidence;
    private final String attackType;
    private final RiskLevel riskLevel;
    private final List<String> affectedHosts;

    public AttackChain(String name, List<AttackStage> stages, double confidence, String attackType,
            RiskLevel riskLevel, List<String> affectedHosts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(stages, "stages must not be null");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Attack chain requires at least one stage");
        }
        this.stages = List.copyOf(stages);
        this.confidence = confidence;
        this.attackType = Objects.requireNonNull(attackType, "attackType must not be null");
        this.riskLevel = riskLevel != null ? riskLevel : RiskLevel.HIGH;
        this.affectedHosts = affectedHosts != null ? List.copyOf(affectedHosts) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<AttackStage> getStages() {
        return stages;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getStartTime() {
        return stages.get(0).getTimestamp();
    }

    public Instant getEndTime() {
        return stages.get(stages.size() - 1).getTimestamp();
    }

    public String getAttackType() {
        return attackType;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    /** Distinct hosts of the whole analysed batch, not only the matched stages. */
    public List<String> getAffectedHosts() {
        return affectedHosts;
    }

    /** @return distinct technique ids of the stages, in stage order */
    public List<String> getTechniqueIds() {
        LinkedHashSet<String> techniques = new LinkedHashSet<>();
        for (AttackStage stage : stages) {
            if (stage.getTechnique() != null) {
                techniques.add(stage.getTechnique());
            }
        }
        return List.copyOf(techniques);
    }

    @Override
    public String toString() {
        return "AttackChain{name='" + name + "', attackType='" + attackType + "', stages=" + stages + '}';
    }
}
