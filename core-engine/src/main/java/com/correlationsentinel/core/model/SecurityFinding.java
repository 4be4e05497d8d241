package com.correlationsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single-event classification.
 *
 * <p>
 * Upstream detectors supply a finding as the <em>base</em> input of the
 * streaming path ({@link FindingSource#DETECTOR}). Score fusion returns either
 * that finding unchanged, an enhanced copy ({@link FindingSource#ENHANCED}),
 * or a finding synthesized from correlation signals alone
 * ({@link FindingSource#CORRELATION}).
 * </p>
 *
 * <p>
 * Immutable. Use {@link #builder()} or {@link #toBuilder()} to derive
 * modified copies.
 * </p>
 *
 * @since 1.0.0
 */
public final class SecurityFinding {

    private final SecurityEventType eventType;
    private final RiskLevel riskLevel;
    private final int confidence;
    private final String summary;
    private final List<String> techniqueIds;
    private final List<String> recommendedActions;
    private final FindingSource source;
    private final double correlationScore;
    private final double burstScore;
    private final double anomalyScore;

    private SecurityFinding(Builder b) {
        this.eventType = Objects.requireNonNull(b.eventType, "eventType must not be null");
        this.riskLevel = Objects.requireNonNull(b.riskLevel, "riskLevel must not be null");
        if (b.confidence < 0 || b.confidence > 100) {
            throw new IllegalArgumentException("confidence must be in [0, 100], got: " + b.confidence);
        }
        this.confidence = b.confidence;
        this.summary = b.summary != null ? b.summary : "";
        this.techniqueIds = List.copyOf(b.techniqueIds);
        this.recommendedActions = List.copyOf(b.recommendedActions);
        this.source = Objects.requireNonNull(b.source, "source must not be null");
        this.correlationScore = b.correlationScore;
        this.burstScore = b.burstScore;
        this.anomalyScore = b.anomalyScore;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this finding's values
     */
    public Builder toBuilder() {
        return new Builder()
                .eventType(eventType)
                .riskLevel(riskLevel)
                .confidence(confidence)
                .summary(summary)
                .techniqueIds(techniqueIds)
                .recommendedActions(recommendedActions)
                .source(source)
                .correlationScore(correlationScore)
                .burstScore(burstScore)
                .anomalyScore(anomalyScore);
    }

    /**
     * Fluent builder for {@link SecurityFinding}. {@code eventType} and
     * {@code riskLevel} are required; {@code source} defaults to
     * {@link FindingSource#DETECTOR}.
     */
    public static class Builder {
        private SecurityEventType eventType;
        private RiskLevel riskLevel;
        private int confidence;
        private String summary;
        private List<String> techniqueIds = new ArrayList<>();
        private List<String> recommendedActions = new ArrayList<>();
        private FindingSource source = FindingSource.DETECTOR;
        private double correlationScore;
        private double burstScore;
        private double anomalyScore;

        public Builder eventType(SecurityEventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder techniqueIds(List<String> techniqueIds) {
            this.techniqueIds = techniqueIds != null ? new ArrayList<>(techniqueIds) : new ArrayList<>();
            return this;
        }

        public Builder recommendedActions(List<String> recommendedActions) {
            this.recommendedActions = recommendedActions != null
                    ? new ArrayList<>(recommendedActions)
                    : new ArrayList<>();
            return this;
        }

        public Builder source(FindingSource source) {
            this.source = source;
            return this;
        }

        public Builder correlationScore(double correlationScore) {
            this.correlationScore = correlationScore;
            return this;
        }

        public Builder burstScore(double burstScore) {
            this.burstScore = burstScore;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        /**
         * @return a new {@link SecurityFinding}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if confidence is outside [0, 100]
         */
        public SecurityFinding build() {
            return new SecurityFinding(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public SecurityEventType getEventType() {
        return eventType;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    /** Confidence on a 0–100 scale. */
    public int getConfidence() {
        return confidence;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getTechniqueIds() {
        return Collections.unmodifiableList(techniqueIds);
    }

    public List<String> getRecommendedActions() {
        return Collections.unmodifiableList(recommendedActions);
    }

    public FindingSource getSource() {
        return source;
    }

    public double getCorrelationScore() {
        return correlationScore;
    }

    public double getBurstScore() {
        return burstScore;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SecurityFinding that))
            return false;
        return confidence == that.confidence
                && eventType == that.eventType
                && riskLevel == that.riskLevel
                && source == that.source
                && summary.equals(that.summary)
                && techniqueIds.equals(that.techniqueIds)
                && recommendedActions.equals(that.recommendedActions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, riskLevel, confidence, summary, techniqueIds, source);
    }

    @Override
    public String toString() {
        return "SecurityFinding{" +
                "eventType=" + eventType +
                ", riskLevel=" + riskLevel +
                ", confidence=" + confidence +
                ", source=" + source +
                ", summary='" + summary + '\'' +
                ", techniqueIds=" + techniqueIds +
                '}';
    }
}
