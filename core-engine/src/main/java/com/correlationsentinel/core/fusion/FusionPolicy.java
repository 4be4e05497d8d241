package com.correlationsentinel.core.fusion;

import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.model.SignalScores;

import java.util.Objects;

/**
 * Thresholds deciding whether signal scores are strong enough to enhance or
 * synthesize a finding.
 *
 * <p>
 * The gate passes when at least one individual score reaches its minimum
 * <em>and</em> the sum reaches {@code minTotal}, or unconditionally when
 * {@code enableLowScoreEvents} is set.
 * </p>
 *
 * @since 1.0.0
 */
public final class FusionPolicy {

    private final double minCorrelation;
    private final double minBurst;
    private final double minAnomaly;
    private final double minTotal;
    private final boolean enableLowScoreEvents;

    public FusionPolicy(double minCorrelation, double minBurst, double minAnomaly, double minTotal,
            boolean enableLowScoreEvents) {
        this.minCorrelation = minCorrelation;
        this.minBurst = minBurst;
        this.minAnomaly = minAnomaly;
        this.minTotal = minTotal;
        this.enableLowScoreEvents = enableLowScoreEvents;
    }

    public static FusionPolicy from(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new FusionPolicy(
                config.getMinCorrelationScore(),
                config.getMinBurstScore(),
                config.getMinAnomalyScore(),
                config.getMinTotalScore(),
                config.isEnableLowScoreEvents());
    }

    /** Defaults of the production deployment: 0.5 / 0.5 / 0.5 / 1.0, no override. */
    public static FusionPolicy defaults() {
        return new FusionPolicy(0.5, 0.5, 0.5, 1.0, false);
    }

    public boolean meetsIndividualThreshold(SignalScores scores) {
        return scores.getCorrelation() >= minCorrelation
                || scores.getBurst() >= minBurst
                || scores.getAnomaly() >= minAnomaly;
    }

    public boolean meetsTotalThreshold(SignalScores scores) {
        return scores.total() >= minTotal;
    }

    public boolean passes(SignalScores scores) {
        return enableLowScoreEvents || (meetsIndividualThreshold(scores) && meetsTotalThreshold(scores));
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public double getMinBurst() {
        return minBurst;
    }

    public double getMinAnomaly() {
        return minAnomaly;
    }

    public double getMinTotal() {
        return minTotal;
    }

    public boolean isEnableLowScoreEvents() {
        return enableLowScoreEvents;
    }

    @Override
    public String toString() {
        return "FusionPolicy{" +
                "minCorrelation=" + minCorrelation +
                ", minBurst=" + minBurst +
                ", minAnomaly=" + minAnomaly +
                ", minTotal=" + minTotal +
                ", enableLowScoreEvents=" + enableLowScoreEvents +
                '}';
    }
}
