package com.correlationsentinel.core.model;

/**
 * The three streaming signal scores computed for one event, each in [0, 1].
 *
 * @since 1.0.0
 */
public final class SignalScores {

    public static final SignalScores NONE = new SignalScores(0.0, 0.0, 0.0);

    private final double correlation;
    private final double burst;
    private final double anomaly;

    public SignalScores(double correlation, double burst, double anomaly) {
        this.correlation = correlation;
        this.burst = burst;
        this.anomaly = anomaly;
    }

    public double getCorrelation() {
        return correlation;
    }

    public double getBurst() {
        return burst;
    }

    public double getAnomaly() {
        return anomaly;
    }

    /** Sum of the three scores, in [0, 3]. */
    public double total() {
        return correlation + burst + anomaly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignalScores that))
            return false;
        return Double.compare(correlation, that.correlation) == 0
                && Double.compare(burst, that.burst) == 0
                && Double.compare(anomaly, that.anomaly) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(correlation) * 31 * 31 + Double.hashCode(burst) * 31 + Double.hashCode(anomaly);
    }

    @Override
    public String toString() {
        return String.format("SignalScores{corr=%.2f, burst=%.2f, anomaly=%.2f}", correlation, burst, anomaly);
    }
}
