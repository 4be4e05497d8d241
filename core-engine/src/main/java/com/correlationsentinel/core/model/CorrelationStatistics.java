package com.correlationsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over stored correlations.
 *
 * @since 1.0.0
 */
public final class CorrelationStatistics {

    private final long totalEventsProcessed;
    private final int correlationsDetected;
    private final Map<CorrelationType, Long> correlationsByType;
    private final double averageConfidence;
    private final List<String> topPatterns;
    private final Instant lastUpdated;

    public CorrelationStatistics(long totalEventsProcessed, int correlationsDetected,
            Map<CorrelationType, Long> correlationsByType, double averageConfidence,
            List<String> topPatterns, Instant lastUpdated) {
        this.totalEventsProcessed = totalEventsProcessed;
        this.correlationsDetected = correlationsDetected;
        this.correlationsByType = correlationsByType.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(correlationsByType));
        this.averageConfidence = averageConfidence;
        this.topPatterns = List.copyOf(topPatterns);
        this.lastUpdated = lastUpdated;
    }

    public long getTotalEventsProcessed() {
        return totalEventsProcessed;
    }

    public int getCorrelationsDetected() {
        return correlationsDetected;
    }

    public Map<CorrelationType, Long> getCorrelationsByType() {
        return correlationsByType;
    }

    public double getAverageConfidence() {
        return averageConfidence;
    }

    /** Up to five most frequent pattern names, most frequent first. */
    public List<String> getTopPatterns() {
        return topPatterns;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "CorrelationStatistics{" +
                "totalEventsProcessed=" + totalEventsProcessed +
                ", correlationsDetected=" + correlationsDetected +
                ", correlationsByType=" + correlationsByType +
                ", averageConfidence=" + averageConfidence +
                ", topPatterns=" + topPatterns +
                '}';
    }
}
