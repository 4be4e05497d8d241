package com.correlationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A detected multi-event pattern.
 *
 * <p>
 * Serialized to JSON and handed to downstream alerting. Instances are
 * immutable once built; the {@link com.correlationsentinel.core.store.CorrelationStore}
 * only ever adds or evicts whole correlations.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. The builder enforces the model invariants: at
 * least one contributing event id and a confidence in {@code [0, 1]}.
 * {@code id} and {@code detectedAt} default to a random UUID and the current
 * instant when not supplied.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "id", "type", "pattern", "confidence", "riskLevel", "detectedAt" })
public final class Correlation {

    private final String id;
    private final CorrelationType type;
    private final double confidence;
    private final String pattern;
    private final List<String> eventIds;
    private final Duration timeWindow;
    private final RiskLevel riskLevel;
    private final String summary;
    private final List<String> recommendedActions;
    private final List<String> techniqueIds;
    private final Map<String, Object> metadata;
    private final Instant detectedAt;

    private Correlation(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        if (Double.isNaN(b.confidence) || b.confidence < 0.0 || b.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + b.confidence);
        }
        this.confidence = b.confidence;
        if (b.eventIds.isEmpty()) {
            throw new IllegalArgumentException("Correlation requires at least one contributing event");
        }
        // preserve order, drop duplicates
        this.eventIds = List.copyOf(new LinkedHashSet<>(b.eventIds));
        this.pattern = b.pattern != null ? b.pattern : type.name();
        this.timeWindow = b.timeWindow != null ? b.timeWindow : Duration.ZERO;
        this.riskLevel = b.riskLevel != null ? b.riskLevel : RiskLevel.MEDIUM;
        this.summary = b.summary != null ? b.summary : "";
        this.recommendedActions = List.copyOf(b.recommendedActions);
        this.techniqueIds = List.copyOf(new LinkedHashSet<>(b.techniqueIds));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.detectedAt = b.detectedAt != null ? b.detectedAt : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Correlation}.
     */
    public static class Builder {
        private String id;
        private CorrelationType type;
        private double confidence;
        private String pattern;
        private List<String> eventIds = new ArrayList<>();
        private Duration timeWindow;
        private RiskLevel riskLevel;
        private String summary;
        private List<String> recommendedActions = new ArrayList<>();
        private List<String> techniqueIds = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant detectedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(CorrelationType type) {
            this.type = type;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder eventIds(List<String> eventIds) {
            this.eventIds = eventIds != null ? new ArrayList<>(eventIds) : new ArrayList<>();
            return this;
        }

        public Builder timeWindow(Duration timeWindow) {
            this.timeWindow = timeWindow;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder recommendedActions(List<String> recommendedActions) {
            this.recommendedActions = recommendedActions != null
                    ? new ArrayList<>(recommendedActions)
                    : new ArrayList<>();
            return this;
        }

        public Builder techniqueIds(List<String> techniqueIds) {
            this.techniqueIds = techniqueIds != null ? new ArrayList<>(techniqueIds) : new ArrayList<>();
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        /**
         * @return a new {@link Correlation}
         * @throws NullPointerException     if {@code type} is missing
         * @throws IllegalArgumentException if no event ids were given or the
         *                                  confidence is outside [0, 1]
         */
        public Correlation build() {
            return new Correlation(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public CorrelationType getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getPattern() {
        return pattern;
    }

    /** Contributing event ids, in the order the pattern observed them. */
    public List<String> getEventIds() {
        return eventIds;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    public List<String> getTechniqueIds() {
        return techniqueIds;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public boolean involves(String eventId) {
        return eventIds.contains(eventId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Correlation that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Correlation{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", pattern='" + pattern + '\'' +
                ", confidence=" + confidence +
                ", riskLevel=" + riskLevel +
                ", events=" + eventIds.size() +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
