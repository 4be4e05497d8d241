package com.correlationsentinel.core.config;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Typed, immutable tuning for the correlation engine.
 *
 * <p>
 * Values are resolved from environment variables with defaults matching the
 * production deployment, so the engine is configurable through the host
 * process environment without code changes.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    // ---------------------------------------------------------------
    // Event history
    // ---------------------------------------------------------------
    private final Duration correlationWindow;
    private final Duration historySweepInterval;

    // ---------------------------------------------------------------
    // Fusion thresholds
    // ---------------------------------------------------------------
    private final double minCorrelationScore;
    private final double minBurstScore;
    private final double minAnomalyScore;
    private final double minTotalScore;
    private final boolean enableLowScoreEvents;

    // ---------------------------------------------------------------
    // Batch analysis and retention
    // ---------------------------------------------------------------
    private final Duration batchInterval;
    private final Duration correlationMaxAge;
    private final Duration storeEvictionInterval;
    private final Duration lateralMovementWindow;

    // ---------------------------------------------------------------
    // Anomaly scoring
    // ---------------------------------------------------------------
    private final Pattern serviceAccountPattern;

    private EngineConfig(Builder b) {
        this.correlationWindow = b.correlationWindow;
        this.historySweepInterval = b.historySweepInterval;
        this.minCorrelationScore = b.minCorrelationScore;
        this.minBurstScore = b.minBurstScore;
        this.minAnomalyScore = b.minAnomalyScore;
        this.minTotalScore = b.minTotalScore;
        this.enableLowScoreEvents = b.enableLowScoreEvents;
        this.batchInterval = b.batchInterval;
        this.correlationMaxAge = b.correlationMaxAge;
        this.storeEvictionInterval = b.storeEvictionInterval;
        this.lateralMovementWindow = b.lateralMovementWindow;
        this.serviceAccountPattern = Pattern.compile(b.serviceAccountPattern);
    }

    /**
     * @return configuration with every default applied
     */
    public static EngineConfig defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link EngineConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static EngineConfig fromEnvironment() {
        try {
            return new Builder()
                    .correlationWindow(seconds("CORRELATION_WINDOW_SECONDS", "300"))
                    .historySweepInterval(seconds("HISTORY_SWEEP_INTERVAL_SECONDS", "600"))
                    .minCorrelationScore(parseDoubleEnv("MIN_CORRELATION_SCORE", "0.5"))
                    .minBurstScore(parseDoubleEnv("MIN_BURST_SCORE", "0.5"))
                    .minAnomalyScore(parseDoubleEnv("MIN_ANOMALY_SCORE", "0.5"))
                    .minTotalScore(parseDoubleEnv("MIN_TOTAL_SCORE", "1.0"))
                    .enableLowScoreEvents(Boolean.parseBoolean(env("ENABLE_LOW_SCORE_EVENTS", "false")))
                    .batchInterval(seconds("BATCH_INTERVAL_SECONDS", "300"))
                    .correlationMaxAge(seconds("CORRELATION_MAX_AGE_SECONDS", "2592000"))
                    .storeEvictionInterval(seconds("STORE_EVICTION_INTERVAL_SECONDS", "21600"))
                    .lateralMovementWindow(seconds("LATERAL_MOVEMENT_WINDOW_SECONDS", "1800"))
                    .serviceAccountPattern(env("SERVICE_ACCOUNT_PATTERN", Builder.DEFAULT_SERVICE_ACCOUNT_PATTERN))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** Retention of the streaming event history; {@code <= 0} disables retention. */
    public Duration getCorrelationWindow() {
        return correlationWindow;
    }

    public Duration getHistorySweepInterval() {
        return historySweepInterval;
    }

    public double getMinCorrelationScore() {
        return minCorrelationScore;
    }

    public double getMinBurstScore() {
        return minBurstScore;
    }

    public double getMinAnomalyScore() {
        return minAnomalyScore;
    }

    public double getMinTotalScore() {
        return minTotalScore;
    }

    /** When {@code true} fusion bypasses its thresholds (tuning / testing). */
    public boolean isEnableLowScoreEvents() {
        return enableLowScoreEvents;
    }

    public Duration getBatchInterval() {
        return batchInterval;
    }

    public Duration getCorrelationMaxAge() {
        return correlationMaxAge;
    }

    public Duration getStoreEvictionInterval() {
        return storeEvictionInterval;
    }

    public Duration getLateralMovementWindow() {
        return lateralMovementWindow;
    }

    public Pattern getServiceAccountPattern() {
        return serviceAccountPattern;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * {@link #build()} checks that thresholds lie in their score ranges, that
     * scheduling intervals are positive and that the service-account pattern
     * compiles. The correlation window may be zero or negative, meaning "no
     * retention".
     * </p>
     */
    public static class Builder {
        static final String DEFAULT_SERVICE_ACCOUNT_PATTERN = "\\$|SERVICE|SYSTEM";

        private Duration correlationWindow = Duration.ofMinutes(5);
        private Duration historySweepInterval = Duration.ofMinutes(10);
        private double minCorrelationScore = 0.5;
        private double minBurstScore = 0.5;
        private double minAnomalyScore = 0.5;
        private double minTotalScore = 1.0;
        private boolean enableLowScoreEvents = false;
        private Duration batchInterval = Duration.ofMinutes(5);
        private Duration correlationMaxAge = Duration.ofDays(30);
        private Duration storeEvictionInterval = Duration.ofHours(6);
        private Duration lateralMovementWindow = Duration.ofMinutes(30);
        private String serviceAccountPattern = DEFAULT_SERVICE_ACCOUNT_PATTERN;

        public Builder correlationWindow(Duration v) {
            this.correlationWindow = v;
            return this;
        }

        public Builder historySweepInterval(Duration v) {
            this.historySweepInterval = v;
            return this;
        }

        public Builder minCorrelationScore(double v) {
            this.minCorrelationScore = v;
            return this;
        }

        public Builder minBurstScore(double v) {
            this.minBurstScore = v;
            return this;
        }

        public Builder minAnomalyScore(double v) {
            this.minAnomalyScore = v;
            return this;
        }

        public Builder minTotalScore(double v) {
            this.minTotalScore = v;
            return this;
        }

        public Builder enableLowScoreEvents(boolean v) {
            this.enableLowScoreEvents = v;
            return this;
        }

        public Builder batchInterval(Duration v) {
            this.batchInterval = v;
            return this;
        }

        public Builder correlationMaxAge(Duration v) {
            this.correlationMaxAge = v;
            return this;
        }

        public Builder storeEvictionInterval(Duration v) {
            this.storeEvictionInterval = v;
            return this;
        }

        public Builder lateralMovementWindow(Duration v) {
            this.lateralMovementWindow = v;
            return this;
        }

        public Builder serviceAccountPattern(String v) {
            this.serviceAccountPattern = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link EngineConfig}
         * @throws NullPointerException     if a duration or the pattern is
         *                                  {@code null}
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            Objects.requireNonNull(correlationWindow, "correlationWindow required");
            requirePositive(historySweepInterval, "historySweepInterval");
            requirePositive(batchInterval, "batchInterval");
            requirePositive(correlationMaxAge, "correlationMaxAge");
            requirePositive(storeEvictionInterval, "storeEvictionInterval");
            requirePositive(lateralMovementWindow, "lateralMovementWindow");

            requireScore(minCorrelationScore, "minCorrelationScore");
            requireScore(minBurstScore, "minBurstScore");
            requireScore(minAnomalyScore, "minAnomalyScore");
            if (Double.isNaN(minTotalScore) || minTotalScore < 0.0 || minTotalScore > 3.0) {
                throw new IllegalArgumentException(
                        "minTotalScore must be in [0, 3], got: " + minTotalScore);
            }

            Objects.requireNonNull(serviceAccountPattern, "serviceAccountPattern required");
            try {
                Pattern.compile(serviceAccountPattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "serviceAccountPattern is not a valid regex: " + serviceAccountPattern, e);
            }

            return new EngineConfig(this);
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }

        private static void requireScore(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static Duration seconds(String name, String defaultValue) {
        return Duration.ofSeconds(Long.parseLong(env(name, defaultValue)));
    }

    private static double parseDoubleEnv(String name, String defaultValue) {
        return Double.parseDouble(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "correlationWindow=" + correlationWindow +
                ", historySweepInterval=" + historySweepInterval +
                ", minCorrelationScore=" + minCorrelationScore +
                ", minBurstScore=" + minBurstScore +
                ", minAnomalyScore=" + minAnomalyScore +
                ", minTotalScore=" + minTotalScore +
                ", enableLowScoreEvents=" + enableLowScoreEvents +
                ", batchInterval=" + batchInterval +
                ", correlationMaxAge=" + correlationMaxAge +
                ", storeEvictionInterval=" + storeEvictionInterval +
                ", lateralMovementWindow=" + lateralMovementWindow +
                ", serviceAccountPattern=" + serviceAccountPattern +
                '}';
    }
}
