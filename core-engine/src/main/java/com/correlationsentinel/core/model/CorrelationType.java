package com.correlationsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of multi-event pattern the engine reports.
 *
 * @since 1.0.0
 */
public enum CorrelationType {

    /** Many events from the same source in a short time. */
    TEMPORAL_BURST,

    /** Events matching a known ordered attack sequence. */
    ATTACK_CHAIN,

    /** The same activity observed across several hosts. */
    LATERAL_MOVEMENT,

    PRIVILEGE_ESCALATION,
    DATA_EXFILTRATION,
    PERSISTENCE,
    COMMAND_CONTROL,
    USER_ANOMALY,

    /** Produced by a pluggable correlation strategy. */
    ML_PATTERN;

    /**
     * Resolve a type name case-insensitively, accepting {@code temporal_burst},
     * {@code TEMPORAL-BURST} and {@code TemporalBurst}.
     *
     * @param value type name
     * @return the matching type, or empty if none matches
     */
    public static Optional<CorrelationType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        for (CorrelationType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
