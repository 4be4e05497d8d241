package com.correlationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered risk level shared by findings and correlations.
 *
 * <p>
 * Declaration order is significant: {@link #max(RiskLevel)} relies on
 * {@link #ordinal()} so that {@code LOW < MEDIUM < HIGH < CRITICAL}.
 * Serialized to JSON in lowercase ({@code "high"}).
 * </p>
 *
 * @since 1.0.0
 */
public enum RiskLevel {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Return the higher of this level and {@code other}.
     *
     * @param other level to compare with; {@code null} is treated as absent
     * @return the more severe of the two levels
     */
    public RiskLevel max(RiskLevel other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }

    public boolean isAtLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a level case-insensitively.
     *
     * @param value level name such as {@code "high"}
     * @return the parsed level
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    @JsonCreator
    public static RiskLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Risk level must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
