package com.correlationsentinel.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Classification assigned to an event by an upstream detector, or produced by
 * the fusion stage for correlation-only findings.
 *
 * @since 1.0.0
 */
public enum SecurityEventType {

    AUTHENTICATION_FAILURE,
    AUTHENTICATION_SUCCESS,
    PRIVILEGE_ESCALATION,
    PROCESS_CREATION,
    NETWORK_CONNECTION,
    DATA_ACCESS,
    DATA_EXFILTRATION,
    SERVICE_MODIFICATION,
    SERVICE_INSTALLATION,
    REGISTRY_MODIFICATION,
    ACCOUNT_MANAGEMENT,
    SECURITY_POLICY_CHANGE,
    POWERSHELL_EXECUTION,
    SCHEDULED_TASK,

    // produced by score fusion
    BURST_ACTIVITY,
    CORRELATED_ACTIVITY,
    ANOMALOUS_ACTIVITY,
    SUSPICIOUS_ACTIVITY,

    UNKNOWN;

    /**
     * @return the name in the form used by event classifiers, e.g.
     *         {@code AuthenticationFailure}
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * Resolve a type name leniently: case-insensitive, and accepting both
     * {@code AUTHENTICATION_FAILURE} and {@code AuthenticationFailure}.
     *
     * @param value type name
     * @return the matching type, or empty if none matches
     */
    public static Optional<SecurityEventType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        for (SecurityEventType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
