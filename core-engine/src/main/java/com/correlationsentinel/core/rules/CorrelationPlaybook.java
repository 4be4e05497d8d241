package com.correlationsentinel.core.rules;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.RiskLevel;

import java.util.List;
import java.util.Locale;

/**
 * Risk grading, response actions and analyst-facing explanations shared by
 * every correlation producer.
 *
 * @since 1.0.0
 */
public final class CorrelationPlaybook {

    private static final List<String> ATTACK_CHAIN_ACTIONS = List.of(
            "Isolate affected systems",
            "Review authentication logs",
            "Reset potentially compromised credentials",
            "Enable additional monitoring");

    private static final List<String> LATERAL_MOVEMENT_ACTIONS = List.of(
            "Segment network to prevent spread",
            "Review remote access logs",
            "Scan for malware on affected systems",
            "Update access control lists");

    private static final List<String> PRIVILEGE_ESCALATION_ACTIONS = List.of(
            "Review privileged account usage",
            "Audit permission changes",
            "Enable enhanced auditing",
            "Review group policy settings");

    private static final List<String> DATA_EXFILTRATION_ACTIONS = List.of(
            "Block suspicious network connections",
            "Review data access logs",
            "Enable DLP policies",
            "Alert data owners");

    private static final List<String> DEFAULT_ACTIONS = List.of(
            "Investigate events",
            "Increase monitoring",
            "Review security policies");

    private CorrelationPlaybook() {
        // utility class — not instantiable
    }

    /**
     * Grade a rule correlation.
     *
     * <pre>
     * confidence &gt; 0.90 or events &gt; 10  → critical
     * confidence &gt; 0.75 or events &gt; 5   → high
     * confidence &gt; 0.50 or events &gt; 3   → medium
     * otherwise                          → low
     * </pre>
     */
    public static RiskLevel riskFor(double confidence, int eventCount) {
        if (confidence > 0.9 || eventCount > 10) {
            return RiskLevel.CRITICAL;
        }
        if (confidence > 0.75 || eventCount > 5) {
            return RiskLevel.HIGH;
        }
        if (confidence > 0.5 || eventCount > 3) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    public static List<String> actionsFor(CorrelationType type) {
        return switch (type) {
            case ATTACK_CHAIN -> ATTACK_CHAIN_ACTIONS;
            case LATERAL_MOVEMENT -> LATERAL_MOVEMENT_ACTIONS;
            case PRIVILEGE_ESCALATION -> PRIVILEGE_ESCALATION_ACTIONS;
            case DATA_EXFILTRATION -> DATA_EXFILTRATION_ACTIONS;
            default -> DEFAULT_ACTIONS;
        };
    }

    /**
     * One-sentence explanation of a correlation for analysts.
     */
    public static String explain(Correlation correlation) {
        int eventCount = correlation.getEventIds().size();
        double minutes = correlation.getTimeWindow().toMillis() / 60_000.0;

        return switch (correlation.getType()) {
            case TEMPORAL_BURST -> String.format(Locale.ROOT,
                    "Detected %d events clustered within %.1f minutes, indicating potential automated attack or malware activity.",
                    eventCount, minutes);
            case ATTACK_CHAIN -> String.format(Locale.ROOT,
                    "Identified attack pattern '%s' with %d sequential events matching known attack techniques.",
                    correlation.getPattern(), eventCount);
            case LATERAL_MOVEMENT -> String.format(Locale.ROOT,
                    "Detected similar suspicious activity across multiple systems within %.1f minutes, suggesting lateral movement.",
                    minutes);
            case PRIVILEGE_ESCALATION -> String.format(Locale.ROOT,
                    "Detected %d events indicating attempts to elevate privileges or access restricted resources.",
                    eventCount);
            default -> String.format(Locale.ROOT,
                    "Correlation pattern '%s' detected with %d related events and %.0f%% confidence.",
                    correlation.getPattern(), eventCount, correlation.getConfidence() * 100);
        };
    }
}
