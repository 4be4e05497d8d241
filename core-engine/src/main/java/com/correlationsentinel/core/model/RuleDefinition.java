package com.correlationsentinel.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative correlation rule loaded from configuration.
 *
 * <p>
 * Example YAML entry:
 * </p>
 *
 * <pre>
 * - id: brute-force
 *   name: Brute Force Attack
 *   type: attack_chain
 *   windowSeconds: 600
 *   minEventCount: 3
 *   minConfidence: 0.8
 *   requiredEventTypes: [AuthenticationFailure, AuthenticationSuccess]
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization. The
 * {@link com.correlationsentinel.core.rules.RuleCatalog} validates every rule
 * before accepting it, so matching never sees a misconfigured rule.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    /** Stable identifier used for updates. */
    private String id;

    /** Display name, also used as the correlation pattern name. */
    private String name;

    private String description = "";

    /** Correlation type name, e.g. "temporal_burst" or "AttackChain". */
    private String type;

    /** Length of the correlation window in seconds. */
    private long windowSeconds;

    /** Events (including the new one) needed before the rule can fire. */
    private int minEventCount = 1;

    /** Minimum computed confidence in [0, 1]. */
    private double minConfidence;

    /** Event types the rule considers; empty means all types. */
    private List<String> requiredEventTypes = new ArrayList<>();

    private boolean enabled = true;

    public RuleDefinition() {
    }

    /**
     * Copy constructor.
     *
     * @param other rule to copy; must not be {@code null}
     */
    public RuleDefinition(RuleDefinition other) {
        Objects.requireNonNull(other, "rule must not be null");
        this.id = other.id;
        this.name = other.name;
        this.description = other.description;
        this.type = other.type;
        this.windowSeconds = other.windowSeconds;
        this.minEventCount = other.minEventCount;
        this.minConfidence = other.minConfidence;
        this.requiredEventTypes = new ArrayList<>(other.requiredEventTypes);
        this.enabled = other.enabled;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = problems();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RuleDefinition: " + String.join("; ", errors));
        }
    }

    /**
     * @return every validation error for this rule; empty when it is valid
     */
    public List<String> problems() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (name == null || name.isBlank()) {
            errors.add("Rule '" + id + "' requires 'name'");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule '" + id + "' requires 'type'");
        } else if (CorrelationType.parse(type).isEmpty()) {
            errors.add("Rule '" + id + "' has unknown type: '" + type + "'");
        }
        if (windowSeconds <= 0) {
            errors.add("Rule '" + id + "' requires 'windowSeconds' > 0");
        }
        if (minEventCount < 1) {
            errors.add("Rule '" + id + "' requires 'minEventCount' >= 1");
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            errors.add("Rule '" + id + "' requires 'minConfidence' in [0, 1]");
        }
        for (String eventType : requiredEventTypes) {
            if (SecurityEventType.parse(eventType).isEmpty()) {
                errors.add("Rule '" + id + "' references unknown event type: '" + eventType + "'");
            }
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Resolved views (not bean properties)
    // ---------------------------------------------------------------

    /**
     * @return the parsed correlation type
     * @throws IllegalStateException if the type is missing or unknown
     */
    public CorrelationType correlationType() {
        return CorrelationType.parse(type)
                .orElseThrow(() -> new IllegalStateException("Unknown correlation type: " + type));
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    /**
     * @return the parsed event-type filter; empty means "all types"
     */
    public Set<SecurityEventType> requiredTypes() {
        Set<SecurityEventType> types = EnumSet.noneOf(SecurityEventType.class);
        for (String eventType : requiredEventTypes) {
            SecurityEventType.parse(eventType).ifPresent(types::add);
        }
        return types;
    }

    public boolean accepts(SecurityEventType eventType) {
        Set<SecurityEventType> types = requiredTypes();
        return types.isEmpty() || types.contains(eventType);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getMinEventCount() {
        return minEventCount;
    }

    public void setMinEventCount(int minEventCount) {
        this.minEventCount = minEventCount;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public List<String> getRequiredEventTypes() {
        return requiredEventTypes;
    }

    public void setRequiredEventTypes(List<String> requiredEventTypes) {
        this.requiredEventTypes = requiredEventTypes != null
                ? new ArrayList<>(requiredEventTypes)
                : new ArrayList<>();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && windowSeconds == that.windowSeconds
                && minEventCount == that.minEventCount
                && Double.compare(minConfidence, that.minConfidence) == 0
                && Objects.equals(requiredEventTypes, that.requiredEventTypes)
                && enabled == that.enabled;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, windowSeconds, minEventCount, minConfidence, enabled);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", windowSeconds=" + windowSeconds +
                ", minEventCount=" + minEventCount +
                ", minConfidence=" + minConfidence +
                ", requiredEventTypes=" + requiredEventTypes +
                ", enabled=" + enabled +
                '}';
    }
}
