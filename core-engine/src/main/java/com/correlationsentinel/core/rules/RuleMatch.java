package com.correlationsentinel.core.rules;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.RuleDefinition;

import java.util.Objects;

/**
 * A rule that fired for an event, together with the correlation it built.
 *
 * @since 1.0.0
 */
public final class RuleMatch {

    private final RuleDefinition rule;
    private final Correlation correlation;

    public RuleMatch(RuleDefinition rule, Correlation correlation) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
    }

    public RuleDefinition getRule() {
        return rule;
    }

    public Correlation getCorrelation() {
        return correlation;
    }

    public double getConfidence() {
        return correlation.getConfidence();
    }

    @Override
    public String toString() {
        return "RuleMatch{rule='" + rule.getId() + "', confidence=" + getConfidence() + '}';
    }
}
