package com.correlationsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleDefinition}.
 */
class RuleDefinitionTest {

    @Test
    @DisplayName("Should accept both snake and camel case type names")
    void shouldParseTypeNamesLeniently() {
        RuleDefinition rule = validRule();
        rule.setType("AttackChain");
        assertThat(rule.correlationType()).isEqualTo(CorrelationType.ATTACK_CHAIN);

        rule.setType("lateral_movement");
        assertThat(rule.correlationType()).isEqualTo(CorrelationType.LATERAL_MOVEMENT);
    }

    @Test
    @DisplayName("Valid rule should pass validation")
    void validRulePasses() {
        assertThatCode(() -> validRule().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject an unknown correlation type")
    void shouldRejectUnknownType() {
        RuleDefinition rule = validRule();
        rule.setType("port_scan");

        assertThatThrownBy(rule::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unknown type");
    }

    @Test
    @DisplayName("Should reject an unknown required event type")
    void shouldRejectUnknownEventType() {
        RuleDefinition rule = validRule();
        rule.setRequiredEventTypes(List.of("AuthenticationFailure", "Teleportation"));

        assertThatThrownBy(rule::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Teleportation");
    }

    @Test
    @DisplayName("Empty required types should accept every event type")
    void emptyFilterAcceptsAll() {
        RuleDefinition rule = validRule();

        assertThat(rule.accepts(SecurityEventType.DATA_ACCESS)).isTrue();

        rule.setRequiredEventTypes(List.of("AuthenticationFailure"));
        assertThat(rule.accepts(SecurityEventType.DATA_ACCESS)).isFalse();
        assertThat(rule.accepts(SecurityEventType.AUTHENTICATION_FAILURE)).isTrue();
    }

    @Test
    @DisplayName("Copy should not share the required types list")
    void copyIsIndependent() {
        RuleDefinition original = validRule();
        original.setRequiredEventTypes(List.of("AuthenticationFailure"));
        RuleDefinition copy = new RuleDefinition(original);

        copy.setRequiredEventTypes(List.of("DataAccess"));

        assertThat(original.getRequiredEventTypes()).containsExactly("AuthenticationFailure");
    }

    private static RuleDefinition validRule() {
        RuleDefinition rule = new RuleDefinition();
        rule.setId("rule-1");
        rule.setName("Rule One");
        rule.setType("temporal_burst");
        rule.setWindowSeconds(300);
        rule.setMinEventCount(5);
        rule.setMinConfidence(0.7);
        return rule;
    }
}
