package com.correlationsentinel.core.rules;

import com.correlationsentinel.core.model.RuleDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleCatalog}.
 */
class RuleCatalogTest {

    private RuleCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = RuleCatalog.fromClasspath(RuleSetLoader.DEFAULT_RESOURCE);
    }

    @Test
    @DisplayName("Default catalog should hold the four bundled rules")
    void defaultCatalog() {
        assertThat(catalog.size()).isEqualTo(4);
        assertThat(catalog.enabledRules())
                .extracting(RuleDefinition::getId)
                .containsExactly("temporal-burst", "brute-force", "lateral-movement", "privilege-escalation");
    }

    @Test
    @DisplayName("Update should replace an existing rule in place")
    void updateReplacesInPlace() {
        RuleDefinition bruteForce = catalog.find("brute-force").orElseThrow();
        bruteForce.setMinEventCount(6);

        catalog.update(bruteForce);

        assertThat(catalog.getRules().get(1).getMinEventCount()).isEqualTo(6);
        assertThat(catalog.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Update with a new id should append the rule")
    void updateAppendsNewRule() {
        catalog.update(rule("exfil", 900));

        assertThat(catalog.getRules())
                .extracting(RuleDefinition::getId)
                .endsWith("exfil");
    }

    @Test
    @DisplayName("Update should reject an invalid rule and leave the catalog unchanged")
    void updateRejectsInvalidRule() {
        assertThatThrownBy(() -> catalog.update(rule("broken", 0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowSeconds");

        assertThat(catalog.find("broken")).isEmpty();
        assertThat(catalog.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Returned rules should be copies")
    void getRulesReturnsCopies() {
        catalog.getRules().get(0).setMinEventCount(99);

        assertThat(catalog.getRules().get(0).getMinEventCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should reject duplicate rule ids")
    void rejectsDuplicateIds() {
        assertThatThrownBy(() -> new RuleCatalog(List.of(rule("dup", 60), rule("dup", 120))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate rule id");
    }

    @Test
    @DisplayName("replaceAll should swap the whole rule set")
    void replaceAllSwapsRules() {
        catalog.replaceAll(List.of(rule("only", 60)));

        assertThat(catalog.getRules()).extracting(RuleDefinition::getId).containsExactly("only");
    }

    @Test
    @DisplayName("remove should drop the rule and report whether it existed")
    void removeDropsRule() {
        assertThat(catalog.remove("lateral-movement")).isTrue();
        assertThat(catalog.remove("lateral-movement")).isFalse();
        assertThat(catalog.size()).isEqualTo(3);
    }

    private static RuleDefinition rule(String id, long windowSeconds) {
        RuleDefinition rule = new RuleDefinition();
        rule.setId(id);
        rule.setName("Rule " + id);
        rule.setType("data_exfiltration");
        rule.setWindowSeconds(windowSeconds);
        rule.setMinEventCount(2);
        rule.setMinConfidence(0.8);
        return rule;
    }
}
