package com.correlationsentinel.core.rules;

import com.correlationsentinel.core.model.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, replaceable set of correlation rules.
 *
 * <h3>Consistency</h3>
 * <p>
 * The catalog holds an immutable snapshot in a {@code volatile} field.
 * Readers take the snapshot without locking; writers are serialized, build a
 * new snapshot and publish it in one assignment, so a reader sees either the
 * old or the new rule set, never a mix.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Every write validates first and throws {@link IllegalStateException} for a
 * misconfigured rule, leaving the catalog unchanged. Rules are copied on the
 * way in and out so callers cannot mutate the published snapshot.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(RuleCatalog.class);

    private volatile List<RuleDefinition> rules;

    /**
     * @param rules initial rules in evaluation order
     * @throws IllegalStateException if any rule is invalid or ids repeat
     */
    public RuleCatalog(List<RuleDefinition> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = validatedCopy(rules);
    }

    /** @see RuleSetLoader#fromClasspath(String) */
    public static RuleCatalog fromClasspath(String resource) {
        return new RuleCatalog(RuleSetLoader.fromClasspath(resource));
    }

    /** @see RuleSetLoader#fromFile(String) */
    public static RuleCatalog fromFile(String path) {
        return new RuleCatalog(RuleSetLoader.fromFile(path));
    }

    /**
     * Build a catalog from the file named by
     * {@value RuleSetLoader#ENV_RULES_PATH}, or the bundled defaults.
     */
    public static RuleCatalog loadDefault() {
        return new RuleCatalog(RuleSetLoader.load());
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /** @return copies of all rules, in catalog order */
    public List<RuleDefinition> getRules() {
        List<RuleDefinition> copies = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            copies.add(new RuleDefinition(rule));
        }
        return copies;
    }

    /**
     * Snapshot of the enabled rules in catalog order. The returned rules are
     * shared with the catalog and must be treated as read-only.
     */
    List<RuleDefinition> enabledRules() {
        List<RuleDefinition> snapshot = rules;
        List<RuleDefinition> enabled = new ArrayList<>(snapshot.size());
        for (RuleDefinition rule : snapshot) {
            if (rule.isEnabled()) {
                enabled.add(rule);
            }
        }
        return enabled;
    }

    public Optional<RuleDefinition> find(String id) {
        for (RuleDefinition rule : rules) {
            if (rule.getId().equals(id)) {
                return Optional.of(new RuleDefinition(rule));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Insert a rule, or replace the rule with the same id in place.
     *
     * @param rule the rule; must not be {@code null}
     * @throws IllegalStateException if the rule is invalid
     */
    public synchronized void update(RuleDefinition rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        RuleDefinition copy = new RuleDefinition(rule);
        copy.validate();

        List<RuleDefinition> next = new ArrayList<>(rules);
        boolean replaced = false;
        for (int i = 0; i < next.size(); i++) {
            if (next.get(i).getId().equals(copy.getId())) {
                next.set(i, copy);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            next.add(copy);
        }
        rules = List.copyOf(next);
        LOG.info("Correlation rule '{}' {}", copy.getId(), replaced ? "updated" : "added");
    }

    /**
     * Swap the whole rule set.
     *
     * @throws IllegalStateException if any rule is invalid or ids repeat
     */
    public synchronized void replaceAll(List<RuleDefinition> replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        rules = validatedCopy(replacement);
        LOG.info("Correlation rules replaced: {} rule(s) active", rules.size());
    }

    /**
     * @return {@code true} if a rule with that id existed
     */
    public synchronized boolean remove(String id) {
        List<RuleDefinition> next = new ArrayList<>(rules);
        boolean removed = next.removeIf(rule -> rule.getId().equals(id));
        if (removed) {
            rules = List.copyOf(next);
            LOG.info("Correlation rule '{}' removed", id);
        }
        return removed;
    }

    private static List<RuleDefinition> validatedCopy(List<RuleDefinition> source) {
        List<RuleDefinition> copies = new ArrayList<>(source.size());
        List<String> errors = new ArrayList<>();
        Map<String, Integer> seenIds = new HashMap<>();
        for (RuleDefinition rule : source) {
            RuleDefinition copy = new RuleDefinition(Objects.requireNonNull(rule, "rule must not be null"));
            collectProblems(copies.size(), copy, seenIds, errors);
            copies.add(copy);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rule set validation failed:\n  - " + String.join("\n  - ", errors));
        }
        return List.copyOf(copies);
    }

    /**
     * Append the problems of the rule at {@code index} to {@code errors},
     * including a repeat of an id already recorded in {@code seenIds}.
     */
    static void collectProblems(int index, RuleDefinition rule, Map<String, Integer> seenIds, List<String> errors) {
        String label = rule.getId() != null
                ? "rules[" + index + "] (" + rule.getId() + ")"
                : "rules[" + index + "]";
        for (String problem : rule.problems()) {
            errors.add(label + ": " + problem);
        }
        if (rule.getId() != null) {
            Integer first = seenIds.putIfAbsent(rule.getId(), index);
            if (first != null) {
                errors.add(label + ": Duplicate rule id '" + rule.getId() + "', first defined at rules[" + first + "]");
            }
        }
    }
}
