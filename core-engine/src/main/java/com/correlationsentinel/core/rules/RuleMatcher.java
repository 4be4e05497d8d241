package com.correlationsentinel.core.rules;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.RuleDefinition;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SecurityEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates the enabled rules of a {@link RuleCatalog} against a new event
 * and the retained history.
 *
 * <h3>Per rule</h3>
 * <ol>
 * <li>Retained events inside {@code [now - window, now]} that pass the
 * rule's event-type filter are collected. The new event always takes part,
 * whatever its type.</li>
 * <li>Fewer than {@code minEventCount} events: the rule does not fire.</li>
 * <li>Confidence is
 * {@code min(1, 0.6 * count / minEventCount + 0.3 * max(0, 1 - span / window) + 0.1 * diverse)}
 * where {@code diverse} is 1 when at least two event types took part.</li>
 * <li>The rule fires when confidence reaches {@code minConfidence}.</li>
 * </ol>
 *
 * <p>
 * Only events still held by the {@link EventHistoryStore} are visible, so a
 * rule window longer than the history retention is effectively capped by it.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RuleMatcher.class);

    private final RuleCatalog catalog;
    private final EventHistoryStore history;

    public RuleMatcher(RuleCatalog catalog, EventHistoryStore history) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    /**
     * Evaluate every enabled rule.
     *
     * @param event the new event, already recorded in the history
     * @param now   reference instant for the rule windows
     * @return all firing rules in catalog order; empty when none fired
     */
    public List<RuleMatch> evaluate(SecurityEvent event, Instant now) {
        Objects.requireNonNull(event, "event must not be null");
        List<RuleDefinition> rules = catalog.enabledRules();
        if (rules.isEmpty()) {
            return List.of();
        }

        Duration widest = rules.stream()
                .map(RuleDefinition::window)
                .max(Comparator.naturalOrder())
                .orElse(Duration.ZERO);
        List<SecurityEvent> retained = history.recentEvents(widest, now);

        List<RuleMatch> matches = new ArrayList<>();
        for (RuleDefinition rule : rules) {
            match(rule, event, retained, now).ifPresent(matches::add);
        }
        return matches;
    }

    /**
     * Pick the strongest match: highest confidence, ties resolved by catalog
     * order. Weaker concurrent matches are not reported.
     */
    public static Optional<RuleMatch> selectBest(List<RuleMatch> matches) {
        RuleMatch best = null;
        for (RuleMatch m : matches) {
            if (best == null || m.getConfidence() > best.getConfidence()) {
                best = m;
            }
        }
        return Optional.ofNullable(best);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<RuleMatch> match(RuleDefinition rule, SecurityEvent event,
            List<SecurityEvent> retained, Instant now) {
        Set<SecurityEventType> filter = rule.requiredTypes();
        Instant from = now.minus(rule.window());
        List<SecurityEvent> related = new ArrayList<>();
        for (SecurityEvent candidate : retained) {
            if (candidate.getId().equals(event.getId())) {
                continue;
            }
            Instant ts = candidate.getTimestamp();
            if (!ts.isBefore(from) && !ts.isAfter(now) && accepts(filter, candidate.getType())) {
                related.add(candidate);
            }
        }
        related.add(event);

        if (related.size() < rule.getMinEventCount()) {
            LOG.trace("Rule [{}] skipped: {} event(s) < minEventCount {}",
                    rule.getId(), related.size(), rule.getMinEventCount());
            return Optional.empty();
        }

        double confidence = confidence(related, rule);
        if (confidence < rule.getMinConfidence()) {
            LOG.debug("Rule [{}] not fired: confidence {} < {}",
                    rule.getId(), confidence, rule.getMinConfidence());
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: {} events, confidence={}", rule.getId(), related.size(), confidence);
        return Optional.of(new RuleMatch(rule, toCorrelation(rule, related, confidence, now)));
    }

    static double confidence(List<SecurityEvent> events, RuleDefinition rule) {
        double base = (double) events.size() / Math.max(rule.getMinEventCount(), 1);

        Instant first = events.get(0).getTimestamp();
        Instant last = first;
        Set<SecurityEventType> types = EnumSet.noneOf(SecurityEventType.class);
        for (SecurityEvent e : events) {
            Instant ts = e.getTimestamp();
            if (ts.isBefore(first)) {
                first = ts;
            }
            if (ts.isAfter(last)) {
                last = ts;
            }
            types.add(e.getType());
        }
        double spanMillis = Duration.between(first, last).toMillis();
        double timeRatio = Math.max(0.0, 1.0 - spanMillis / rule.window().toMillis());
        double diversityBonus = types.size() > 1 ? 0.1 : 0.0;

        return Math.min(1.0, base * 0.6 + timeRatio * 0.3 + diversityBonus);
    }

    private static Correlation toCorrelation(RuleDefinition rule, List<SecurityEvent> events,
            double confidence, Instant now) {
        List<SecurityEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparing(SecurityEvent::getTimestamp));

        List<String> eventIds = new ArrayList<>(ordered.size());
        Set<String> techniques = new LinkedHashSet<>();
        for (SecurityEvent e : ordered) {
            eventIds.add(e.getId());
            techniques.addAll(e.getTechniqueIds());
        }

        return Correlation.builder()
                .type(rule.correlationType())
                .confidence(confidence)
                .pattern(rule.getName())
                .eventIds(eventIds)
                .timeWindow(rule.window())
                .techniqueIds(new ArrayList<>(techniques))
                .riskLevel(CorrelationPlaybook.riskFor(confidence, ordered.size()))
                .summary(rule.getName() + ": " + ordered.size() + " related events detected")
                .recommendedActions(CorrelationPlaybook.actionsFor(rule.correlationType()))
                .metadata("ruleId", rule.getId())
                .metadata("matchedEventCount", ordered.size())
                .detectedAt(now)
                .build();
    }

    private static boolean accepts(Set<SecurityEventType> filter, SecurityEventType type) {
        return filter.isEmpty() || filter.contains(type);
    }
}
