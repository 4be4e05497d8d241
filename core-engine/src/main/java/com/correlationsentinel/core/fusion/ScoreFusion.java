package com.correlationsentinel.core.fusion;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.FindingSource;
import com.correlationsentinel.core.model.RawEvent;
import com.correlationsentinel.core.model.RiskLevel;
import com.correlationsentinel.core.model.SecurityEventType;
import com.correlationsentinel.core.model.SecurityFinding;
import com.correlationsentinel.core.model.SignalScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Combines a detector's base finding with the streaming signal scores.
 *
 * <h3>Outcomes</h3>
 * <ol>
 * <li><b>Base finding, gate passes</b>: the finding is enhanced. Risk is
 * raised to the score band (never lowered), confidence grows by
 * {@code floor(10 * total)} up to 100, techniques, actions and summary are
 * extended.</li>
 * <li><b>Base finding, gate fails</b>: the finding is returned unchanged.</li>
 * <li><b>No base finding, gate passes</b>: a correlation-only finding is
 * synthesized from the scores.</li>
 * <li><b>Otherwise</b>: nothing.</li>
 * </ol>
 *
 * <p>
 * {@link #escalate(SecurityFinding, Correlation)} applies a rule correlation
 * found for the same event on top of the fused finding.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoreFusion {

    private static final Logger LOG = LoggerFactory.getLogger(ScoreFusion.class);

    static final String BRUTE_FORCE = "T1110";
    static final String VALID_ACCOUNTS = "T1078";
    static final String MONITOR_ACTION = "Monitor for additional suspicious activity";

    private final FusionPolicy policy;

    public ScoreFusion(FusionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Fuse a base finding with signal scores.
     *
     * @param raw    the observed event; must not be {@code null}
     * @param base   detector finding, or {@code null}
     * @param scores signal scores of the event
     * @return the enhanced, passed-through or synthesized finding, or empty
     */
    public Optional<SecurityFinding> fuse(RawEvent raw, SecurityFinding base, SignalScores scores) {
        Objects.requireNonNull(raw, "raw event must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        boolean gate = policy.passes(scores);

        if (base != null) {
            if (gate) {
                LOG.debug("Enhancing finding for event {} with {}", raw.getId(), scores);
                return Optional.of(enhance(base, scores));
            }
            LOG.debug("Scores below thresholds for event {}: {} (total={})", raw.getId(), scores, scores.total());
            return Optional.of(base);
        }

        if (gate) {
            SecurityFinding synthesized = synthesize(raw, scores);
            LOG.info("Created correlation-based finding for event {}: {} ({}) confidence {}%",
                    raw.getId(), synthesized.getEventType(), synthesized.getRiskLevel().label(),
                    synthesized.getConfidence());
            return Optional.of(synthesized);
        }

        LOG.debug("No finding for event {}: scores {} below total threshold {}",
                raw.getId(), scores, policy.getMinTotal());
        return Optional.empty();
    }

    /**
     * Raise a finding to at least the risk of a correlation detected for the
     * same event and fold in the correlation's techniques and actions.
     *
     * <p>
     * Never lowers risk or confidence.
     * </p>
     */
    public SecurityFinding escalate(SecurityFinding finding, Correlation correlation) {
        Objects.requireNonNull(finding, "finding must not be null");
        Objects.requireNonNull(correlation, "correlation must not be null");

        RiskLevel risk = finding.getRiskLevel().max(correlation.getRiskLevel());
        LOG.debug("Escalating finding {} -> {} after correlation '{}'",
                finding.getRiskLevel().label(), risk.label(), correlation.getPattern());

        return finding.toBuilder()
                .riskLevel(risk)
                .techniqueIds(union(finding.getTechniqueIds(), correlation.getTechniqueIds()))
                .recommendedActions(union(finding.getRecommendedActions(), correlation.getRecommendedActions()))
                .summary(finding.getSummary() + " - " + correlation.getSummary())
                .source(finding.getSource() == FindingSource.DETECTOR ? FindingSource.ENHANCED : finding.getSource())
                .build();
    }

    // ---------------------------------------------------------------
    // Enhancement
    // ---------------------------------------------------------------

    private SecurityFinding enhance(SecurityFinding base, SignalScores scores) {
        double total = scores.total();
        RiskLevel risk = base.getRiskLevel().max(band(total).orElse(null));
        int confidence = Math.min(100, base.getConfidence() + (int) (total * 10));

        List<String> clauses = new ArrayList<>();
        if (scores.getCorrelation() > 0.5) {
            clauses.add("correlated activity detected");
        }
        if (scores.getBurst() > 0.5) {
            clauses.add("burst pattern identified");
        }
        if (scores.getAnomaly() > 0.5) {
            clauses.add("anomalous behavior observed");
        }
        String summary = clauses.isEmpty()
                ? base.getSummary()
                : base.getSummary() + " - " + String.join(", ", clauses);

        return base.toBuilder()
                .riskLevel(risk)
                .confidence(confidence)
                .summary(summary)
                .techniqueIds(union(base.getTechniqueIds(), techniquesFor(scores)))
                .recommendedActions(union(base.getRecommendedActions(), actionsFor(scores)))
                .source(FindingSource.ENHANCED)
                .correlationScore(scores.getCorrelation())
                .burstScore(scores.getBurst())
                .anomalyScore(scores.getAnomaly())
                .build();
    }

    // ---------------------------------------------------------------
    // Synthesis
    // ---------------------------------------------------------------

    private SecurityFinding synthesize(RawEvent raw, SignalScores scores) {
        double total = scores.total();

        List<String> patterns = new ArrayList<>();
        if (scores.getBurst() > 0.5) {
            patterns.add("burst pattern");
        }
        if (scores.getCorrelation() > 0.5) {
            patterns.add("correlated events");
        }
        if (scores.getAnomaly() > 0.5) {
            patterns.add("anomalous behavior");
        }
        String summary = patterns.isEmpty()
                ? "Suspicious " + raw.getChannel() + " activity detected"
                : "Suspicious " + raw.getChannel() + " activity detected with " + String.join(", ", patterns);

        List<String> actions = new ArrayList<>(actionsFor(scores));
        actions.add(MONITOR_ACTION);

        return SecurityFinding.builder()
                .eventType(dominantType(scores))
                .riskLevel(band(total).orElse(RiskLevel.LOW))
                .confidence(Math.min(95, 50 + (int) (total * 20)))
                .summary(summary)
                .techniqueIds(techniquesFor(scores))
                .recommendedActions(actions)
                .source(FindingSource.CORRELATION)
                .correlationScore(scores.getCorrelation())
                .burstScore(scores.getBurst())
                .anomalyScore(scores.getAnomaly())
                .build();
    }

    private static SecurityEventType dominantType(SignalScores scores) {
        if (scores.getBurst() > 0.7) {
            return SecurityEventType.BURST_ACTIVITY;
        }
        if (scores.getCorrelation() > 0.7) {
            return SecurityEventType.CORRELATED_ACTIVITY;
        }
        if (scores.getAnomaly() > 0.7) {
            return SecurityEventType.ANOMALOUS_ACTIVITY;
        }
        return SecurityEventType.SUSPICIOUS_ACTIVITY;
    }

    // ---------------------------------------------------------------
    // Shared
    // ---------------------------------------------------------------

    static Optional<RiskLevel> band(double total) {
        if (total > 2.0) {
            return Optional.of(RiskLevel.CRITICAL);
        }
        if (total > 1.5) {
            return Optional.of(RiskLevel.HIGH);
        }
        if (total > 1.0) {
            return Optional.of(RiskLevel.MEDIUM);
        }
        return Optional.empty();
    }

    private static List<String> techniquesFor(SignalScores scores) {
        List<String> techniques = new ArrayList<>();
        if (scores.getBurst() > 0.7) {
            techniques.add(BRUTE_FORCE);
        }
        if (scores.getCorrelation() > 0.7 || scores.getAnomaly() > 0.7) {
            techniques.add(VALID_ACCOUNTS);
        }
        return techniques;
    }

    private static List<String> actionsFor(SignalScores scores) {
        List<String> actions = new ArrayList<>();
        if (scores.getBurst() > 0.5) {
            actions.add("Implement rate limiting");
        }
        if (scores.getCorrelation() > 0.5) {
            actions.add("Investigate related events");
        }
        if (scores.getAnomaly() > 0.5) {
            actions.add("Review user activity patterns");
        }
        return actions;
    }

    private static List<String> union(List<String> first, List<String> second) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }
}
