package com.correlationsentinel.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of analysing one event on the streaming path.
 *
 * <p>
 * Carries the fused finding (if fusion produced or passed one through), the
 * best correlation (if any rule or strategy fired), the signal scores, the
 * names of every rule that fired and a human-readable explanation.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventAnalysis {

    private static final EventAnalysis NONE = new EventAnalysis(
            null, null, SignalScores.NONE, List.of(), "No correlation patterns detected");

    private final SecurityFinding finding;
    private final Correlation correlation;
    private final SignalScores scores;
    private final List<String> matchedRules;
    private final String explanation;

    public EventAnalysis(SecurityFinding finding, Correlation correlation, SignalScores scores,
            List<String> matchedRules, String explanation) {
        this.finding = finding;
        this.correlation = correlation;
        this.scores = scores != null ? scores : SignalScores.NONE;
        this.matchedRules = matchedRules != null ? List.copyOf(matchedRules) : List.of();
        this.explanation = explanation != null ? explanation : "";
    }

    /** @return the empty analysis returned for absent input or failures */
    public static EventAnalysis none() {
        return NONE;
    }

    public Optional<SecurityFinding> getFinding() {
        return Optional.ofNullable(finding);
    }

    public Optional<Correlation> getCorrelation() {
        return Optional.ofNullable(correlation);
    }

    public boolean hasCorrelation() {
        return correlation != null;
    }

    public SignalScores getScores() {
        return scores;
    }

    public List<String> getMatchedRules() {
        return matchedRules;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "EventAnalysis{" +
                "finding=" + finding +
                ", correlation=" + correlation +
                ", scores=" + scores +
                ", matchedRules=" + matchedRules +
                '}';
    }
}
