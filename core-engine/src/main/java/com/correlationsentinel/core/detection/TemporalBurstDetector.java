package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.RiskLevel;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.rules.CorrelationPlaybook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds runs of at least {@value #MIN_BURST_SIZE} events from the same host
 * inside one window.
 *
 * <h3>Algorithm</h3>
 * <p>
 * Events are grouped by host and sorted by time. From every start index the
 * run grows while events stay within {@code window} of the start (inclusive).
 * Each qualifying run is reported, so a long burst yields several overlapping
 * correlations.
 * </p>
 *
 * @since 1.0.0
 */
public class TemporalBurstDetector implements BatchDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TemporalBurstDetector.class);

    static final int MIN_BURST_SIZE = 5;
    static final String PATTERN = "Temporal Burst";

    @Override
    public List<Correlation> detect(List<SecurityEvent> events, Duration window, Instant now) {
        Map<String, List<SecurityEvent>> byHost = new LinkedHashMap<>();
        for (SecurityEvent event : events) {
            byHost.computeIfAbsent(event.getHost(), h -> new ArrayList<>()).add(event);
        }

        List<Correlation> correlations = new ArrayList<>();
        for (Map.Entry<String, List<SecurityEvent>> entry : byHost.entrySet()) {
            String host = entry.getKey();
            List<SecurityEvent> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparing(SecurityEvent::getTimestamp));

            for (int i = 0; i < sorted.size(); i++) {
                Instant start = sorted.get(i).getTimestamp();
                int end = i + 1;
                while (end < sorted.size()
                        && Duration.between(start, sorted.get(end).getTimestamp()).compareTo(window) <= 0) {
                    end++;
                }
                List<SecurityEvent> burst = sorted.subList(i, end);
                if (burst.size() >= MIN_BURST_SIZE) {
                    correlations.add(toCorrelation(host, burst, window, now));
                }
            }
        }

        LOG.debug("Temporal burst detection found {} burst(s) in {} event(s)", correlations.size(), events.size());
        return correlations;
    }

    /** {@code 0.8 + 0.02 * (count - 5)}, clamped to 1.0. */
    static double confidenceFor(int count) {
        return Math.min(1.0, 0.8 + (count - MIN_BURST_SIZE) * 0.02);
    }

    private static Correlation toCorrelation(String host, List<SecurityEvent> burst, Duration window, Instant now) {
        int count = burst.size();
        Duration duration = Duration.between(burst.get(0).getTimestamp(), burst.get(count - 1).getTimestamp());

        List<String> eventIds = new ArrayList<>(count);
        for (SecurityEvent e : burst) {
            eventIds.add(e.getId());
        }

        return Correlation.builder()
                .type(CorrelationType.TEMPORAL_BURST)
                .confidence(confidenceFor(count))
                .pattern(PATTERN)
                .eventIds(eventIds)
                .timeWindow(window)
                .riskLevel(count > 10 ? RiskLevel.HIGH : RiskLevel.MEDIUM)
                .summary("Temporal burst of " + count + " events from " + host)
                .recommendedActions(CorrelationPlaybook.actionsFor(CorrelationType.TEMPORAL_BURST))
                .metadata("source", host)
                .metadata("eventCount", count)
                .metadata("durationMinutes", duration.toMillis() / 60_000.0)
                .detectedAt(now)
                .build();
    }

    @Override
    public String getName() {
        return "temporal-burst";
    }
}
