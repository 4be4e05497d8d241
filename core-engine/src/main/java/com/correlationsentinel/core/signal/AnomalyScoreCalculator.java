package com.correlationsentinel.core.signal;

import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.history.HistoryKey;
import com.correlationsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Heuristic anomaly score built from three additive indicators.
 *
 * <ul>
 * <li>{@code +0.3} off-hours activity: event hour (UTC) {@code >= 22} or
 * {@code <= 6}</li>
 * <li>{@code +0.2} a service or machine account acting during weekday
 * business hours (08 to 18 inclusive)</li>
 * <li>{@code +0.2} the first event ever retained for its key</li>
 * </ul>
 *
 * <p>
 * The result is capped at {@code 1.0}. The service-account pattern is
 * searched anywhere in the actor name.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyScoreCalculator implements SignalCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyScoreCalculator.class);

    private final EventHistoryStore history;
    private final Pattern serviceAccountPattern;

    public AnomalyScoreCalculator(EventHistoryStore history, Pattern serviceAccountPattern) {
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.serviceAccountPattern = Objects.requireNonNull(serviceAccountPattern,
                "serviceAccountPattern must not be null");
    }

    @Override
    public double score(SecurityEvent event, Instant now) {
        ZonedDateTime at = event.getTimestamp().atZone(ZoneOffset.UTC);
        int hour = at.getHour();
        double score = 0.0;

        if (hour >= 22 || hour <= 6) {
            score += 0.3;
        }

        String actor = event.getRaw().getActor();
        if (serviceAccountPattern.matcher(actor).find()
                && isWeekday(at.getDayOfWeek())
                && hour >= 8 && hour <= 18) {
            score += 0.2;
        }

        if (history.size(HistoryKey.of(event.getRaw())) == 1) {
            score += 0.2;
        }

        LOG.trace("Anomaly score for {} = {}", event.getId(), score);
        return Math.min(1.0, score);
    }

    private static boolean isWeekday(DayOfWeek day) {
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    @Override
    public String getName() {
        return "anomaly";
    }
}
