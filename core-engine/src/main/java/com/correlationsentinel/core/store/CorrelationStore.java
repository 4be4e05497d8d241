package com.correlationsentinel.core.store;

import com.correlationsentinel.core.model.Correlation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of detected correlations, keyed by correlation id.
 *
 * <p>
 * Thread-safe. Nothing is persisted; the store is emptied only by
 * {@link #evictOlderThan(Duration, Instant)}.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationStore {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationStore.class);

    private static final Comparator<Correlation> NEWEST_FIRST =
            Comparator.comparing(Correlation::getDetectedAt).reversed();

    private final ConcurrentHashMap<String, Correlation> correlations = new ConcurrentHashMap<>();

    /** Insert or replace a correlation with the same id. */
    public void put(Correlation correlation) {
        Objects.requireNonNull(correlation, "correlation must not be null");
        correlations.put(correlation.getId(), correlation);
    }

    public Optional<Correlation> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(correlations.get(id));
    }

    /**
     * @return correlations detected in {@code [start, end]}, newest first
     */
    public List<Correlation> query(Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        List<Correlation> result = new ArrayList<>();
        for (Correlation c : correlations.values()) {
            Instant at = c.getDetectedAt();
            if (!at.isBefore(start) && !at.isAfter(end)) {
                result.add(c);
            }
        }
        result.sort(NEWEST_FIRST);
        return result;
    }

    /**
     * @return correlations that include {@code eventId}, newest first
     */
    public List<Correlation> byEvent(String eventId) {
        List<Correlation> result = new ArrayList<>();
        for (Correlation c : correlations.values()) {
            if (c.involves(eventId)) {
                result.add(c);
            }
        }
        result.sort(NEWEST_FIRST);
        return result;
    }

    /**
     * Remove correlations detected before {@code now - maxAge}.
     *
     * @return number of removed correlations
     */
    public int evictOlderThan(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, Correlation> entry : correlations.entrySet()) {
            if (entry.getValue().getDetectedAt().isBefore(cutoff)
                    && correlations.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Evicted {} correlation(s) older than {}", removed, cutoff);
        }
        return removed;
    }

    /** @return every stored correlation, newest first */
    public List<Correlation> all() {
        List<Correlation> result = new ArrayList<>(correlations.values());
        result.sort(NEWEST_FIRST);
        return result;
    }

    public int size() {
        return correlations.size();
    }
}
