package com.correlationsentinel.core.history;

import com.correlationsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, time-windowed memory of recent events grouped by
 * {@link HistoryKey}.
 *
 * <h3>Retention</h3>
 * <p>
 * Every write trims the written bucket to the retention window measured from
 * the supplied {@code now}; {@link #sweep(Instant)} trims all buckets and
 * drops the empty ones. A retention of zero or less keeps nothing.
 * </p>
 *
 * <h3>Thread safety</h3>
 * <p>
 * Buckets live in a {@link ConcurrentHashMap}. Writes go through
 * {@link ConcurrentHashMap#compute} so insert-or-append is atomic per key;
 * each bucket additionally guards its list with its own monitor so readers
 * never observe a half-trimmed list. Distinct keys never contend.
 * </p>
 *
 * @since 1.0.0
 */
public class EventHistoryStore {

    private static final Logger LOG = LoggerFactory.getLogger(EventHistoryStore.class);

    private final ConcurrentHashMap<HistoryKey, Bucket> buckets = new ConcurrentHashMap<>();
    private final Duration retention;
    private final AtomicLong totalRecorded = new AtomicLong();

    /**
     * @param retention how long events are kept; {@code <= 0} keeps nothing
     */
    public EventHistoryStore(Duration retention) {
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
    }

    /**
     * Append an event under its key and trim that key's bucket.
     *
     * @param event the classified event; must not be {@code null}
     * @param now   reference instant for trimming
     * @return number of events retained under the key after the write
     */
    public int record(SecurityEvent event, Instant now) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(now, "now must not be null");
        totalRecorded.incrementAndGet();

        HistoryKey key = HistoryKey.of(event.getRaw());
        Instant cutoff = cutoff(now);
        int[] size = new int[1];
        buckets.compute(key, (k, bucket) -> {
            Bucket target = bucket != null ? bucket : new Bucket();
            size[0] = target.appendAndTrim(event, cutoff);
            return size[0] == 0 ? null : target;
        });
        return size[0];
    }

    /**
     * Count retained events under {@code key} no older than {@code now - window}.
     *
     * @return the count, {@code 0} for an unknown key
     */
    public int recentCount(HistoryKey key, Duration window, Instant now) {
        Bucket bucket = buckets.get(key);
        if (bucket == null) {
            return 0;
        }
        return bucket.countSince(now.minus(window));
    }

    /** @return number of events currently retained under {@code key} */
    public int size(HistoryKey key) {
        Bucket bucket = buckets.get(key);
        return bucket == null ? 0 : bucket.size();
    }

    /**
     * Collect retained events of every key whose timestamp lies in
     * {@code [now - window, now]}.
     *
     * @return matching events sorted by timestamp
     */
    public List<SecurityEvent> recentEvents(Duration window, Instant now) {
        Instant from = now.minus(window);
        List<SecurityEvent> result = new ArrayList<>();
        for (Bucket bucket : buckets.values()) {
            bucket.collectBetween(from, now, result);
        }
        result.sort(Comparator.comparing(SecurityEvent::getTimestamp));
        return result;
    }

    /**
     * Trim every bucket to the retention window and drop empty buckets.
     *
     * @param now reference instant
     * @return number of buckets removed
     */
    public int sweep(Instant now) {
        Instant cutoff = cutoff(now);
        int removed = 0;
        for (HistoryKey key : buckets.keySet()) {
            boolean[] dropped = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.trim(cutoff) == 0) {
                    dropped[0] = true;
                    return null;
                }
                return bucket;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        LOG.debug("History sweep removed {} empty key(s), {} remaining", removed, buckets.size());
        return removed;
    }

    /** @return events recorded since creation, including trimmed ones */
    public long getTotalRecorded() {
        return totalRecorded.get();
    }

    public int keyCount() {
        return buckets.size();
    }

    public Duration getRetention() {
        return retention;
    }

    private Instant cutoff(Instant now) {
        // no retention: everything up to and including now is stale
        return retention.isZero() || retention.isNegative()
                ? Instant.MAX
                : now.minus(retention);
    }

    // ---------------------------------------------------------------
    // Bucket
    // ---------------------------------------------------------------

    private static final class Bucket {

        private final List<SecurityEvent> events = new ArrayList<>();

        synchronized int appendAndTrim(SecurityEvent event, Instant cutoff) {
            events.add(event);
            return trim(cutoff);
        }

        synchronized int trim(Instant cutoff) {
            events.removeIf(e -> e.getTimestamp().isBefore(cutoff));
            return events.size();
        }

        synchronized int countSince(Instant from) {
            int count = 0;
            for (SecurityEvent e : events) {
                if (!e.getTimestamp().isBefore(from)) {
                    count++;
                }
            }
            return count;
        }

        synchronized void collectBetween(Instant from, Instant to, List<SecurityEvent> sink) {
            for (SecurityEvent e : events) {
                Instant ts = e.getTimestamp();
                if (!ts.isBefore(from) && !ts.isAfter(to)) {
                    sink.add(e);
                }
            }
        }

        synchronized int size() {
            return events.size();
        }
    }
}
