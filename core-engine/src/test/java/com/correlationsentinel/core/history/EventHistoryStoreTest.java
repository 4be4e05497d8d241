package com.correlationsentinel.core.history;

import com.correlationsentinel.core.model.RawEvent;
import com.correlationsentinel.core.model.SecurityEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.correlationsentinel.core.TestEvents.BASE;
import static com.correlationsentinel.core.TestEvents.failedLogon;
import static com.correlationsentinel.core.TestEvents.raw;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventHistoryStore}.
 */
class EventHistoryStoreTest {

    private static final HistoryKey ALICE_FAILURES = new HistoryKey("Security", 4625, "alice");

    private EventHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new EventHistoryStore(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should group events by channel, event id and actor")
    void shouldGroupByKey() {
        record(failedLogon("e1", BASE));
        record(failedLogon("e2", BASE.plusSeconds(5)));
        record(raw("e3", "Security", 4625, "bob", "ws-01", BASE.plusSeconds(6)));

        assertThat(store.size(ALICE_FAILURES)).isEqualTo(2);
        assertThat(store.size(new HistoryKey("Security", 4625, "bob"))).isEqualTo(1);
        assertThat(store.keyCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("recentCount should exclude events older than the window relative to now")
    void recentCountExcludesOlderEvents() {
        record(failedLogon("e1", BASE));
        record(failedLogon("e2", BASE.plusSeconds(90)));

        Instant now = BASE.plusSeconds(90);
        assertThat(store.recentCount(ALICE_FAILURES, Duration.ofMinutes(1), now)).isEqualTo(1);
        assertThat(store.recentCount(ALICE_FAILURES, Duration.ofMinutes(2), now)).isEqualTo(2);
    }

    @Test
    @DisplayName("Unknown key should have a zero count")
    void unknownKeyCountsZero() {
        assertThat(store.recentCount(ALICE_FAILURES, Duration.ofMinutes(1), BASE)).isZero();
        assertThat(store.size(ALICE_FAILURES)).isZero();
    }

    @Test
    @DisplayName("Should trim events beyond the retention window on write")
    void shouldTrimOnWrite() {
        record(failedLogon("e1", BASE));
        int size = store.record(SecurityEvent.of(failedLogon("e2", BASE.plusSeconds(360)), null),
                BASE.plusSeconds(360));

        assertThat(size).isEqualTo(1);
        assertThat(store.size(ALICE_FAILURES)).isEqualTo(1);
    }

    @Test
    @DisplayName("Zero retention should keep nothing and never fail")
    void zeroRetentionKeepsNothing() {
        EventHistoryStore noRetention = new EventHistoryStore(Duration.ZERO);

        int size = noRetention.record(SecurityEvent.of(failedLogon("e1", BASE), null), BASE);

        assertThat(size).isZero();
        assertThat(noRetention.keyCount()).isZero();
        assertThat(noRetention.getTotalRecorded()).isEqualTo(1);
    }

    @Test
    @DisplayName("recentEvents should return events of all keys in the window, oldest first")
    void recentEventsAcrossKeys() {
        record(raw("b1", "Security", 4624, "bob", "ws-02", BASE.plusSeconds(30)));
        record(failedLogon("a1", BASE.plusSeconds(10)));
        record(failedLogon("a2", BASE.plusSeconds(100)));

        List<SecurityEvent> recent = store.recentEvents(Duration.ofSeconds(80), BASE.plusSeconds(100));

        assertThat(recent).extracting(SecurityEvent::getId).containsExactly("b1", "a2");
    }

    @Test
    @DisplayName("Sweep should drop keys whose events all expired")
    void sweepRemovesEmptyBuckets() {
        record(failedLogon("e1", BASE));
        record(raw("e2", "Security", 4624, "bob", "ws-02", BASE.plusSeconds(240)));

        int removed = store.sweep(BASE.plusSeconds(330));

        assertThat(removed).isEqualTo(1);
        assertThat(store.keyCount()).isEqualTo(1);
        assertThat(store.size(ALICE_FAILURES)).isZero();
    }

    @Test
    @DisplayName("Should count every recorded event, including trimmed ones")
    void countsTotalRecorded() {
        record(failedLogon("e1", BASE));
        record(failedLogon("e2", BASE.plusSeconds(600)));

        assertThat(store.getTotalRecorded()).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent writes to one key should not lose events")
    void concurrentWritesToSameKey() throws Exception {
        EventHistoryStore shared = new EventHistoryStore(Duration.ofHours(1));
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        shared.record(SecurityEvent.of(failedLogon("t" + thread + "-" + i, BASE), null), BASE);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(shared.size(ALICE_FAILURES)).isEqualTo(threads * perThread);
        assertThat(shared.getTotalRecorded()).isEqualTo(threads * perThread);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void record(RawEvent raw) {
        store.record(SecurityEvent.of(raw, null), raw.getTimestamp());
    }
}
