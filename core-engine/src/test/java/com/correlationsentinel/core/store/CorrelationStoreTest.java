package com.correlationsentinel.core.store;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.correlationsentinel.core.TestEvents.BASE;
import static org.assertj.core.api.Assertions.assertThat;

class CorrelationStoreTest {

    private final CorrelationStore store = new CorrelationStore();

    @Test
    @DisplayName("Should return stored correlations by id")
    void getById() {
        Correlation c = correlation("c1", BASE, "e1");
        store.put(c);

        assertThat(store.get("c1")).containsSame(c);
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    @DisplayName("Putting the same id again should replace the entry")
    void putReplaces() {
        store.put(correlation("c1", BASE, "e1"));
        store.put(correlation("c1", BASE.plusSeconds(5), "e2"));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("c1").orElseThrow().getEventIds()).containsExactly("e2");
    }

    @Test
    @DisplayName("Range queries should be inclusive and newest first")
    void queryRange() {
        store.put(correlation("c1", BASE, "e1"));
        store.put(correlation("c2", BASE.plusSeconds(60), "e2"));
        store.put(correlation("c3", BASE.plusSeconds(120), "e3"));
        store.put(correlation("c4", BASE.plusSeconds(180), "e4"));

        List<Correlation> result = store.query(BASE.plusSeconds(60), BASE.plusSeconds(120));

        assertThat(result).extracting(Correlation::getId).containsExactly("c3", "c2");
        assertThat(store.all()).extracting(Correlation::getId).containsExactly("c4", "c3", "c2", "c1");
    }

    @Test
    @DisplayName("Event lookups should find every correlation that includes the event")
    void byEvent() {
        store.put(correlation("c1", BASE, "e1", "e2"));
        store.put(correlation("c2", BASE.plusSeconds(10), "e2", "e3"));

        assertThat(store.byEvent("e2")).extracting(Correlation::getId).containsExactly("c2", "c1");
        assertThat(store.byEvent("e1")).extracting(Correlation::getId).containsExactly("c1");
        assertThat(store.byEvent("nope")).isEmpty();
    }

    @Test
    @DisplayName("Eviction should drop only correlations older than the cutoff")
    void evictOlderThan() {
        store.put(correlation("old", BASE, "e1"));
        store.put(correlation("new", BASE.plus(Duration.ofDays(20)), "e2"));

        int removed = store.evictOlderThan(Duration.ofDays(30), BASE.plus(Duration.ofDays(31)));

        assertThat(removed).isEqualTo(1);
        assertThat(store.all()).extracting(Correlation::getId).containsExactly("new");
    }

    private static Correlation correlation(String id, Instant detectedAt, String... eventIds) {
        return Correlation.builder()
                .id(id)
                .type(CorrelationType.TEMPORAL_BURST)
                .confidence(0.8)
                .eventIds(List.of(eventIds))
                .detectedAt(detectedAt)
                .build();
    }
}
