package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Runs the batch detectors in sequence over one event snapshot.
 *
 * <h3>Stages</h3>
 * <p>
 * Temporal burst, then attack chain, then lateral movement. The cancellation
 * signal is checked before each stage; once it reports {@code true} the
 * remaining stages are skipped and the correlations gathered so far are
 * returned.
 * </p>
 *
 * <h3>Error handling</h3>
 * <p>
 * A detector that throws is logged and skipped; the other stages still run.
 * </p>
 *
 * @since 1.0.0
 */
public class BatchAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final List<BatchDetector> stages;

    /**
     * Default stages with the given lateral-movement bucket width.
     */
    public BatchAnalyzer(Duration lateralMovementWindow) {
        this(List.of(
                new TemporalBurstDetector(),
                new AttackChainDetector(),
                new LateralMovementDetector(lateralMovementWindow)));
    }

    public BatchAnalyzer(List<BatchDetector> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        this.stages = List.copyOf(stages);
    }

    /**
     * Analyse a batch.
     *
     * @param events    snapshot to analyse; an empty list yields an empty result
     * @param window    detector time window
     * @param now       timestamp for produced correlations
     * @param cancelled checked between stages
     * @return correlations of all stages that ran, in stage order
     */
    public List<Correlation> analyze(List<SecurityEvent> events, Duration window, Instant now,
            BooleanSupplier cancelled) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(window, "window must not be null");
        if (events.isEmpty()) {
            return List.of();
        }

        List<SecurityEvent> snapshot = List.copyOf(events);
        List<Correlation> correlations = new ArrayList<>();
        for (BatchDetector detector : stages) {
            if (cancelled.getAsBoolean()) {
                LOG.info("Batch analysis cancelled before stage '{}'", detector.getName());
                break;
            }
            try {
                List<Correlation> found = detector.detect(snapshot, window, now);
                LOG.debug("Stage '{}' produced {} correlation(s)", detector.getName(), found.size());
                correlations.addAll(found);
            } catch (RuntimeException e) {
                LOG.error("Batch detector '{}' failed on {} event(s)", detector.getName(), snapshot.size(), e);
            }
        }

        LOG.info("Batch analysis of {} event(s) produced {} correlation(s)", snapshot.size(), correlations.size());
        return correlations;
    }
}
