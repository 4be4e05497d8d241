package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.detection.AttackChainDetector;
import com.correlationsentinel.core.detection.BatchAnalyzer;
import com.correlationsentinel.core.fusion.FusionPolicy;
import com.correlationsentinel.core.fusion.ScoreFusion;
import com.correlationsentinel.core.history.EventHistoryStore;
import com.correlationsentinel.core.model.AttackChain;
import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationStatistics;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.EventAnalysis;
import com.correlationsentinel.core.model.RawEvent;
import com.correlationsentinel.core.model.RuleDefinition;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SecurityFinding;
import com.correlationsentinel.core.model.SignalScores;
import com.correlationsentinel.core.rules.CorrelationPlaybook;
import com.correlationsentinel.core.rules.RuleCatalog;
import com.correlationsentinel.core.rules.RuleMatch;
import com.correlationsentinel.core.rules.RuleMatcher;
import com.correlationsentinel.core.signal.SignalEvaluator;
import com.correlationsentinel.core.store.CorrelationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Entry point of the correlation engine.
 *
 * <h3>Streaming path</h3>
 * <p>
 * {@link #analyze(RawEvent, SecurityFinding)} records the event in the
 * history, scores it, runs the rule matcher and the correlation strategy,
 * fuses the scores with the detector finding and escalates that finding
 * when a correlation fired. The call is synchronous and never throws for
 * analysis failures: they are logged and reported as an empty analysis.
 * </p>
 *
 * <h3>Batch path</h3>
 * <p>
 * {@link #analyzeBatch(List, Duration)} runs the batch detectors over a
 * caller-supplied snapshot; it never reads the streaming history. When an
 * {@link EventSource} is configured, {@link #start()} also schedules it
 * periodically.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} schedules the maintenance tasks (history sweep,
 * correlation eviction, batch analysis). {@link #stop()} is idempotent and
 * final; a stopped engine cannot be restarted. Analysis works without ever
 * calling {@code start()}.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    static final String NO_CORRELATION = "No correlation patterns detected";
    static final int TOP_PATTERNS = 5;

    private final EngineConfig config;
    private final RuleCatalog catalog;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final CorrelationStrategy strategy;
    private final EventSource eventSource;
    private final List<CorrelationListener> listeners;

    private final EventHistoryStore history;
    private final SignalEvaluator signals;
    private final RuleMatcher matcher;
    private final ScoreFusion fusion;
    private final BatchAnalyzer batchAnalyzer;
    private final AttackChainDetector chainDetector;
    private final CorrelationStore store;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final List<ScheduledFuture<?>> tasks = new CopyOnWriteArrayList<>();
    private volatile Instant lastBatchEnd;

    private CorrelationEngine(Builder b) {
        this.config = b.config != null ? b.config : EngineConfig.defaults();
        this.catalog = b.catalog != null ? b.catalog : RuleCatalog.loadDefault();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.ownsScheduler = b.scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler() : b.scheduler;
        this.strategy = b.strategy != null ? b.strategy : new NoOpCorrelationStrategy();
        this.eventSource = b.eventSource;
        this.listeners = new CopyOnWriteArrayList<>(b.listeners);

        this.history = new EventHistoryStore(config.getCorrelationWindow());
        this.signals = SignalEvaluator.forHistory(history, config.getServiceAccountPattern());
        this.matcher = new RuleMatcher(catalog, history);
        this.fusion = new ScoreFusion(FusionPolicy.from(config));
        this.batchAnalyzer = new BatchAnalyzer(config.getLateralMovementWindow());
        this.chainDetector = new AttackChainDetector();
        this.store = new CorrelationStore();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Streaming path
    // ---------------------------------------------------------------

    /**
     * Analyse one event.
     *
     * @param raw     the observed event; {@code null} yields
     *                {@link EventAnalysis#none()}
     * @param finding the detector's finding for the event, or {@code null}
     * @return the analysis; never {@code null}
     */
    public EventAnalysis analyze(RawEvent raw, SecurityFinding finding) {
        if (raw == null) {
            LOG.debug("No raw event supplied, skipping correlation analysis");
            return EventAnalysis.none();
        }
        try {
            return doAnalyze(raw, finding);
        } catch (RuntimeException e) {
            LOG.error("Correlation analysis failed for event {}", raw.getId(), e);
            return EventAnalysis.none();
        }
    }

    /**
     * Analyse one event and return only the correlation, if any.
     *
     * @see #analyze(RawEvent, SecurityFinding)
     */
    public Optional<Correlation> analyzeEvent(RawEvent raw, SecurityFinding finding) {
        return analyze(raw, finding).getCorrelation();
    }

    private EventAnalysis doAnalyze(RawEvent raw, SecurityFinding finding) {
        Instant now = clock.instant();
        SecurityEvent event = SecurityEvent.of(raw, finding);

        history.record(event, now);
        SignalScores scores = signals.evaluate(event, now);

        List<RuleMatch> matches = matcher.evaluate(event, now);
        List<String> matchedRules = matches.stream()
                .map(m -> m.getRule().getName())
                .collect(Collectors.toList());
        Correlation correlation = RuleMatcher.selectBest(matches)
                .map(RuleMatch::getCorrelation)
                .orElse(null);

        Correlation learned = detectWithStrategy(event, now).orElse(null);
        if (learned != null && (correlation == null || learned.getConfidence() > correlation.getConfidence())) {
            correlation = learned;
        }

        Optional<SecurityFinding> fused = fusion.fuse(raw, finding, scores);
        if (correlation != null && fused.isPresent()) {
            fused = Optional.of(fusion.escalate(fused.get(), correlation));
        }

        String explanation = NO_CORRELATION;
        if (correlation != null) {
            store.put(correlation);
            LOG.info("Correlation detected: {} '{}' ({} events, confidence={}, risk={})",
                    correlation.getType(), correlation.getPattern(), correlation.getEventIds().size(),
                    correlation.getConfidence(), correlation.getRiskLevel().label());
            notifyListeners(correlation);
            explanation = CorrelationPlaybook.explain(correlation);
        }

        return new EventAnalysis(fused.orElse(null), correlation, scores, matchedRules, explanation);
    }

    private Optional<Correlation> detectWithStrategy(SecurityEvent event, Instant now) {
        try {
            List<SecurityEvent> recent = history.recentEvents(config.getCorrelationWindow(), now);
            return strategy.detect(event, recent, now);
        } catch (RuntimeException e) {
            LOG.error("Correlation strategy failed for event {}, continuing without it", event.getId(), e);
            return Optional.empty();
        }
    }

    // ---------------------------------------------------------------
    // Batch path
    // ---------------------------------------------------------------

    /**
     * Run the batch detectors over an event snapshot and store the results.
     *
     * @param events snapshot to analyse; {@code null} or empty yields an
     *               empty list
     * @param window detector window
     * @return the correlations found, in stage order
     */
    public List<Correlation> analyzeBatch(List<SecurityEvent> events, Duration window) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        Objects.requireNonNull(window, "window must not be null");
        try {
            List<Correlation> found = batchAnalyzer.analyze(events, window, clock.instant(), this::isCancelled);
            for (Correlation correlation : found) {
                store.put(correlation);
                notifyListeners(correlation);
            }
            return found;
        } catch (RuntimeException e) {
            LOG.error("Batch correlation analysis failed for {} event(s)", events.size(), e);
            return List.of();
        }
    }

    /**
     * Find attack chains without converting or storing them.
     */
    public List<AttackChain> detectAttackChains(List<SecurityEvent> events, Duration window) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        try {
            return chainDetector.findChains(events, window);
        } catch (RuntimeException e) {
            LOG.error("Attack chain detection failed for {} event(s)", events.size(), e);
            return List.of();
        }
    }

    /**
     * Pull the events since the previous run from the {@link EventSource} and
     * analyse them. Does nothing without an event source. When the source
     * fails, the failure is logged and the same range is requested again on
     * the next run.
     *
     * @return correlations produced by this run
     */
    public List<Correlation> runBatchAnalysis() {
        if (eventSource == null) {
            return List.of();
        }
        Instant end = clock.instant();
        Instant start = lastBatchEnd != null ? lastBatchEnd : end.minus(config.getBatchInterval());
        List<SecurityEvent> events;
        try {
            events = eventSource.eventsBetween(start, end);
        } catch (RuntimeException e) {
            // range stays open and is retried on the next run
            LOG.error("Event source failed for batch range [{}, {})", start, end, e);
            return List.of();
        }
        lastBatchEnd = end;
        LOG.debug("Periodic batch analysis over [{}, {}): {} event(s)", start, end,
                events == null ? 0 : events.size());
        return analyzeBatch(events, config.getBatchInterval());
    }

    private boolean isCancelled() {
        return stopping.get() || Thread.currentThread().isInterrupted();
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public List<Correlation> getCorrelations(Instant start, Instant end) {
        return store.query(start, end);
    }

    public Optional<Correlation> getCorrelation(String id) {
        return store.get(id);
    }

    public List<Correlation> getEventCorrelations(String eventId) {
        return store.byEvent(eventId);
    }

    /**
     * Aggregate statistics over stored correlations.
     *
     * @param start inclusive lower bound, or {@code null} for unbounded
     * @param end   inclusive upper bound, or {@code null} for unbounded
     */
    public CorrelationStatistics getStatistics(Instant start, Instant end) {
        List<Correlation> selected = store.query(
                start != null ? start : Instant.MIN,
                end != null ? end : Instant.MAX);

        Map<CorrelationType, Long> byType = new EnumMap<>(CorrelationType.class);
        Map<String, Long> byPattern = new HashMap<>();
        double confidenceSum = 0.0;
        for (Correlation c : selected) {
            byType.merge(c.getType(), 1L, Long::sum);
            byPattern.merge(c.getPattern(), 1L, Long::sum);
            confidenceSum += c.getConfidence();
        }

        List<String> topPatterns = byPattern.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_PATTERNS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        return new CorrelationStatistics(
                history.getTotalRecorded(),
                selected.size(),
                byType,
                selected.isEmpty() ? 0.0 : confidenceSum / selected.size(),
                topPatterns,
                clock.instant());
    }

    // ---------------------------------------------------------------
    // Rules and extension points
    // ---------------------------------------------------------------

    public List<RuleDefinition> getRules() {
        return catalog.getRules();
    }

    /**
     * Add or replace a rule.
     *
     * @throws IllegalStateException if the rule is invalid
     */
    public void updateRule(RuleDefinition rule) {
        catalog.update(rule);
    }

    /**
     * Hand confirmed correlations to the correlation strategy.
     */
    public void trainModels(List<Correlation> confirmed) {
        if (confirmed == null || confirmed.isEmpty()) {
            LOG.debug("No confirmed correlations supplied for training");
            return;
        }
        try {
            strategy.train(List.copyOf(confirmed));
        } catch (RuntimeException e) {
            LOG.error("Correlation strategy training failed on {} correlation(s)", confirmed.size(), e);
        }
    }

    /**
     * @return number of evicted correlations
     */
    public int cleanupOlderThan(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        return store.evictOlderThan(maxAge, clock.instant());
    }

    /**
     * @return number of history keys dropped
     */
    public int runHistorySweep() {
        return history.sweep(clock.instant());
    }

    public void addListener(CorrelationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    private void notifyListeners(Correlation correlation) {
        for (CorrelationListener listener : listeners) {
            try {
                listener.onCorrelation(correlation);
            } catch (RuntimeException e) {
                LOG.error("Correlation listener failed for correlation {}", correlation.getId(), e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Schedule the maintenance tasks. Calling it again while running has no
     * effect.
     *
     * @throws IllegalStateException if the engine has been stopped
     */
    public void start() {
        if (stopping.get()) {
            throw new IllegalStateException("Correlation engine has been stopped");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        schedule("history-sweep", config.getHistorySweepInterval(), this::runHistorySweep);
        schedule("correlation-eviction", config.getStoreEvictionInterval(),
                () -> cleanupOlderThan(config.getCorrelationMaxAge()));
        if (eventSource != null) {
            schedule("batch-analysis", config.getBatchInterval(), this::runBatchAnalysis);
        }
        LOG.info("Correlation engine started with {} rule(s): {}", catalog.size(), config);
    }

    /**
     * Cancel scheduled work and, when the engine created its own scheduler,
     * shut it down. Idempotent.
     */
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        for (ScheduledFuture<?> task : tasks) {
            task.cancel(false);
        }
        tasks.clear();
        running.set(false);

        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Correlation engine stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void schedule(String name, Duration interval, Runnable task) {
        long millis = interval.toMillis();
        tasks.add(scheduler.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // keep the periodic task alive
                LOG.error("Scheduled task '{}' failed", name, e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS));
        LOG.debug("Scheduled '{}' every {}", name, interval);
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "correlation-engine-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CorrelationEngine}.
     *
     * <p>
     * Every collaborator is optional: the configuration defaults to
     * {@link EngineConfig#defaults()}, the rule catalog to
     * {@link RuleCatalog#loadDefault()}, the clock to UTC system time, the
     * strategy to {@link NoOpCorrelationStrategy}. Without a scheduler the
     * engine creates and owns a single daemon thread. Without an
     * {@link EventSource} no periodic batch analysis is scheduled.
     * </p>
     */
    public static class Builder {
        private EngineConfig config;
        private RuleCatalog catalog;
        private Clock clock;
        private ScheduledExecutorService scheduler;
        private CorrelationStrategy strategy;
        private EventSource eventSource;
        private final List<CorrelationListener> listeners = new ArrayList<>();

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder ruleCatalog(RuleCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** A scheduler supplied here is used but never shut down by the engine. */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder strategy(CorrelationStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder eventSource(EventSource eventSource) {
            this.eventSource = eventSource;
            return this;
        }

        public Builder listener(CorrelationListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /**
         * @return a new, not yet started engine
         * @throws IllegalStateException if the default rules cannot be loaded
         */
        public CorrelationEngine build() {
            return new CorrelationEngine(this);
        }
    }
}
