package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.CorrelationType;
import com.correlationsentinel.core.model.RiskLevel;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SecurityEventType;
import com.correlationsentinel.core.rules.CorrelationPlaybook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flags the same kind of access seen on several hosts in one time bucket.
 *
 * <p>
 * Only {@code NETWORK_CONNECTION} and {@code AUTHENTICATION_SUCCESS} events
 * are considered. Events are bucketed by type and by window-aligned bucket
 * start, {@code floor(epochMillis / width) * width}; a bucket touching at
 * least {@value #MIN_HOSTS} distinct hosts is reported.
 * </p>
 *
 * <p>
 * The bucket width is fixed at construction and independent of the batch
 * window; events straddling a bucket boundary fall into different buckets.
 * </p>
 *
 * @since 1.0.0
 */
public class LateralMovementDetector implements BatchDetector {

    private static final Logger LOG = LoggerFactory.getLogger(LateralMovementDetector.class);

    static final int MIN_HOSTS = 3;
    static final String PATTERN = "Lateral Movement";
    public static final Duration DEFAULT_BUCKET_WIDTH = Duration.ofMinutes(30);

    private static final Set<SecurityEventType> MOVEMENT_TYPES = Set.of(
            SecurityEventType.NETWORK_CONNECTION, SecurityEventType.AUTHENTICATION_SUCCESS);

    private final Duration bucketWidth;

    public LateralMovementDetector() {
        this(DEFAULT_BUCKET_WIDTH);
    }

    /**
     * @param bucketWidth bucket width; must be positive
     */
    public LateralMovementDetector(Duration bucketWidth) {
        Objects.requireNonNull(bucketWidth, "bucketWidth must not be null");
        if (bucketWidth.isZero() || bucketWidth.isNegative()) {
            throw new IllegalArgumentException("bucketWidth must be > 0, got: " + bucketWidth);
        }
        this.bucketWidth = bucketWidth;
    }

    @Override
    public List<Correlation> detect(List<SecurityEvent> events, Duration window, Instant now) {
        long width = bucketWidth.toMillis();

        Map<SecurityEventType, TreeMap<Long, List<SecurityEvent>>> buckets =
                new EnumMap<>(SecurityEventType.class);
        for (SecurityEvent event : events) {
            if (!MOVEMENT_TYPES.contains(event.getType())) {
                continue;
            }
            long bucketStart = Math.floorDiv(event.getTimestamp().toEpochMilli(), width) * width;
            buckets.computeIfAbsent(event.getType(), t -> new TreeMap<>())
                    .computeIfAbsent(bucketStart, b -> new ArrayList<>())
                    .add(event);
        }

        List<Correlation> correlations = new ArrayList<>();
        buckets.forEach((type, byStart) -> byStart.forEach((start, group) -> {
            group.sort(Comparator.comparing(SecurityEvent::getTimestamp));
            Set<String> hosts = new LinkedHashSet<>();
            for (SecurityEvent e : group) {
                hosts.add(e.getHost());
            }
            if (hosts.size() >= MIN_HOSTS) {
                LOG.info("Lateral movement: {} events across {} hosts in bucket {}",
                        type, hosts.size(), Instant.ofEpochMilli(start));
                correlations.add(toCorrelation(type, group, hosts, now));
            }
        }));
        return correlations;
    }

    /** {@code 0.75 + 0.05 * (hosts - 3)}, clamped to 1.0. */
    static double confidenceFor(int hostCount) {
        return Math.min(1.0, 0.75 + (hostCount - MIN_HOSTS) * 0.05);
    }

    private Correlation toCorrelation(SecurityEventType type, List<SecurityEvent> group, Set<String> hosts,
            Instant now) {
        List<String> eventIds = new ArrayList<>(group.size());
        for (SecurityEvent e : group) {
            eventIds.add(e.getId());
        }

        return Correlation.builder()
                .type(CorrelationType.LATERAL_MOVEMENT)
                .confidence(confidenceFor(hosts.size()))
                .pattern(PATTERN)
                .eventIds(eventIds)
                .timeWindow(bucketWidth)
                .riskLevel(RiskLevel.HIGH)
                .summary("Similar " + type.displayName() + " events across " + hosts.size() + " machines")
                .recommendedActions(CorrelationPlaybook.actionsFor(CorrelationType.LATERAL_MOVEMENT))
                .metadata("affectedHosts", new ArrayList<>(hosts))
                .metadata("eventType", type.displayName())
                .detectedAt(now)
                .build();
    }

    public Duration getBucketWidth() {
        return bucketWidth;
    }

    @Override
    public String getName() {
        return "lateral-movement";
    }
}
