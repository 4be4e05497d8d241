package com.correlationsentinel.core.detection;

import com.correlationsentinel.core.model.AttackChain;
import com.correlationsentinel.core.model.AttackStage;
import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.RiskLevel;
import com.correlationsentinel.core.model.SecurityEvent;
import com.correlationsentinel.core.model.SecurityEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.correlationsentinel.core.model.SecurityEventType.AUTHENTICATION_FAILURE;
import static com.correlationsentinel.core.model.SecurityEventType.AUTHENTICATION_SUCCESS;
import static com.correlationsentinel.core.model.SecurityEventType.DATA_ACCESS;
import static com.correlationsentinel.core.model.SecurityEventType.DATA_EXFILTRATION;
import static com.correlationsentinel.core.model.SecurityEventType.NETWORK_CONNECTION;
import static com.correlationsentinel.core.model.SecurityEventType.PRIVILEGE_ESCALATION;
import static com.correlationsentinel.core.model.SecurityEventType.PROCESS_CREATION;
import static com.correlationsentinel.core.model.SecurityEventType.REGISTRY_MODIFICATION;
import static com.correlationsentinel.core.model.SecurityEventType.SERVICE_MODIFICATION;

/**
 * Matches time-ordered events against fixed multi-stage attack patterns.
 *
 * <h3>Matching</h3>
 * <p>
 * For each pattern the sorted batch is scanned once. An event whose type
 * equals the next expected stage advances the chain; the first stage also
 * fixes the chain start. When an advancing event lies more than
 * {@code window} after the chain start, progress is discarded and that event
 * becomes stage 1 of a new candidate, starting a new window. The first
 * completed chain per pattern is reported.
 * </p>
 *
 * <h3>Labels</h3>
 * <ul>
 * <li>authentication failure and success: {@value #BRUTE_FORCE}</li>
 * <li>process creation and network connection: Remote Execution</li>
 * <li>privilege escalation: Privilege Escalation</li>
 * <li>data exfiltration: Data Exfiltration</li>
 * <li>otherwise: Unknown</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AttackChainDetector implements BatchDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AttackChainDetector.class);

    static final double CHAIN_CONFIDENCE = 0.85;
    static final String BRUTE_FORCE = "Brute Force Attack";

    /** Built-in patterns, evaluated in this order. */
    public static final List<List<SecurityEventType>> DEFAULT_PATTERNS = List.of(
            List.of(AUTHENTICATION_FAILURE, PRIVILEGE_ESCALATION, DATA_ACCESS),
            List.of(PROCESS_CREATION, NETWORK_CONNECTION, DATA_EXFILTRATION),
            List.of(SERVICE_MODIFICATION, REGISTRY_MODIFICATION, PROCESS_CREATION),
            List.of(AUTHENTICATION_FAILURE, AUTHENTICATION_FAILURE, AUTHENTICATION_SUCCESS));

    private final List<List<SecurityEventType>> patterns;

    public AttackChainDetector() {
        this(DEFAULT_PATTERNS);
    }

    /**
     * @param patterns ordered stage lists; each must be non-empty
     * @throws IllegalArgumentException if a pattern is empty
     */
    public AttackChainDetector(List<List<SecurityEventType>> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        List<List<SecurityEventType>> copies = new ArrayList<>();
        for (List<SecurityEventType> pattern : patterns) {
            if (pattern == null || pattern.isEmpty()) {
                throw new IllegalArgumentException("Attack chain pattern must have at least one stage");
            }
            copies.add(List.copyOf(pattern));
        }
        this.patterns = List.copyOf(copies);
    }

    @Override
    public List<Correlation> detect(List<SecurityEvent> events, Duration window, Instant now) {
        return findChains(events, window).stream()
                .map(chain -> AttackChainConverter.toCorrelation(chain, now))
                .collect(Collectors.toList());
    }

    /**
     * Run every pattern against the batch.
     *
     * @return at most one chain per pattern, in pattern order
     */
    public List<AttackChain> findChains(List<SecurityEvent> events, Duration window) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(window, "window must not be null");
        if (events.isEmpty()) {
            return List.of();
        }

        List<SecurityEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(SecurityEvent::getTimestamp));
        List<String> affectedHosts = sorted.stream()
                .map(SecurityEvent::getHost)
                .distinct()
                .collect(Collectors.toList());

        List<AttackChain> chains = new ArrayList<>();
        for (List<SecurityEventType> pattern : patterns) {
            match(sorted, pattern, window, affectedHosts).ifPresent(chain -> {
                LOG.info("Attack chain detected: {} ({} stages)", chain.getName(), chain.getStages().size());
                chains.add(chain);
            });
        }
        return chains;
    }

    private static Optional<AttackChain> match(List<SecurityEvent> sorted, List<SecurityEventType> pattern,
            Duration window, List<String> affectedHosts) {
        List<AttackStage> stages = new ArrayList<>();
        Instant chainStart = null;

        for (SecurityEvent event : sorted) {
            if (event.getType() != pattern.get(stages.size())) {
                continue;
            }

            if (chainStart == null) {
                chainStart = event.getTimestamp();
            } else if (Duration.between(chainStart, event.getTimestamp()).compareTo(window) > 0) {
                // stale progress: the current event opens a new candidate as stage 1
                stages.clear();
                chainStart = event.getTimestamp();
            }
            stages.add(new AttackStage(stages.size() + 1, event.getType().displayName(), event.getId(),
                    event.getTimestamp(), event.getSummary(), event.primaryTechnique()));

            if (stages.size() == pattern.size()) {
                return Optional.of(new AttackChain(nameOf(pattern), stages, CHAIN_CONFIDENCE,
                        attackTypeOf(pattern), RiskLevel.HIGH, affectedHosts));
            }
        }
        return Optional.empty();
    }

    static String nameOf(List<SecurityEventType> pattern) {
        return pattern.stream()
                .map(SecurityEventType::displayName)
                .collect(Collectors.joining(" -> "));
    }

    static String attackTypeOf(List<SecurityEventType> pattern) {
        LinkedHashSet<SecurityEventType> types = new LinkedHashSet<>(pattern);
        if (types.contains(AUTHENTICATION_FAILURE) && types.contains(AUTHENTICATION_SUCCESS)) {
            return BRUTE_FORCE;
        }
        if (types.contains(PROCESS_CREATION) && types.contains(NETWORK_CONNECTION)) {
            return "Remote Execution";
        }
        if (types.contains(PRIVILEGE_ESCALATION)) {
            return "Privilege Escalation";
        }
        if (types.contains(DATA_EXFILTRATION)) {
            return "Data Exfiltration";
        }
        return "Unknown";
    }

    public List<List<SecurityEventType>> getPatterns() {
        return patterns;
    }

    @Override
    public String getName() {
        return "attack-chain";
    }
}
