package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Default {@link CorrelationStrategy}: never detects anything and ignores
 * training input.
 */
public final class NoOpCorrelationStrategy implements CorrelationStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(NoOpCorrelationStrategy.class);

    @Override
    public Optional<Correlation> detect(SecurityEvent event, List<SecurityEvent> recent, Instant now) {
        return Optional.empty();
    }

    @Override
    public void train(List<Correlation> confirmed) {
        LOG.info("No trainable correlation strategy configured; ignoring {} confirmed correlation(s)",
                confirmed.size());
    }
}
