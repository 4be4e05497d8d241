package com.correlationsentinel.core.serialization;

import com.correlationsentinel.core.model.Correlation;
import com.correlationsentinel.core.model.RawEvent;
import com.correlationsentinel.core.model.SecurityFinding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON codec for the engine's wire shapes.
 *
 * <ul>
 * <li>{@link Correlation} and {@link SecurityFinding} → JSON bytes for
 * downstream alerting; instants and durations as ISO-8601 strings, risk
 * levels in lowercase</li>
 * <li>JSON bytes → {@link RawEvent} for ingestion; unknown fields are
 * ignored</li>
 * </ul>
 *
 * <p>
 * Failures never propagate: a value that cannot be written yields an empty
 * byte array, a malformed event is logged and dropped.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationJsonCodec {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationJsonCodec.class);

    private final ObjectMapper mapper;

    public CorrelationJsonCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] serialize(Correlation correlation) {
        try {
            return mapper.writeValueAsBytes(correlation);
        } catch (Exception e) {
            LOG.error("Failed to serialize correlation: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    public byte[] serialize(SecurityFinding finding) {
        try {
            return mapper.writeValueAsBytes(finding);
        } catch (Exception e) {
            LOG.error("Failed to serialize finding: {}", e.getMessage(), e);
            return new byte[0];
        }
    }

    /**
     * @return the correlation as a JSON string
     * @throws IllegalStateException if the correlation cannot be written
     */
    public String toJson(Correlation correlation) {
        try {
            return mapper.writeValueAsString(correlation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize correlation " + correlation.getId(), e);
        }
    }

    /**
     * Decode a raw event.
     *
     * @param message JSON bytes
     * @return the event, or empty for a missing or malformed message
     */
    public Optional<RawEvent> readEvent(byte[] message) {
        if (message == null || message.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(message, RawEvent.class));
        } catch (IOException e) {
            LOG.warn("Failed to deserialize event, skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
