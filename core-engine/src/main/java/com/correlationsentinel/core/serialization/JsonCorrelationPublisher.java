package com.correlationsentinel.core.serialization;

import com.correlationsentinel.core.engine.CorrelationListener;
import com.correlationsentinel.core.model.Correlation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link CorrelationListener} that encodes each correlation as JSON and hands
 * the bytes to a downstream sink, such as a message-queue producer.
 *
 * <p>
 * Correlations that fail to encode are dropped after the codec has logged
 * the failure.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonCorrelationPublisher implements CorrelationListener {

    private static final Logger LOG = LoggerFactory.getLogger(JsonCorrelationPublisher.class);

    private final CorrelationJsonCodec codec;
    private final Consumer<byte[]> sink;

    public JsonCorrelationPublisher(Consumer<byte[]> sink) {
        this(new CorrelationJsonCodec(), sink);
    }

    public JsonCorrelationPublisher(CorrelationJsonCodec codec, Consumer<byte[]> sink) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    @Override
    public void onCorrelation(Correlation correlation) {
        byte[] payload = codec.serialize(correlation);
        if (payload.length == 0) {
            return;
        }
        sink.accept(payload);
        LOG.debug("Published correlation {} ({} bytes)", correlation.getId(), payload.length);
    }
}
