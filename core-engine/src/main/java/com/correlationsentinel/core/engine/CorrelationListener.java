package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.model.Correlation;

/**
 * Callback for every correlation the engine stores, from both the streaming
 * and the batch path.
 *
 * <p>
 * Called synchronously on the analysing thread; implementations should hand
 * work off rather than block.
 * </p>
 */
@FunctionalInterface
public interface CorrelationListener {

    void onCorrelation(Correlation correlation);
}
