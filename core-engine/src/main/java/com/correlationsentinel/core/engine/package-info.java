/**
 * The correlation engine façade and its extension points.
 *
 * <p>
 * {@link com.correlationsentinel.core.engine.CorrelationEngine} wires the
 * history, signals, rules, fusion, batch detectors and store together.
 * Hosts plug in a {@link com.correlationsentinel.core.engine.CorrelationStrategy},
 * an {@link com.correlationsentinel.core.engine.EventSource} for periodic
 * batch runs and {@link com.correlationsentinel.core.engine.CorrelationListener}s
 * for downstream delivery.
 * </p>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.engine;
