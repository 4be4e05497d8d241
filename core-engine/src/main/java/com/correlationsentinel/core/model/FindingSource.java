package com.correlationsentinel.core.model;

/**
 * How a {@link SecurityFinding} came to be.
 *
 * @since 1.0.0
 */
public enum FindingSource {

    /** Supplied unchanged by an upstream per-event detector. */
    DETECTOR,

    /** A detector finding enhanced with correlation signals. */
    ENHANCED,

    /** Synthesized from correlation signals alone. */
    CORRELATION
}
