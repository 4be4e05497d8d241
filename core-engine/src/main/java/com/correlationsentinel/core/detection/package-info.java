/**
 * Batch pattern detection over explicit event snapshots.
 *
 * <p>
 * All detectors implement the
 * {@link com.correlationsentinel.core.detection.BatchDetector} interface and
 * are run in order by
 * {@link com.correlationsentinel.core.detection.BatchAnalyzer}:
 * </p>
 * <ul>
 * <li>{@link com.correlationsentinel.core.detection.TemporalBurstDetector}:
 * many events from one host inside a window</li>
 * <li>{@link com.correlationsentinel.core.detection.AttackChainDetector}:
 * ordered multi-stage attack patterns</li>
 * <li>{@link com.correlationsentinel.core.detection.LateralMovementDetector}:
 * the same access type on several hosts in one time bucket</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a detector, implement {@code BatchDetector} and pass it to the
 * {@code BatchAnalyzer} stage list.
 * </p>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.detection;
