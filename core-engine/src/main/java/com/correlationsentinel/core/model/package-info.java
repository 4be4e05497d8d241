/**
 * Domain model classes for Correlation Sentinel.
 *
 * <ul>
 * <li>{@link com.correlationsentinel.core.model.RawEvent} — observed log
 * entry</li>
 * <li>{@link com.correlationsentinel.core.model.SecurityFinding} — per-event
 * classification, before or after score fusion</li>
 * <li>{@link com.correlationsentinel.core.model.SecurityEvent} — raw event plus
 * its classification</li>
 * <li>{@link com.correlationsentinel.core.model.Correlation} — detected
 * multi-event pattern</li>
 * <li>{@link com.correlationsentinel.core.model.RuleDefinition} — correlation
 * rule configuration POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.model;
