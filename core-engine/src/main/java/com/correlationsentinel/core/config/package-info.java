/**
 * Engine tuning: correlation and batch windows, fusion thresholds, history
 * sweep and schedules, held in
 * {@link com.correlationsentinel.core.config.EngineConfig} and resolved from
 * environment variables.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.config;
