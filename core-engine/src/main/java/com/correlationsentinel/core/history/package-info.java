/**
 * Streaming event history.
 *
 * <p>
 * {@link com.correlationsentinel.core.history.EventHistoryStore} keeps the
 * recent events of each
 * {@link com.correlationsentinel.core.history.HistoryKey} for the signal
 * calculators and the rule matcher. State is in memory only.
 * </p>
 */
package com.correlationsentinel.core.history;
