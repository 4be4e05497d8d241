/**
 * Per-event signal scoring over the streaming history: correlation, burst
 * and anomaly, each in {@code [0, 1]}.
 */
package com.correlationsentinel.core.signal;
