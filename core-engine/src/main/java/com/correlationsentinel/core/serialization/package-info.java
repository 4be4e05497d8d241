/**
 * Jackson-based JSON encoding of correlations and findings, and decoding of
 * raw events.
 */
package com.correlationsentinel.core.serialization;
