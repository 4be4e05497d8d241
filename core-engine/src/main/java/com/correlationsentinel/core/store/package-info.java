/**
 * In-memory storage of detected correlations.
 */
package com.correlationsentinel.core.store;
