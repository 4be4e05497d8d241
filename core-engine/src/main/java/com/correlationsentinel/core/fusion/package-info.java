/**
 * Score fusion: turns signal scores plus an optional detector finding into
 * the finding reported for an event.
 */
package com.correlationsentinel.core.fusion;
