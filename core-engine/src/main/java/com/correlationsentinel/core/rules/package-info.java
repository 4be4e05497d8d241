/**
 * Declarative correlation rules.
 *
 * <p>
 * {@link com.correlationsentinel.core.rules.RuleSetLoader} reads rule sets
 * from YAML; {@link com.correlationsentinel.core.rules.RuleCatalog} holds the
 * active rules; {@link com.correlationsentinel.core.rules.RuleMatcher} evaluates
 * them on the streaming path; {@link com.correlationsentinel.core.rules.CorrelationPlaybook}
 * grades risk and supplies response actions for every correlation producer.
 * </p>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.rules;
