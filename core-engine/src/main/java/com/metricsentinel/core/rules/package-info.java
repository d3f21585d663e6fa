/**
 * Alert rule evaluation.
 *
 * <p>
 * {@link com.metricsentinel.core.rules.RuleEngine} compiles validated
 * {@link com.metricsentinel.core.config.AlertRule}s into scope filters and
 * {@link com.metricsentinel.core.rules.RuleCondition}s and evaluates them
 * against {@link com.metricsentinel.core.rules.AnomalyTrigger}s and
 * {@link com.metricsentinel.core.rules.MetricTrigger}s.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.rules;
