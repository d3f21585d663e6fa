/**
 * Configuration loading and validation for Metric Sentinel.
 *
 * <p>
 * Alert rules and maintenance windows are defined in {@code rules.yml} and
 * loaded by {@link com.metricsentinel.core.config.RulesLoader} into a
 * {@link com.metricsentinel.core.config.RuleSet}; detector, fusion and
 * delivery tuning lives in {@code pipeline.yml} and is loaded by
 * {@link com.metricsentinel.core.config.SettingsLoader}. Both loaders
 * validate right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
