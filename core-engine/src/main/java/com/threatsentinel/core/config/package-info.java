/**
 * Configuration loading and validation.
 *
 * <p>
 * Detection rules are defined in YAML and loaded by
 * {@link com.threatsentinel.core.config.RulesLoader} into a
 * {@link com.threatsentinel.core.config.RulesConfig} instance; validation
 * runs automatically after parsing. Runtime tunables come from the
 * environment through {@link com.threatsentinel.core.config.SentinelSettings}.
 * </p>
 *
 * @since 1.0.0
 */
package com.threatsentinel.core.config;
