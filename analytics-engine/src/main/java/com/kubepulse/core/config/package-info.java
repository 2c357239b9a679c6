/**
 * Configuration loading and validation for the analytics engines.
 *
 * <p>
 * Detector settings and SLO definitions are read from YAML by
 * {@link com.kubepulse.core.config.AnalyticsConfigLoader} into an
 * {@link com.kubepulse.core.config.AnalyticsConfig}. Validation runs
 * automatically after parsing so bad configuration fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.kubepulse.core.config;
