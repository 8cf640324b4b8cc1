/**
 * YAML-backed configuration: {@link com.driftguard.core.config.DriftGuardConfig}
 * with one settings section per detection stage, loaded and validated by
 * {@link com.driftguard.core.config.ConfigLoader}.
 */
package com.driftguard.core.config;
