/**
 * Current-versus-baseline comparison of aggregate metrics, with the
 * per-metric alert thresholds of the {@link com.driftguard.core.comparison.ThresholdTable}.
 */
package com.driftguard.core.comparison;
