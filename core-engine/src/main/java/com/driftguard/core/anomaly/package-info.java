/**
 * Statistical anomaly detection over numeric record fields. Each method is an
 * {@link com.driftguard.core.anomaly.AnomalyStrategy}; the
 * {@link com.driftguard.core.anomaly.AnomalyEngine} owns the per-model rolling
 * windows and combines the strategies' results.
 */
package com.driftguard.core.anomaly;
