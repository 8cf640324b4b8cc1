/**
 * Domain model classes for LLM DriftGuard.
 *
 * <ul>
 * <li>{@link com.driftguard.core.model.LlmEvent}: an ingested interaction
 * record, never mutated</li>
 * <li>{@link com.driftguard.core.model.EnrichedRecord}: an event plus the
 * result fields attached by the detection stages</li>
 * <li>{@link com.driftguard.core.model.BaselineRecord} and
 * {@link com.driftguard.core.model.ThresholdRecord}: rows of the baseline and
 * threshold tables</li>
 * <li>result types for drift, similarity, anomalies and baseline
 * comparison</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftguard.core.model;
