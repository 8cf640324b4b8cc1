/**
 * Apache Flink deployment of DriftGuard.
 *
 * <p>
 * This package wires the core enrichment pipeline into a Flink job that
 * consumes LLM interaction records from Kafka, enriches them per
 * {@code model_id}, and publishes the enriched records back to Kafka. A
 * companion batch entry point rebuilds the baseline table the streaming job
 * reads.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.driftguard.flink.DriftGuardJob}: streaming entry point</li>
 * <li>{@link com.driftguard.flink.EnrichmentProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.driftguard.flink.JobConfig}: environment-driven deployment
 * settings</li>
 * <li>{@link com.driftguard.flink.BaselineRecomputeJob}: baseline table
 * rebuild</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftguard.flink;
