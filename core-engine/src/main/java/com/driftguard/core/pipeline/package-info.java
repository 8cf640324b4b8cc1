/**
 * Batch orchestration: {@link com.driftguard.core.pipeline.DriftGuardPipeline}
 * validates records, runs the enabled stages and summarises each batch.
 */
package com.driftguard.core.pipeline;
