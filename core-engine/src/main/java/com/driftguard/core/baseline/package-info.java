/**
 * Per-model baselines: the immutable {@link com.driftguard.core.baseline.BaselineSnapshot},
 * the {@link com.driftguard.core.baseline.BaselineStore} that swaps snapshots
 * atomically, their persistent repositories, and the
 * {@link com.driftguard.core.baseline.BaselineCalculator} that recomputes them.
 */
package com.driftguard.core.baseline;
