/**
 * Derived per-record metrics: heuristic text quality, throughput and optional
 * per-model trends.
 */
package com.driftguard.core.metrics;
