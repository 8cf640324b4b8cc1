/**
 * Semantic drift detection against stored reference texts or a rolling
 * per-model window.
 */
package com.driftguard.core.drift;
