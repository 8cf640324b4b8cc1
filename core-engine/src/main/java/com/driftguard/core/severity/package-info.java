/**
 * Severity banding shared by every detector.
 *
 * <p>
 * {@link com.driftguard.core.severity.SeverityBands} turns an ordered list of
 * cutpoints into a total partition of the score axis; the enums in this package
 * are its fixed instantiations for drift, anomalies, baseline comparison and
 * similarity.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftguard.core.severity;
