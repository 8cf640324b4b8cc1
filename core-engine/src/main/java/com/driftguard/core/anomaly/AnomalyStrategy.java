package com.driftguard.core.anomaly;

import com.driftguard.core.model.FieldAnomaly;

import java.util.List;

/**
 * Contract for anomaly detection methods.
 *
 * <p>
 * Strategies are stateless: all history arrives through the
 * {@link AnomalyContext}, so one instance serves every model and field.
 * Each evaluation yields a comparable {@code (anomalous, score)} pair in a
 * {@link FieldAnomaly}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyStrategy {

    /**
     * Score returned when a value differs from a reference with zero spread.
     * Large enough to exceed any valid threshold.
     */
    double ZERO_SPREAD_SCORE = 1_000_000.0;

    /**
     * @param context the record's values and history
     * @return one evaluation per field the method could score; fields lacking
     *         the required history are left out
     */
    List<FieldAnomaly> evaluate(AnomalyContext context);

    /**
     * @return the method label used in anomaly tags
     */
    String getMethodName();

    /**
     * {@code |value - center| / spread}; with zero spread the distance is
     * {@code 0} for {@code value == center} and {@link #ZERO_SPREAD_SCORE}
     * otherwise.
     */
    static double standardizedDistance(double value, double center, double spread) {
        if (spread <= 0) {
            return value == center ? 0.0 : ZERO_SPREAD_SCORE;
        }
        return Math.min(ZERO_SPREAD_SCORE, Math.abs(value - center) / spread);
    }
}
