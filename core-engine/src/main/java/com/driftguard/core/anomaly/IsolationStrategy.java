package com.driftguard.core.anomaly;

import com.driftguard.core.model.FieldAnomaly;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multivariate test: the root mean square of the standardised distances of
 * all selected fields that have a reference. Catches records that are
 * moderately unusual on several fields at once. Reported under the
 * pseudo-field {@value #FIELD}.
 *
 * @since 1.0.0
 */
public class IsolationStrategy implements AnomalyStrategy {

    public static final String NAME = "isolation";
    public static final String FIELD = "multivariate";

    @Override
    public List<FieldAnomaly> evaluate(AnomalyContext context) {
        Map<String, Object> distances = new LinkedHashMap<>();
        double sumSq = 0;
        int n = 0;
        for (Map.Entry<String, Double> entry : context.getValues().entrySet()) {
            Optional<AnomalyContext.Reference> ref = context.reference(entry.getKey());
            if (ref.isEmpty()) {
                continue;
            }
            double d = ref.get().standardize(entry.getValue());
            distances.put(entry.getKey(), d);
            sumSq += d * d;
            n++;
        }
        if (n == 0) {
            return List.of();
        }
        double score = Math.min(ZERO_SPREAD_SCORE, Math.sqrt(sumSq / n));
        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("fields", n);
        analysis.put("distances", distances);
        return List.of(new FieldAnomaly(FIELD, NAME, score > context.getThreshold(), score, analysis));
    }

    @Override
    public String getMethodName() {
        return NAME;
    }
}
