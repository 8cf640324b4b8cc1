package com.driftguard.core.anomaly;

import com.driftguard.core.model.FieldAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Z-score test per field: {@code |x - mean| / stdDev} against the model's
 * baseline or, without one, the rolling window. Flagged when the score
 * exceeds the threshold.
 *
 * @since 1.0.0
 */
public class ZScoreStrategy implements AnomalyStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreStrategy.class);

    public static final String NAME = "zscore";

    @Override
    public List<FieldAnomaly> evaluate(AnomalyContext context) {
        List<FieldAnomaly> results = new ArrayList<>();
        context.getValues().forEach((field, value) -> {
            Optional<AnomalyContext.Reference> ref = context.reference(field);
            if (ref.isEmpty()) {
                LOG.trace("No reference for field '{}' of model '{}' yet - skipping", field,
                        context.getModelId());
                return;
            }
            AnomalyContext.Reference reference = ref.get();
            double score = reference.standardize(value);
            boolean anomalous = score > context.getThreshold();

            Map<String, Object> analysis = new LinkedHashMap<>();
            analysis.put("value", value);
            analysis.put("mean", reference.getMean());
            analysis.put("std", reference.getStdDev());
            analysis.put("z_score", score);
            analysis.put("reference", reference.getSource());
            results.add(new FieldAnomaly(field, NAME, anomalous, score, analysis));
        });
        return results;
    }

    @Override
    public String getMethodName() {
        return NAME;
    }
}
