package com.driftguard.core.anomaly;

import com.driftguard.core.config.AnomalySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the {@link AnomalyStrategy} instances for a configured
 * {@link AnomalyMethod}.
 *
 * <p>
 * This is the single point of extension when adding a detection method:
 * register the new {@link AnomalyMethod} constant here.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyStrategyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyStrategyFactory.class);

    private AnomalyStrategyFactory() {
    }

    /**
     * @param method   the method
     * @param settings settings supplying method parameters
     * @return unmodifiable list of strategies; several for {@link AnomalyMethod#ALL}
     */
    public static List<AnomalyStrategy> create(AnomalyMethod method, AnomalySettings settings) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        List<AnomalyStrategy> strategies = switch (method) {
            case ZSCORE -> List.of(new ZScoreStrategy());
            case IQR -> List.of(new IqrStrategy(settings.getIqrMultiplier()));
            case ISOLATION -> List.of(new IsolationStrategy());
            case TREND -> List.of(new TrendStrategy(settings.getTrendWindow()));
            case ALL -> List.of(
                    new ZScoreStrategy(),
                    new IqrStrategy(settings.getIqrMultiplier()),
                    new IsolationStrategy(),
                    new TrendStrategy(settings.getTrendWindow()));
        };
        LOG.info("Created {} anomaly strategy(ies) for method '{}'", strategies.size(), method.label());
        return strategies;
    }

    /**
     * @param settings validated settings
     * @return strategies for {@code settings.getMethod()}
     */
    public static List<AnomalyStrategy> create(AnomalySettings settings) {
        return create(settings.anomalyMethod(), settings);
    }
}
