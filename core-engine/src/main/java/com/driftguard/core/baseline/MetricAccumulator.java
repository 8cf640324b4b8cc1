package com.driftguard.core.baseline;

/**
 * Single-pass mean and sample standard deviation (Welford's algorithm).
 *
 * @since 1.0.0
 */
final class MetricAccumulator {

    private long count;
    private double mean;
    private double m2;

    void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    long count() {
        return count;
    }

    /**
     * @return the mean, or {@code null} without samples
     */
    Double mean() {
        return count == 0 ? null : mean;
    }

    /**
     * @return the sample standard deviation; {@code 0.0} for a single sample
     *         and {@code null} without samples
     */
    Double sampleStdDev() {
        if (count == 0) {
            return null;
        }
        if (count == 1) {
            return 0.0;
        }
        return Math.sqrt(Math.max(0.0, m2 / (count - 1)));
    }
}
