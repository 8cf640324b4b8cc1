package com.driftguard.core.anomaly;

/**
 * Fixed-capacity window of the most recent values of one numeric field.
 *
 * <p>
 * Mean and sample standard deviation come from running sums maintained on
 * every append and eviction, so reading them costs O(1). The sums are kept
 * relative to a shift value and rebuilt from the buffer once per full
 * rotation, re-anchoring the shift on the oldest value. This bounds rounding
 * error, and a window that has held identical values since the last rebuild
 * reports exactly zero spread.
 * </p>
 *
 * <p>
 * Not thread-safe: each window has a single writer.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingStats {

    private final double[] values;
    private int head;
    private int size;

    private double shift;
    private double sum;
    private double sumSq;
    private long evictions;

    public RollingStats(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.values = new double[capacity];
    }

    /**
     * Append {@code value}, evicting the oldest value when full.
     */
    public void add(double value) {
        if (size == 0) {
            shift = value;
        }
        int tail = (head + size) % values.length;
        boolean full = size == values.length;
        if (full) {
            double e = values[head] - shift;
            sum -= e;
            sumSq -= e * e;
            head = (head + 1) % values.length;
        } else {
            size++;
        }
        values[tail] = value;
        double d = value - shift;
        sum += d;
        sumSq += d * d;
        if (full && ++evictions % values.length == 0) {
            rebuild();
        }
    }

    private void rebuild() {
        shift = values[head];
        sum = 0;
        sumSq = 0;
        for (int i = 0; i < size; i++) {
            double d = values[(head + i) % values.length] - shift;
            sum += d;
            sumSq += d * d;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    /**
     * @return the buffered values from oldest to newest
     */
    public double[] values() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = values[(head + i) % values.length];
        }
        return out;
    }

    /**
     * @return the newest {@code n} values (fewer if not available), oldest first
     */
    public double[] last(int n) {
        int count = Math.min(Math.max(n, 0), size);
        double[] out = new double[count];
        for (int i = 0; i < count; i++) {
            out[i] = values[(head + size - count + i) % values.length];
        }
        return out;
    }

    public double mean() {
        if (size == 0) {
            return Double.NaN;
        }
        return shift + sum / size;
    }

    /**
     * @return the sample standard deviation; {@code 0} with fewer than two
     *         values
     */
    public double sampleStdDev() {
        if (size < 2) {
            return 0.0;
        }
        double variance = (sumSq - sum * sum / size) / (size - 1);
        return Math.sqrt(Math.max(0.0, variance));
    }
}
