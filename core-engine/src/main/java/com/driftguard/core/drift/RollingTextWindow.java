package com.driftguard.core.drift;

import java.util.Arrays;
import java.util.Optional;

/**
 * The most recent embeddings of one model with an incrementally maintained
 * centroid.
 *
 * <p>
 * Adding an embedding and reading the centroid both cost O(dimension),
 * independent of the window size. The running sum is rebuilt from the buffer
 * once per full rotation to stop rounding error from accumulating.
 * </p>
 *
 * <p>
 * Not thread-safe: each window has a single writer.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollingTextWindow {

    private final RingBuffer<double[]> buffer;
    private final double[] sum;
    private long evictions;

    public RollingTextWindow(int capacity, int dimension) {
        this.buffer = new RingBuffer<>(capacity);
        this.sum = new double[dimension];
    }

    public void add(double[] embedding) {
        if (embedding.length != sum.length) {
            throw new IllegalArgumentException("Embedding dimension " + embedding.length
                    + " does not match window dimension " + sum.length);
        }
        double[] copy = embedding.clone();
        double[] evicted = buffer.add(copy);
        for (int i = 0; i < sum.length; i++) {
            sum[i] += copy[i];
        }
        if (evicted != null) {
            for (int i = 0; i < sum.length; i++) {
                sum[i] -= evicted[i];
            }
            if (++evictions % buffer.capacity() == 0) {
                rebuildSum();
            }
        }
    }

    private void rebuildSum() {
        Arrays.fill(sum, 0.0);
        for (double[] v : buffer.toList()) {
            for (int i = 0; i < sum.length; i++) {
                sum[i] += v[i];
            }
        }
    }

    /**
     * @return the mean of the buffered embeddings, or empty if none
     */
    public Optional<double[]> centroid() {
        int n = buffer.size();
        if (n == 0) {
            return Optional.empty();
        }
        double[] c = new double[sum.length];
        for (int i = 0; i < c.length; i++) {
            c[i] = sum[i] / n;
        }
        return Optional.of(c);
    }

    public int size() {
        return buffer.size();
    }

    public int capacity() {
        return buffer.capacity();
    }
}
