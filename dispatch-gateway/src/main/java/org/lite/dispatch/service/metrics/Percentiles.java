package org.lite.dispatch.service.metrics;

import java.util.Arrays;

/**
 * Exact nearest-rank percentiles over retained samples.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * 1-based rank of quantile {@code q} among {@code n} ordered samples.
     */
    public static long nearestRank(double q, long n) {
        double clamped = Math.min(1.0, Math.max(0.0, q));
        long rank = (long) Math.ceil(clamped * n);
        return Math.max(1, Math.min(n, rank));
    }

    public static double of(double[] sorted, double q) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        return sorted[(int) nearestRank(q, sorted.length) - 1];
    }

    public static double[] sortedCopy(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }
}
