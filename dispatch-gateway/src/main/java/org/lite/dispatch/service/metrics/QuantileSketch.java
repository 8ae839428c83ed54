package org.lite.dispatch.service.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mergeable quantile sketch with logarithmically sized bins.
 *
 * <p>A positive value {@code v} is counted in bin {@code ceil(log(v) / log(gamma))} where
 * {@code gamma = (1 + a) / (1 - a)} for relative accuracy {@code a}. Every value in a bin lies
 * within a factor {@code gamma} of the bin's lower bound, so reporting the bin midpoint
 * {@code 2 * gamma^i / (gamma + 1)} is off by at most {@code a} relative to any value of that bin.
 * Quantile queries therefore return a value within relative error {@code a} of the exact
 * nearest-rank quantile. Merging two sketches adds bin counts and keeps the same guarantee, which
 * is what lets minute buckets roll into hours and days without the raw samples.
 *
 * <p>Values at or below {@link #MIN_INDEXABLE} (including zero and negatives) share a single zero
 * bin and are reported as 0. Not thread-safe.
 */
public class QuantileSketch {

    public static final double DEFAULT_RELATIVE_ACCURACY = 0.01;
    static final double MIN_INDEXABLE = 1e-9;

    private final double relativeAccuracy;
    private final double gamma;
    private final double logGamma;
    private final TreeMap<Integer, Long> bins = new TreeMap<>();
    private long zeroCount;
    private long count;

    public QuantileSketch() {
        this(DEFAULT_RELATIVE_ACCURACY);
    }

    public QuantileSketch(double relativeAccuracy) {
        if (relativeAccuracy <= 0 || relativeAccuracy >= 1) {
            throw new IllegalArgumentException("relativeAccuracy must be in (0, 1): " + relativeAccuracy);
        }
        this.relativeAccuracy = relativeAccuracy;
        this.gamma = (1 + relativeAccuracy) / (1 - relativeAccuracy);
        this.logGamma = Math.log(gamma);
    }

    public static QuantileSketch fromBins(double relativeAccuracy, List<Integer> indexes, List<Long> counts,
                                          long zeroCount) {
        QuantileSketch sketch = new QuantileSketch(relativeAccuracy);
        if (indexes != null && counts != null) {
            if (indexes.size() != counts.size()) {
                throw new IllegalArgumentException("Sketch index and count lists differ in size");
            }
            for (int i = 0; i < indexes.size(); i++) {
                sketch.addToBin(indexes.get(i), counts.get(i));
            }
        }
        sketch.zeroCount += zeroCount;
        sketch.count += zeroCount;
        return sketch;
    }

    public void add(double value) {
        if (Double.isNaN(value)) {
            return;
        }
        if (value <= MIN_INDEXABLE) {
            zeroCount++;
            count++;
            return;
        }
        addToBin(index(value), 1);
    }

    public void merge(QuantileSketch other) {
        if (Math.abs(other.relativeAccuracy - relativeAccuracy) > 1e-12) {
            throw new IllegalArgumentException("Cannot merge sketches with different accuracy");
        }
        for (Map.Entry<Integer, Long> bin : other.bins.entrySet()) {
            addToBin(bin.getKey(), bin.getValue());
        }
        zeroCount += other.zeroCount;
        count += other.zeroCount;
    }

    /**
     * Nearest-rank quantile estimate for {@code q} in [0, 1]; NaN when empty.
     */
    public double quantile(double q) {
        if (count == 0) {
            return Double.NaN;
        }
        long rank = Percentiles.nearestRank(q, count);
        long seen = zeroCount;
        if (seen >= rank) {
            return 0.0;
        }
        for (Map.Entry<Integer, Long> bin : bins.entrySet()) {
            seen += bin.getValue();
            if (seen >= rank) {
                return value(bin.getKey());
            }
        }
        return value(bins.lastKey());
    }

    public long getCount() {
        return count;
    }

    public long getZeroCount() {
        return zeroCount;
    }

    public double getRelativeAccuracy() {
        return relativeAccuracy;
    }

    public List<Integer> indexes() {
        return new ArrayList<>(bins.keySet());
    }

    public List<Long> counts() {
        return new ArrayList<>(bins.values());
    }

    int index(double value) {
        return (int) Math.ceil(Math.log(value) / logGamma);
    }

    double value(int index) {
        return 2 * Math.pow(gamma, index) / (gamma + 1);
    }

    private void addToBin(int index, long n) {
        if (n <= 0) {
            return;
        }
        bins.merge(index, n, Long::sum);
        count += n;
    }
}
