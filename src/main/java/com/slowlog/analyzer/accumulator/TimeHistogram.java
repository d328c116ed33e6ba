package com.slowlog.analyzer.accumulator;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query time distribution over half-open buckets {@code [0,b1), [b1,b2), ..., [bn,inf)}.
 */
public class TimeHistogram {

    private final double[] bounds;
    private final long[] counts;

    public TimeHistogram(double[] bounds) {
        this.bounds = bounds.clone();
        this.counts = new long[bounds.length + 1];
    }

    void add(double seconds) {
        counts[bucketOf(seconds)]++;
    }

    public int bucketOf(double seconds) {
        for (int i = 0; i < bounds.length; i++) {
            if (seconds < bounds[i]) {
                return i;
            }
        }
        return bounds.length;
    }

    public double[] getBounds() {
        return bounds.clone();
    }

    public long[] getCounts() {
        return counts.clone();
    }

    public long getCount(int bucket) {
        return counts[bucket];
    }

    public int size() {
        return counts.length;
    }

    public String getLabel(int bucket) {
        if (bucket == bounds.length) {
            return format(bounds[bounds.length - 1]) + "s+";
        }
        double lower = bucket == 0 ? 0 : bounds[bucket - 1];
        return format(lower) + "-" + format(bounds[bucket]) + "s";
    }

    /**
     * Bucket label to count, in bucket order, e.g. "0-1s", "1-10s", ..., "60s+".
     */
    public Map<String, Long> asMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < counts.length; i++) {
            map.put(getLabel(i), counts[i]);
        }
        return map;
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bounds) + Arrays.hashCode(counts);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        TimeHistogram other = (TimeHistogram) obj;
        return Arrays.equals(bounds, other.bounds) && Arrays.equals(counts, other.counts);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
