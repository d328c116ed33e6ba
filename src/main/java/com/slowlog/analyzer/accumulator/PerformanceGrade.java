package com.slowlog.analyzer.accumulator;

import java.util.Arrays;

/**
 * Coarse rating of a query time. With the default thresholds: EXCELLENT below 1s, GOOD below 5s, AVERAGE below
 * 10s, POOR below 30s, VERY_POOR otherwise.
 */
public enum PerformanceGrade {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    AVERAGE("Average"),
    POOR("Poor"),
    VERY_POOR("Very poor");

    private static final double[] DEFAULT_THRESHOLDS = { 1, 5, 10, 30 };

    private final String label;

    PerformanceGrade(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static PerformanceGrade classify(double seconds) {
        return classify(seconds, DEFAULT_THRESHOLDS);
    }

    /**
     * @param thresholds four ascending upper bounds, exclusive, for EXCELLENT through POOR
     */
    public static PerformanceGrade classify(double seconds, double[] thresholds) {
        if (thresholds == null || thresholds.length != 4) {
            throw new IllegalArgumentException("Expected 4 grade thresholds, got " + Arrays.toString(thresholds));
        }
        PerformanceGrade[] grades = values();
        for (int i = 0; i < thresholds.length; i++) {
            if (seconds < thresholds[i]) {
                return grades[i];
            }
        }
        return VERY_POOR;
    }
}
