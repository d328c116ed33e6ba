package com.slowlog.analyzer.accumulator;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class PerformanceGradeTest {

    @Test
    public void testDefaultThresholds() {
        assertEquals(PerformanceGrade.EXCELLENT, PerformanceGrade.classify(0.99));
        assertEquals(PerformanceGrade.GOOD, PerformanceGrade.classify(1.0));
        assertEquals(PerformanceGrade.AVERAGE, PerformanceGrade.classify(5.0));
        assertEquals(PerformanceGrade.POOR, PerformanceGrade.classify(10.0));
        assertEquals(PerformanceGrade.VERY_POOR, PerformanceGrade.classify(30.0));
    }

    @Test
    public void testCustomThresholds() {
        double[] thresholds = { 0.1, 0.5, 1, 2 };
        assertEquals(PerformanceGrade.GOOD, PerformanceGrade.classify(0.2, thresholds));
        assertEquals(PerformanceGrade.VERY_POOR, PerformanceGrade.classify(2.5, thresholds));
    }

    @Test
    public void testWrongThresholdCount() {
        assertThrows(IllegalArgumentException.class, () -> PerformanceGrade.classify(1, new double[] { 1, 2 }));
        assertEquals("Very poor", PerformanceGrade.VERY_POOR.getLabel());
    }
}
