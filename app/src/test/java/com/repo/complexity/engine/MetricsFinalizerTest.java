package com.repo.complexity.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsFinalizerTest {

    @Test
    void testMaintainabilityFormula() {
        double mi = MetricsFinalizer.maintainabilityIndex(100, 4, 20, false);

        double expected = 171 - 3.42 * Math.log(100) - 0.23 * Math.log(4) - 16.2 * Math.log(20);
        assertEquals(expected, mi, 1e-9);
    }

    @Test
    void testCeilingWhenEffortOrLocIsZero() {
        assertEquals(171.0, MetricsFinalizer.maintainabilityIndex(0, 3, 10, false), 1e-9);
        assertEquals(171.0, MetricsFinalizer.maintainabilityIndex(50, 3, 0, false), 1e-9);
    }

    @Test
    void testRescaleClampsAtZero() {
        double raw = MetricsFinalizer.maintainabilityIndex(1e9, 50, 5000, false);
        assertTrue(raw < 0);

        assertEquals(0.0, MetricsFinalizer.maintainabilityIndex(1e9, 50, 5000, true), 1e-9);
        assertEquals(100.0, MetricsFinalizer.maintainabilityIndex(0, 1, 0, true), 1e-9);

        double rescaled = MetricsFinalizer.maintainabilityIndex(100, 4, 20, true);
        double expectedRaw = MetricsFinalizer.maintainabilityIndex(100, 4, 20, false);
        assertEquals(expectedRaw * 100 / 171, rescaled, 1e-9);
        assertTrue(rescaled >= 0 && rescaled <= 100);
    }

    @Test
    void testZeroComplexityIsRejected() {
        assertThrows(IllegalStateException.class, () -> MetricsFinalizer.maintainabilityIndex(10, 0, 10, false));
    }
}
