package com.finance.calc.stats;

import com.finance.calc.api.FinanceErrorKind;
import com.finance.calc.api.FinanceException;
import org.junit.Test;

import java.util.OptionalDouble;

import static com.finance.calc.FinanceAssert.assertFails;
import static com.finance.calc.FinanceAssert.assertInvalid;
import static com.finance.calc.stats.DescriptiveStatistics.*;
import static org.junit.Assert.*;

public class DescriptiveStatisticsTest {

    @Test
    public void testMean() {
        assertEquals(3.0, mean(new double[] { 1, 2, 3, 4, 5 }), 0.0);
        assertEquals(-1.5, mean(new double[] { -1, -2 }), 0.0);
    }

    @Test
    public void testMeanRejectsEmptyAndNonFinite() {
        assertInvalid(() -> mean(new double[0]));
        FinanceException e = assertInvalid(() -> mean(new double[] { 1.0, 2.0, Double.NaN }));
        assertTrue(e.getMessage(), e.getMessage().contains("index 2"));
    }

    @Test
    public void testMedian() {
        assertEquals(3.0, median(new double[] { 1, 2, 3, 4, 5 }), 0.0);
        assertEquals(2.5, median(new double[] { 1, 2, 3, 4 }), 0.0);
        assertEquals(3.0, median(new double[] { 5, 1, 3 }), 0.0);
        assertEquals(7.0, median(new double[] { 7 }), 0.0);
    }

    @Test
    public void testMeanOverflow() {
        assertFails(FinanceErrorKind.OVERFLOW, () -> mean(new double[] { 1e308, 1e308 }));
    }

    @Test
    public void testMedianOfLargeValues() {
        assertEquals(1e308, median(new double[] { 1e308, 1e308 }), 0.0);
    }

    @Test
    public void testMedianDoesNotReorderInput() {
        double[] data = { 5, 1, 4, 2 };
        median(data);
        assertArrayEquals(new double[] { 5, 1, 4, 2 }, data, 0.0);
    }

    @Test
    public void testMedianRejectsNonFiniteBeforeSorting() {
        assertInvalid(() -> median(new double[] { 1.0, Double.POSITIVE_INFINITY, 3.0 }));
        assertInvalid(() -> median(new double[0]));
    }

    @Test
    public void testMode() {
        assertEquals(2.0, mode(new double[] { 1, 2, 2, 3, 4 }).getAsDouble(), 0.0);
        assertEquals(-0.5, mode(new double[] { -0.5, -0.5, 3, 3.25 }).getAsDouble(), 0.0);
    }

    @Test
    public void testModeNoRepeats() {
        assertFalse(mode(new double[] { 1, 2, 3, 4 }).isPresent());
        assertFalse(mode(new double[0]).isPresent());
    }

    @Test
    public void testModeTieReturnsSmallest() {
        OptionalDouble m = mode(new double[] { 3, 3, 1, 1, 2, 2 });
        assertEquals(1.0, m.getAsDouble(), 0.0);
        assertEquals(4.0, mode(new double[] { 9, 9, 4, 4, 7 }).getAsDouble(), 0.0);
    }

    @Test
    public void testModeTolerance() {
        // Within ten decimal digits: merged
        assertEquals(0.3, mode(new double[] { 0.1 + 0.2, 0.3, 5.0 }).getAsDouble(), 1e-12);
        // Differ at the ninth digit: distinct
        assertFalse(mode(new double[] { 1.000000001, 1.000000002 }).isPresent());
    }

    @Test
    public void testModeRejectsNonFinite() {
        assertInvalid(() -> mode(new double[] { 1.0, Double.NaN }));
    }

    @Test
    public void testVariance() {
        double[] data = { 2, 4, 4, 4, 5, 5, 7, 9 };
        assertEquals(4.0, variance(data), 1e-12);
        assertEquals(2.0, standardDeviation(data), 1e-12);
        assertEquals(32.0 / 7.0, sampleVariance(data), 1e-12);
        assertEquals(Math.sqrt(32.0 / 7.0), sampleStandardDeviation(data), 1e-12);
    }

    @Test
    public void testVarianceOverflow() {
        double[] data = { 1e308, -1e308 };
        assertFails(FinanceErrorKind.OVERFLOW, () -> variance(data));
        assertFails(FinanceErrorKind.OVERFLOW, () -> sampleVariance(data));
        assertFails(FinanceErrorKind.OVERFLOW, () -> standardDeviation(data));
        assertFails(FinanceErrorKind.OVERFLOW, () -> sampleStandardDeviation(data));
    }

    @Test
    public void testVarianceNeedsTwoObservations() {
        assertInvalid(() -> variance(new double[] { 1.0 }));
        assertInvalid(() -> variance(new double[0]));
        assertInvalid(() -> sampleVariance(new double[] { 1.0 }));
        assertInvalid(() -> standardDeviation(new double[] { 1.0 }));
        assertInvalid(() -> sampleStandardDeviation(null));
    }

    @Test
    public void testWeightedAverage() {
        assertEquals(23.0, weightedAverage(new double[] { 10, 20, 30 }, new double[] { 0.2, 0.3, 0.5 }), 1e-12);
        assertEquals(760.0 / 9.0, weightedAverage(new double[] { 80, 90, 85 }, new double[] { 3, 2, 4 }), 1e-12);
    }

    @Test
    public void testWeightedAverageRejectsBadSeries() {
        assertInvalid(() -> weightedAverage(new double[] { 1, 2 }, new double[] { 1 }));
        assertInvalid(() -> weightedAverage(new double[0], new double[0]));
        assertInvalid(() -> weightedAverage(new double[] { 1, 2 }, new double[] { 1, -1 }));
        assertInvalid(() -> weightedAverage(new double[] { 1, Double.NaN }, new double[] { 1, 1 }));
    }

    @Test
    public void testWeightedAverageZeroWeights() {
        assertFails(FinanceErrorKind.DIVISION_BY_ZERO,
                () -> weightedAverage(new double[] { 1, 2, 3 }, new double[] { 0, 0, 0 }));
    }

    @Test
    public void testWeightedAverageOverflow() {
        assertFails(FinanceErrorKind.OVERFLOW,
                () -> weightedAverage(new double[] { 1, 1 }, new double[] { 1e308, 1e308 }));
        assertFails(FinanceErrorKind.OVERFLOW,
                () -> weightedAverage(new double[] { 1e308, 1e308 }, new double[] { 10, 10 }));
    }

    @Test
    public void testProbability() {
        assertEquals(1.0 / 6.0, probability(1, 6), 0.0);
        assertEquals(1.0, probability(6, 6), 0.0);
        assertEquals(0.0, probability(0, 6), 0.0);
    }

    @Test
    public void testProbabilityInvalid() {
        assertFails(FinanceErrorKind.DIVISION_BY_ZERO, () -> probability(0, 0));
        assertInvalid(() -> probability(7, 6));
        assertInvalid(() -> probability(-1, 6));
        assertInvalid(() -> probability(1, -6));
    }
}
