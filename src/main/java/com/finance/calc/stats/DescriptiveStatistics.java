package com.finance.calc.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

import com.finance.calc.api.FinanceException;

/**
 * Descriptive statistics over {@code double[]} samples.
 * <p>
 * Every routine rejects non-finite elements up front, naming the offending
 * index, so sorting and summing never see NaN or infinity.
 */
public final class DescriptiveStatistics {
    /**
     * Values equal after rounding to this many decimal digits are the same
     * value for {@link #mode}.
     */
    public static final int MODE_SCALE = 10;

    private DescriptiveStatistics() {
        // Utility class
    }

    public static double mean(double[] numbers) {
        requireNonEmpty(numbers, "mean");
        requireFinite(numbers);
        double sum = 0.0;
        for (double d : numbers)
            sum += d;
        return finite(finite(sum, "mean sum") / numbers.length, "mean");
    }

    /** Middle value, or the average of the two middle values for even counts. */
    public static double median(double[] numbers) {
        requireNonEmpty(numbers, "median");
        requireFinite(numbers);
        double[] sorted = numbers.clone();
        Arrays.sort(sorted);
        int len = sorted.length;
        if (len % 2 == 0)
            return sorted[len / 2 - 1] / 2.0 + sorted[len / 2] / 2.0;
        return sorted[len / 2];
    }

    /**
     * Most frequent value.
     * <p>
     * Values are grouped after rounding to {@link #MODE_SCALE} decimal digits.
     * Ties resolve to the smallest value.
     *
     * @return empty when the sample is empty or no value repeats
     */
    public static OptionalDouble mode(double[] numbers) {
        if (numbers == null || numbers.length == 0)
            return OptionalDouble.empty();
        requireFinite(numbers);

        // Ascending order, so the first key reaching the max frequency is the smallest.
        Map<BigDecimal, Integer> frequencies = new TreeMap<>();
        for (double d : numbers)
            frequencies.merge(modeKey(d), 1, Integer::sum);

        BigDecimal best = null;
        int bestCount = 1;
        for (Map.Entry<BigDecimal, Integer> e : frequencies.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best == null ? OptionalDouble.empty() : OptionalDouble.of(best.doubleValue());
    }

    /** Population variance: squared deviations over N. Needs two observations. */
    public static double variance(double[] numbers) {
        requireAtLeastTwo(numbers, "variance");
        return finite(sumSquaredDeviations(numbers) / numbers.length, "variance");
    }

    /** Sample variance: squared deviations over N - 1. Needs two observations. */
    public static double sampleVariance(double[] numbers) {
        requireAtLeastTwo(numbers, "sample variance");
        return finite(sumSquaredDeviations(numbers) / (numbers.length - 1), "sample variance");
    }

    public static double standardDeviation(double[] numbers) {
        return Math.sqrt(variance(numbers));
    }

    public static double sampleStandardDeviation(double[] numbers) {
        return Math.sqrt(sampleVariance(numbers));
    }

    /**
     * {@code sum(value * weight) / sum(weight)}. Weights must be finite and
     * non-negative; a zero total weight is a DIVISION_BY_ZERO.
     */
    public static double weightedAverage(double[] numbers, double[] weights) {
        if (numbers == null || numbers.length == 0 || weights == null || weights.length == 0)
            throw FinanceException.invalidInput("Numbers", "Numbers and weights cannot be empty");
        if (numbers.length != weights.length)
            throw FinanceException.invalidInput("Weights",
                    "Numbers and weights must have the same length: " + numbers.length + " vs " + weights.length);

        double sumProduct = 0.0;
        double sumWeight = 0.0;
        for (int i = 0; i < numbers.length; i++) {
            double val = numbers[i];
            double weight = weights[i];
            if (!Double.isFinite(val))
                throw FinanceException.invalidInput("Numbers", val, "Invalid number at index " + i + ": " + val);
            if (!Double.isFinite(weight) || weight < 0.0)
                throw FinanceException.invalidInput("Weights", weight, "Invalid weight at index " + i + ": " + weight);
            sumProduct += val * weight;
            sumWeight += weight;
        }

        finite(sumProduct, "weighted sum");
        finite(sumWeight, "total weight");
        if (sumWeight == 0.0)
            throw FinanceException.divisionByZero("Total weight");
        return finite(sumProduct / sumWeight, "weighted average");
    }

    /** {@code successes / trials}; zero trials is a DIVISION_BY_ZERO. */
    public static double probability(int successes, int trials) {
        if (trials < 0)
            throw FinanceException.invalidInput("Trials", trials, "Trials must be non-negative: " + trials);
        if (successes < 0)
            throw FinanceException.invalidInput("Successes", successes,
                    "Successes must be non-negative: " + successes);
        if (trials == 0)
            throw FinanceException.divisionByZero("Trials");
        if (successes > trials)
            throw FinanceException.invalidInput("Successes", successes,
                    "Successes cannot exceed trials (" + trials + ")");
        return (double) successes / trials;
    }

    static BigDecimal modeKey(double value) {
        return new BigDecimal(value).setScale(MODE_SCALE, RoundingMode.HALF_EVEN);
    }

    private static double sumSquaredDeviations(double[] numbers) {
        double mean = mean(numbers);
        double sumSq = 0.0;
        for (double d : numbers) {
            double dev = d - mean;
            sumSq += dev * dev;
        }
        return finite(sumSq, "sum of squared deviations");
    }

    private static double finite(double value, String operation) {
        if (!Double.isFinite(value))
            throw FinanceException.overflow(operation, value);
        return value;
    }

    private static void requireNonEmpty(double[] numbers, String what) {
        if (numbers == null || numbers.length == 0)
            throw FinanceException.invalidInput("Numbers", "Cannot calculate " + what + " of empty dataset");
    }

    private static void requireAtLeastTwo(double[] numbers, String what) {
        if (numbers == null || numbers.length < 2)
            throw FinanceException.invalidInput("Numbers",
                    "At least two numbers are required to calculate " + what);
    }

    private static void requireFinite(double[] numbers) {
        for (int i = 0; i < numbers.length; i++) {
            if (!Double.isFinite(numbers[i]))
                throw FinanceException.invalidInput("Numbers", numbers[i],
                        "Invalid number at index " + i + ": " + numbers[i]);
        }
    }
}
