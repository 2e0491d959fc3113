package com.finance.calc.safety;

import com.finance.calc.api.FinanceException;

/**
 * Input contracts shared by every calculation.
 * <p>
 * Each check throws {@link FinanceException} of kind INVALID_INPUT naming the
 * field and the offending value.
 */
public final class Validators {
    private Validators() {
        // Utility class
    }

    /** Fails if {@code value} is NaN, infinite or {@code <= 0}. */
    public static void validatePositive(double value, String name) {
        validateFinite(value, name);
        if (value <= 0.0)
            throw FinanceException.invalidInput(name, value, name + " must be positive: " + value);
    }

    /** Fails if {@code value} is NaN, infinite or {@code < 0}. */
    public static void validateNonNegative(double value, String name) {
        validateFinite(value, name);
        if (value < 0.0)
            throw FinanceException.invalidInput(name, value, name + " must be non-negative: " + value);
    }

    /** Fails if {@code value} is NaN or infinite. */
    public static void validateFinite(double value, String name) {
        if (!Double.isFinite(value))
            throw FinanceException.invalidInput(name, value, name + " must be a valid number: " + value);
    }

    /** Fails if {@code |value|} exceeds the default magnitude limit. */
    public static void validateCalculationRange(double value, String name) {
        validateCalculationRange(value, name, SafetyLimits.DEFAULT);
    }

    /** Fails if {@code |value|} exceeds {@code limits.maxMagnitude}. */
    public static void validateCalculationRange(double value, String name, SafetyLimits limits) {
        if (Math.abs(value) > limits.getMaxMagnitude())
            throw FinanceException.invalidInput(name, value,
                    name + " is too large for safe calculation: " + value);
    }

    /**
     * Fails if the series is null, empty or holds a non-finite element. The
     * message names the element by its 1-based position.
     */
    public static void validateSeries(double[] values, String name, String elementLabel) {
        validateNotEmpty(values, name);
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i]))
                throw FinanceException.invalidInput(name, values[i],
                        name + " at " + elementLabel + " " + (i + 1) + " is invalid: " + values[i]);
        }
    }

    /** Fails if the series is null or empty. */
    public static void validateNotEmpty(double[] values, String name) {
        if (values == null || values.length == 0)
            throw FinanceException.invalidInput(name, name + " cannot be empty");
    }
}
