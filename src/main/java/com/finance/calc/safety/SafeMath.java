package com.finance.calc.safety;

import com.finance.calc.api.FinanceException;

import lombok.Getter;

/**
 * Guarded arithmetic.
 * <p>
 * Every operation checks operand finiteness, computes, then checks that the
 * result is finite. A non-finite result from finite operands is an OVERFLOW;
 * it never propagates silently as {@code Infinity} or {@code NaN}.
 * <p>
 * Instances are immutable and hold the {@link SafetyLimits} they enforce.
 */
@Getter
public final class SafeMath {
    private static final SafeMath STANDARD = new SafeMath(SafetyLimits.DEFAULT);

    private final SafetyLimits limits;

    public SafeMath(SafetyLimits limits) {
        if (limits == null)
            throw new IllegalArgumentException("limits must not be null");
        this.limits = limits;
    }

    /** Returns the instance bound to {@link SafetyLimits#DEFAULT}. */
    public static SafeMath standard() {
        return STANDARD;
    }

    public double multiply(double a, double b) {
        Validators.validateFinite(a, "Multiplicand");
        Validators.validateFinite(b, "Multiplier");
        return checkResult(a * b, "multiplication");
    }

    public double divide(double a, double b) {
        Validators.validateFinite(a, "Dividend");
        Validators.validateFinite(b, "Divisor");
        if (b == 0.0)
            throw FinanceException.divisionByZero("Divisor");
        return checkResult(a / b, "division");
    }

    /**
     * Raises {@code base} to {@code exponent}. Exponents whose magnitude
     * exceeds {@code limits.maxExponent} are rejected as INVALID_INPUT before
     * any computation.
     */
    public double power(double base, double exponent) {
        Validators.validateFinite(base, "Base");
        Validators.validateFinite(exponent, "Exponent");
        if (Math.abs(exponent) > limits.getMaxExponent())
            throw FinanceException.invalidInput("Exponent", exponent,
                    "Exponent too large for safe calculation: " + exponent);
        return checkResult(Math.pow(base, exponent), "power");
    }

    /** Rejects a non-finite intermediate or final result. */
    public double checkResult(double result, String operation) {
        if (!Double.isFinite(result))
            throw FinanceException.overflow(operation, result);
        return result;
    }

    /** Range check against this instance's magnitude limit. */
    public void validateCalculationRange(double value, String name) {
        Validators.validateCalculationRange(value, name, limits);
    }
}
