package com.finance.calc.interest;

import com.finance.calc.api.FinanceException;
import com.finance.calc.safety.SafeMath;

import static com.finance.calc.safety.Validators.validateNonNegative;
import static com.finance.calc.safety.Validators.validatePositive;

/**
 * Interest and time-value-of-money functions.
 * <p>
 * Rates are decimal fractions ({@code 0.05} is 5%). Conversion from a
 * percentage is the caller's job.
 */
public final class TimeValueCalculator {
    /** Discount rates at or above this are rejected by {@link #presentValue}. */
    public static final double MAX_DISCOUNT_RATE = 1.0;

    private final SafeMath math;

    public TimeValueCalculator() {
        this(SafeMath.standard());
    }

    public TimeValueCalculator(SafeMath math) {
        this.math = math;
    }

    /**
     * Simple interest.
     * <p>
     * Formula: {@code I = P * r * t}
     */
    public double simpleInterest(double principal, double rate, double time) {
        validatePositive(principal, "Principal");
        validateNonNegative(rate, "Interest rate");
        validateNonNegative(time, "Time");
        math.validateCalculationRange(principal, "Principal");

        double principalTimesRate = math.multiply(principal, rate);
        return math.multiply(principalTimesRate, time);
    }

    /**
     * Amount after compounding {@code frequency} times a year for
     * {@code years} whole years.
     * <p>
     * Formula: {@code A = P * (1 + r/n)^(n*t)}
     */
    public double compoundInterest(double principal, double rate, int frequency, int years) {
        validatePositive(principal, "Principal");
        validateNonNegative(rate, "Interest rate");
        math.validateCalculationRange(principal, "Principal");
        if (frequency <= 0)
            throw FinanceException.invalidInput("Compound frequency", frequency,
                    "Compound frequency must be positive: " + frequency);
        if (years < 0)
            throw FinanceException.invalidInput("Years", years, "Years must be non-negative: " + years);

        double ratePerPeriod = rate / frequency;
        double totalPeriods = (double) frequency * years;

        double growth = math.power(1.0 + ratePerPeriod, totalPeriods);
        return math.multiply(principal, growth);
    }

    /**
     * Present value of a future amount.
     * <p>
     * Formula: {@code PV = FV / (1 + r)^t}. Rates of 100% or more are rejected.
     */
    public double presentValue(double futureValue, double rate, double time) {
        validatePositive(futureValue, "Future value");
        validateNonNegative(rate, "Discount rate");
        validateNonNegative(time, "Time");
        math.validateCalculationRange(futureValue, "Future value");
        if (rate >= MAX_DISCOUNT_RATE)
            throw FinanceException.invalidInput("Discount rate", rate,
                    "Discount rate should be less than 100%: " + rate);

        double discountFactor = math.power(1.0 + rate, time);
        return math.divide(futureValue, discountFactor);
    }

    /**
     * Future value of a present amount.
     * <p>
     * Formula: {@code FV = PV * (1 + r)^t}
     */
    public double futureValue(double presentValue, double rate, double time) {
        validatePositive(presentValue, "Present value");
        validateNonNegative(rate, "Interest rate");
        validateNonNegative(time, "Time");
        math.validateCalculationRange(presentValue, "Present value");

        double growth = math.power(1.0 + rate, time);
        return math.multiply(presentValue, growth);
    }
}
