package com.finance.calc.loan;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.finance.calc.api.FinanceException;
import com.finance.calc.safety.SafeMath;

import static com.finance.calc.safety.Validators.validateNonNegative;
import static com.finance.calc.safety.Validators.validatePositive;

/**
 * Fixed-rate loan engine: monthly payment, amortization schedule, mortgage
 * summary and break-even analysis.
 * <p>
 * Unlike the rest of the engine, loan rates are annual <em>percentages</em>
 * ({@code 5.0} is 5%). The monthly rate is {@code annual / 100 / 12}.
 * <p>
 * The clock is only consulted for the mortgage payoff date.
 */
public final class LoanCalculator {
    public static final int MONTHS_PER_YEAR = 12;

    private final SafeMath math;
    private final Clock clock;

    public LoanCalculator() {
        this(SafeMath.standard(), Clock.systemDefaultZone());
    }

    public LoanCalculator(Clock clock) {
        this(SafeMath.standard(), clock);
    }

    public LoanCalculator(SafeMath math, Clock clock) {
        if (clock == null)
            throw new IllegalArgumentException("clock must not be null");
        this.math = math;
        this.clock = clock;
    }

    /**
     * Level monthly payment.
     * <p>
     * Formula: {@code M = P * r / (1 - (1 + r)^-n)}; a zero rate degenerates to
     * {@code P / n}.
     */
    public double monthlyPayment(double principal, double annualRatePercent, double termYears) {
        validatePositive(principal, "Principal");
        validateNonNegative(annualRatePercent, "Annual interest rate");
        validatePositive(termYears, "Loan term");
        math.validateCalculationRange(principal, "Principal");

        double monthlyRate = monthlyRate(annualRatePercent);
        double payments = termYears * MONTHS_PER_YEAR;
        if (monthlyRate == 0.0)
            return math.divide(principal, payments);

        // 1 - (1 + r)^-n, accurate even where 1 + r rounds to 1. Payment counts
        // exceed the exponent cutoff, so only the result is checked.
        double denominator = math.checkResult(-Math.expm1(-payments * Math.log1p(monthlyRate)),
                "loan discount factor");
        if (denominator == 0.0)
            return math.divide(principal, payments);
        return math.multiply(principal, math.divide(monthlyRate, denominator));
    }

    /**
     * Full month-by-month schedule, generated eagerly.
     * <p>
     * Each month charges {@code balance * r} as interest and applies the rest
     * of the payment to principal. The last month's balance is set to exactly
     * zero to absorb floating-point drift.
     *
     * @return an unmodifiable list of {@code termYears * 12} payments
     */
    public List<AmortizationPayment> amortizationSchedule(double principal, double annualRatePercent,
            int termYears) {
        int totalPayments = totalPayments(termYears);
        double payment = monthlyPayment(principal, annualRatePercent, termYears);
        double monthlyRate = monthlyRate(annualRatePercent);

        List<AmortizationPayment> schedule = new ArrayList<>(totalPayments);
        double balance = principal;
        for (int month = 1; month <= totalPayments; month++) {
            double interest = balance * monthlyRate;
            double principalPortion = payment - interest;
            balance -= principalPortion;
            if (month == totalPayments)
                balance = 0.0;
            schedule.add(new AmortizationPayment(month, principalPortion, interest, balance));
        }
        return Collections.unmodifiableList(schedule);
    }

    /**
     * Monthly payment, total interest over the term and payoff date counted
     * from today's date on the injected clock.
     */
    public MortgageDetails mortgageDetails(double loanAmount, double annualRatePercent, int termYears) {
        int totalPayments = totalPayments(termYears);
        double payment = monthlyPayment(loanAmount, annualRatePercent, termYears);
        double totalPaid = math.multiply(payment, totalPayments);
        LocalDate payoff = LocalDate.now(clock).plusMonths(totalPayments);
        return new MortgageDetails(payment, totalPaid - loanAmount, payoff);
    }

    /**
     * Units to sell to cover fixed costs.
     * <p>
     * Formula: {@code units = fixed / (price - variable)}. A zero or negative
     * contribution margin is rejected.
     */
    public double breakEvenUnits(double fixedCosts, double variableCostPerUnit, double pricePerUnit) {
        validatePositive(fixedCosts, "Fixed costs");
        validatePositive(variableCostPerUnit, "Variable cost per unit");
        validatePositive(pricePerUnit, "Price per unit");
        if (pricePerUnit <= variableCostPerUnit)
            throw FinanceException.invalidInput("Price per unit", pricePerUnit,
                    "Price per unit must be greater than variable cost per unit (" + variableCostPerUnit + ")");

        return math.divide(fixedCosts, pricePerUnit - variableCostPerUnit);
    }

    /** Break-even units together with the revenue at that volume. */
    public BreakEvenResult breakEvenAnalysis(double fixedCosts, double variableCostPerUnit, double pricePerUnit) {
        double units = breakEvenUnits(fixedCosts, variableCostPerUnit, pricePerUnit);
        return new BreakEvenResult(units, math.multiply(units, pricePerUnit));
    }

    private static double monthlyRate(double annualRatePercent) {
        return annualRatePercent / 100.0 / MONTHS_PER_YEAR;
    }

    private static int totalPayments(int termYears) {
        if (termYears <= 0)
            throw FinanceException.invalidInput("Term", termYears, "Term must be positive: " + termYears);
        try {
            return Math.multiplyExact(termYears, MONTHS_PER_YEAR);
        } catch (ArithmeticException e) {
            throw FinanceException.invalidInput("Term", termYears, "Term is too long: " + termYears + " years");
        }
    }
}
