package com.finance.calc.investment;

import java.util.OptionalDouble;

import com.finance.calc.api.FinanceException;
import com.finance.calc.safety.SafeMath;

import static com.finance.calc.safety.Validators.validateFinite;
import static com.finance.calc.safety.Validators.validateNonNegative;
import static com.finance.calc.safety.Validators.validatePositive;
import static com.finance.calc.safety.Validators.validateSeries;

/**
 * Investment appraisal over cash-flow series.
 * <p>
 * Cash-flow index 0 is the first future period, discounted by one period.
 * Every series is checked for emptiness and for non-finite elements before
 * any discounting.
 */
public final class InvestmentAnalyzer {
    public static final double IRR_INITIAL_GUESS = 0.1;
    public static final double IRR_TOLERANCE = 1e-10;
    public static final int IRR_MAX_ITERATIONS = 100;
    // Below this the Newton step is numerically meaningless.
    private static final double IRR_MIN_DERIVATIVE = 1e-12;

    private final SafeMath math;

    public InvestmentAnalyzer() {
        this(SafeMath.standard());
    }

    public InvestmentAnalyzer(SafeMath math) {
        this.math = math;
    }

    /**
     * Net present value.
     * <p>
     * Formula: {@code NPV = -I + sum(CF_i / (1 + r)^i)}, i = 1..N
     */
    public double npv(double initialInvestment, double[] cashFlows, double discountRate) {
        validatePositive(initialInvestment, "Initial investment");
        validateNonNegative(discountRate, "Discount rate");
        validateSeries(cashFlows, "Cash flow", "year");

        return math.checkResult(-initialInvestment + discountedSum(cashFlows, discountRate), "NPV");
    }

    /**
     * Discounted cash flow value: the NPV sum without the investment term.
     * The rate may be negative but must stay above -100%.
     */
    public double dcf(double[] cashFlows, double discountRate) {
        validateFinite(discountRate, "Discount rate");
        if (discountRate <= -1.0)
            throw FinanceException.invalidInput("Discount rate", discountRate,
                    "Discount rate must be greater than -1: " + discountRate);
        validateSeries(cashFlows, "Cash flow", "year");

        return math.checkResult(discountedSum(cashFlows, discountRate), "DCF");
    }

    /**
     * Periods needed for cumulative cash flow to recover the initial cost,
     * interpolated linearly inside the crossing period as
     * {@code index + remaining / crossingFlow + 1} (0-based index). Costs of
     * 300 against flows {@code [100, 200, 300]} pay back at 3.0, costs of 250
     * at 2.75.
     *
     * @return the fractional period count, or empty if the series never
     *         recovers the cost
     */
    public OptionalDouble paybackPeriod(double initialCost, double[] cashFlows) {
        validatePositive(initialCost, "Initial cost");
        validateSeries(cashFlows, "Cash flow", "year");

        double cumulative = 0.0;
        for (int period = 0; period < cashFlows.length; period++) {
            double cashFlow = cashFlows[period];
            double previous = cumulative;
            cumulative += cashFlow;
            if (cumulative >= initialCost) {
                double remaining = initialCost - previous;
                return OptionalDouble.of(period + remaining / cashFlow + 1.0);
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Return on investment as a percentage.
     * <p>
     * Formula: {@code ROI = netProfit / cost * 100}. A negative profit is a loss.
     */
    public double roi(double netProfit, double costOfInvestment) {
        validatePositive(costOfInvestment, "Cost of investment");
        validateFinite(netProfit, "Net profit");
        return math.multiply(math.divide(netProfit, costOfInvestment), 100.0);
    }

    /**
     * Expected return under the Capital Asset Pricing Model.
     * <p>
     * Formula: {@code E(R) = rf + beta * (rm - rf)}. Beta may be zero or negative.
     */
    public double capm(double riskFreeRate, double beta, double marketReturn) {
        validateNonNegative(riskFreeRate, "Risk-free rate");
        validateFinite(beta, "Beta");
        validateFinite(marketReturn, "Market return");
        return math.checkResult(riskFreeRate + beta * (marketReturn - riskFreeRate), "CAPM");
    }

    /**
     * Internal rate of return: the rate at which {@link #npv} is zero.
     * <p>
     * Solved with Newton-Raphson from {@link #IRR_INITIAL_GUESS}. Fails with
     * CONVERGENCE_FAILED when the derivative vanishes, the iterate leaves
     * {@code (-1, inf)}, or {@link #IRR_MAX_ITERATIONS} pass without reaching
     * {@link #IRR_TOLERANCE}.
     */
    public double irr(double initialInvestment, double[] cashFlows) {
        validatePositive(initialInvestment, "Initial investment");
        validateSeries(cashFlows, "Cash flow", "year");
        boolean anyInflow = false;
        for (double cf : cashFlows) {
            if (cf > 0) {
                anyInflow = true;
                break;
            }
        }
        if (!anyInflow)
            throw FinanceException.invalidInput("Cash flow", "IRR requires at least one positive cash flow");

        double rate = IRR_INITIAL_GUESS;
        for (int iteration = 0; iteration < IRR_MAX_ITERATIONS; iteration++) {
            double value = -initialInvestment;
            double derivative = 0.0;
            for (int i = 0; i < cashFlows.length; i++) {
                int period = i + 1;
                double factor = Math.pow(1.0 + rate, period);
                value += cashFlows[i] / factor;
                derivative -= period * cashFlows[i] / (factor * (1.0 + rate));
            }

            if (Math.abs(value) < IRR_TOLERANCE)
                return rate;
            if (!Double.isFinite(derivative) || Math.abs(derivative) < IRR_MIN_DERIVATIVE)
                throw FinanceException.convergenceFailed("IRR",
                        "IRR derivative vanished at rate " + rate + " after " + iteration + " iterations");

            double next = rate - value / derivative;
            if (!Double.isFinite(next) || next <= -1.0)
                throw FinanceException.convergenceFailed("IRR",
                        "IRR iterate left the valid domain (" + next + ") after " + (iteration + 1)
                                + " iterations");
            if (Math.abs(next - rate) < IRR_TOLERANCE)
                return next;
            rate = next;
        }
        throw FinanceException.convergenceFailed("IRR",
                "IRR did not converge within " + IRR_MAX_ITERATIONS + " iterations");
    }

    private static double discountedSum(double[] cashFlows, double rate) {
        double sum = 0.0;
        for (int i = 0; i < cashFlows.length; i++) {
            sum += cashFlows[i] / Math.pow(1.0 + rate, i + 1);
        }
        return sum;
    }
}
