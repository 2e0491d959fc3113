package com.finance.calc.io;

import static com.finance.calc.io.CalculationRunner.getDouble;
import static com.finance.calc.io.CalculationRunner.getString;
import static com.finance.calc.io.CalculationRunner.optional;
import static com.finance.calc.io.CalculationRunner.requireArray;
import static com.finance.calc.io.CalculationRunner.requireDouble;
import static com.finance.calc.io.CalculationRunner.requireInt;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import com.finance.calc.FinanceEngine;
import com.finance.calc.asset.DepreciationMethod;
import com.finance.calc.loan.MortgageDetails;
import com.finance.calc.stats.DescriptiveStatistics;

/**
 * Every calculation a {@link CalculationRequest} can name, each bound to the
 * handler that reads its parameters and calls the engine.
 */
public enum CalculationType {
    // --- Interest & time value ---
    SIMPLE_INTEREST((e, p) -> e.getTimeValue().simpleInterest(
            requireDouble(p, "principal"), requireDouble(p, "rate"), requireDouble(p, "time"))),
    COMPOUND_INTEREST((e, p) -> e.getTimeValue().compoundInterest(
            requireDouble(p, "principal"), requireDouble(p, "rate"),
            requireInt(p, "frequency"), requireInt(p, "years"))),
    PRESENT_VALUE((e, p) -> e.getTimeValue().presentValue(
            requireDouble(p, "futureValue"), requireDouble(p, "rate"), requireDouble(p, "time"))),
    FUTURE_VALUE((e, p) -> e.getTimeValue().futureValue(
            requireDouble(p, "presentValue"), requireDouble(p, "rate"), requireDouble(p, "time"))),

    // --- Investment analysis ---
    NPV((e, p) -> e.getInvestment().npv(
            requireDouble(p, "initialInvestment"), requireArray(p, "cashFlows"), requireDouble(p, "discountRate"))),
    DCF((e, p) -> e.getInvestment().dcf(requireArray(p, "cashFlows"), requireDouble(p, "discountRate"))),
    PAYBACK_PERIOD((e, p) -> optional(e.getInvestment().paybackPeriod(
            requireDouble(p, "initialCost"), requireArray(p, "cashFlows")))),
    ROI((e, p) -> e.getInvestment().roi(requireDouble(p, "netProfit"), requireDouble(p, "costOfInvestment"))),
    CAPM((e, p) -> e.getInvestment().capm(
            requireDouble(p, "riskFreeRate"), requireDouble(p, "beta"), requireDouble(p, "marketReturn"))),
    IRR((e, p) -> e.getInvestment().irr(requireDouble(p, "initialInvestment"), requireArray(p, "cashFlows"))),

    // --- Loans ---
    LOAN_PAYMENT((e, p) -> e.getLoans().monthlyPayment(
            requireDouble(p, "principal"), requireDouble(p, "annualRatePercent"), requireDouble(p, "termYears"))),
    AMORTIZATION((e, p) -> e.getLoans().amortizationSchedule(
            requireDouble(p, "principal"), requireDouble(p, "annualRatePercent"), requireInt(p, "termYears"))),
    MORTGAGE((e, p) -> {
        MortgageDetails d = e.getLoans().mortgageDetails(
                requireDouble(p, "loanAmount"), requireDouble(p, "annualRatePercent"), requireInt(p, "termYears"));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("monthlyPayment", d.monthlyPayment());
        out.put("totalInterest", d.totalInterest());
        out.put("payoffDate", d.payoffDate().toString());
        return out;
    }),
    BREAK_EVEN_UNITS((e, p) -> e.getLoans().breakEvenUnits(
            requireDouble(p, "fixedCosts"), requireDouble(p, "variableCostPerUnit"),
            requireDouble(p, "pricePerUnit"))),
    BREAK_EVEN((e, p) -> e.getLoans().breakEvenAnalysis(
            requireDouble(p, "fixedCosts"), requireDouble(p, "variableCostPerUnit"),
            requireDouble(p, "pricePerUnit"))),

    // --- Depreciation ---
    DEPRECIATION((e, p) -> e.getDepreciation().schedule(
            DepreciationMethod.fromString(getString(p, "method", "straight-line")),
            requireDouble(p, "cost"), getDouble(p, "salvageValue", 0.0), requireInt(p, "usefulLifeYears"))),

    // --- Ratios ---
    ROE((e, p) -> e.getRatios().returnOnEquity(requireDouble(p, "netIncome"), requireDouble(p, "equity"))),
    ROA((e, p) -> e.getRatios().returnOnAssets(requireDouble(p, "netIncome"), requireDouble(p, "totalAssets"))),
    PE_RATIO((e, p) -> e.getRatios().priceToEarnings(
            requireDouble(p, "stockPrice"), requireDouble(p, "earningsPerShare"))),
    DIVIDEND_YIELD((e, p) -> e.getRatios().dividendYield(
            requireDouble(p, "annualDividend"), requireDouble(p, "stockPrice"))),
    DEBT_TO_EQUITY((e, p) -> e.getRatios().debtToEquity(
            requireDouble(p, "totalDebt"), requireDouble(p, "totalEquity"))),
    CURRENT_RATIO((e, p) -> e.getRatios().currentRatio(
            requireDouble(p, "currentAssets"), requireDouble(p, "currentLiabilities"))),
    QUICK_RATIO((e, p) -> e.getRatios().quickRatio(
            requireDouble(p, "currentAssets"), requireDouble(p, "inventory"),
            requireDouble(p, "currentLiabilities"))),
    WACC((e, p) -> e.getRatios().wacc(
            requireDouble(p, "costOfEquity"), requireDouble(p, "costOfDebt"), requireDouble(p, "taxRate"),
            requireDouble(p, "marketValueEquity"), requireDouble(p, "marketValueDebt"))),

    // --- Statistics ---
    MEAN((e, p) -> DescriptiveStatistics.mean(requireArray(p, "numbers"))),
    MEDIAN((e, p) -> DescriptiveStatistics.median(requireArray(p, "numbers"))),
    MODE((e, p) -> optional(DescriptiveStatistics.mode(requireArray(p, "numbers")))),
    VARIANCE((e, p) -> DescriptiveStatistics.variance(requireArray(p, "numbers"))),
    SAMPLE_VARIANCE((e, p) -> DescriptiveStatistics.sampleVariance(requireArray(p, "numbers"))),
    STANDARD_DEVIATION((e, p) -> DescriptiveStatistics.standardDeviation(requireArray(p, "numbers"))),
    SAMPLE_STANDARD_DEVIATION((e, p) -> DescriptiveStatistics.sampleStandardDeviation(requireArray(p, "numbers"))),
    WEIGHTED_AVERAGE((e, p) -> DescriptiveStatistics.weightedAverage(
            requireArray(p, "numbers"), requireArray(p, "weights"))),
    PROBABILITY((e, p) -> DescriptiveStatistics.probability(requireInt(p, "successes"), requireInt(p, "trials")));

    private final Handler handler;

    CalculationType(Handler handler) {
        this.handler = handler;
    }

    /** Runs the calculation against {@code engine} with the given parameters. */
    public Object calculate(FinanceEngine engine, Map<String, Object> params) {
        return handler.apply(engine, params);
    }

    /** Accepts enum names in any case, with dashes or underscores. */
    public static CalculationType fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Calculation type must not be null");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown calculation type: " + s, e);
        }
    }

    @FunctionalInterface
    interface Handler {
        Object apply(FinanceEngine engine, Map<String, Object> params);
    }
}
