package com.finance.calc;

import java.time.Clock;

import com.finance.calc.asset.DepreciationCalculator;
import com.finance.calc.interest.TimeValueCalculator;
import com.finance.calc.investment.InvestmentAnalyzer;
import com.finance.calc.loan.LoanCalculator;
import com.finance.calc.ratio.FinancialRatios;
import com.finance.calc.safety.SafeMath;
import com.finance.calc.safety.SafetyLimits;

import lombok.Getter;

/**
 * Bundles the calculators of the engine behind one set of
 * {@link SafetyLimits} and one {@link Clock}.
 * <p>
 * Statistics have no configurable state and are used directly through
 * {@link com.finance.calc.stats.DescriptiveStatistics}.
 */
@Getter
public final class FinanceEngine {
    private final SafetyLimits limits;
    private final TimeValueCalculator timeValue;
    private final InvestmentAnalyzer investment;
    private final LoanCalculator loans;
    private final DepreciationCalculator depreciation;
    private final FinancialRatios ratios;

    public FinanceEngine() {
        this(SafetyLimits.DEFAULT, Clock.systemDefaultZone());
    }

    public FinanceEngine(SafetyLimits limits, Clock clock) {
        SafeMath math = new SafeMath(limits);
        this.limits = limits;
        this.timeValue = new TimeValueCalculator(math);
        this.investment = new InvestmentAnalyzer(math);
        this.loans = new LoanCalculator(math, clock);
        this.depreciation = new DepreciationCalculator(math);
        this.ratios = new FinancialRatios(math);
    }
}
