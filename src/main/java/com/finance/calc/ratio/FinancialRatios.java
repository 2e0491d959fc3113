package com.finance.calc.ratio;

import java.math.BigDecimal;
import java.math.MathContext;

import com.finance.calc.api.FinanceException;
import com.finance.calc.safety.SafeMath;

import static com.finance.calc.safety.Validators.validateFinite;
import static com.finance.calc.safety.Validators.validateNonNegative;
import static com.finance.calc.safety.Validators.validatePositive;

/**
 * Profitability, valuation, leverage and liquidity ratios.
 * <p>
 * Percent-style ratios (ROE, ROA, dividend yield) are returned multiplied by
 * 100; the others are plain multiples. Every divisor must be strictly positive.
 */
public final class FinancialRatios {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SafeMath math;

    public FinancialRatios() {
        this(SafeMath.standard());
    }

    public FinancialRatios(SafeMath math) {
        this.math = math;
    }

    /**
     * Return on equity, in percent. Computed in decimal arithmetic so that
     * round inputs give round outputs.
     */
    public double returnOnEquity(double netIncome, double shareholdersEquity) {
        validatePositive(shareholdersEquity, "Shareholders' equity");
        validateFinite(netIncome, "Net income");

        BigDecimal roe = BigDecimal.valueOf(netIncome)
                .divide(BigDecimal.valueOf(shareholdersEquity), MathContext.DECIMAL64)
                .multiply(HUNDRED);
        return math.checkResult(roe.doubleValue(), "ROE");
    }

    /** Return on assets, in percent. */
    public double returnOnAssets(double netIncome, double totalAssets) {
        validatePositive(totalAssets, "Total assets");
        validateFinite(netIncome, "Net income");
        return math.multiply(math.divide(netIncome, totalAssets), 100.0);
    }

    /** Price-to-earnings multiple. */
    public double priceToEarnings(double stockPrice, double earningsPerShare) {
        validatePositive(stockPrice, "Stock price");
        validatePositive(earningsPerShare, "Earnings per share");
        return math.divide(stockPrice, earningsPerShare);
    }

    /** Annual dividend over share price, in percent. */
    public double dividendYield(double annualDividend, double stockPrice) {
        validatePositive(stockPrice, "Stock price");
        validateNonNegative(annualDividend, "Annual dividend");
        return math.multiply(math.divide(annualDividend, stockPrice), 100.0);
    }

    public double debtToEquity(double totalDebt, double totalEquity) {
        validateNonNegative(totalDebt, "Total debt");
        validatePositive(totalEquity, "Total equity");
        return math.divide(totalDebt, totalEquity);
    }

    public double currentRatio(double currentAssets, double currentLiabilities) {
        validateNonNegative(currentAssets, "Current assets");
        validatePositive(currentLiabilities, "Current liabilities");
        return math.divide(currentAssets, currentLiabilities);
    }

    /** Acid-test ratio: current assets less inventory, over current liabilities. */
    public double quickRatio(double currentAssets, double inventory, double currentLiabilities) {
        validateNonNegative(currentAssets, "Current assets");
        validateNonNegative(inventory, "Inventory");
        validatePositive(currentLiabilities, "Current liabilities");
        if (inventory > currentAssets)
            throw FinanceException.invalidInput("Inventory", inventory,
                    "Inventory cannot exceed current assets (" + currentAssets + ")");
        return math.divide(currentAssets - inventory, currentLiabilities);
    }

    /**
     * Weighted average cost of capital.
     * <p>
     * Formula: {@code WACC = E/V * Re + D/V * Rd * (1 - T)}, {@code V = E + D}.
     * The tax rate is a fraction in {@code [0, 1]}. A zero total market value
     * is a DIVISION_BY_ZERO.
     */
    public double wacc(double costOfEquity, double costOfDebt, double taxRate, double marketValueEquity,
            double marketValueDebt) {
        validateNonNegative(costOfEquity, "Cost of equity");
        validateNonNegative(costOfDebt, "Cost of debt");
        validateNonNegative(taxRate, "Tax rate");
        validateNonNegative(marketValueEquity, "Market value of equity");
        validateNonNegative(marketValueDebt, "Market value of debt");
        if (taxRate > 1.0)
            throw FinanceException.invalidInput("Tax rate", taxRate,
                    "Tax rate should be expressed as a decimal (0-1): " + taxRate);

        double totalValue = marketValueEquity + marketValueDebt;
        if (totalValue == 0.0)
            throw FinanceException.divisionByZero("Total market value");

        double equityWeight = marketValueEquity / totalValue;
        double debtWeight = marketValueDebt / totalValue;
        return math.checkResult(equityWeight * costOfEquity + debtWeight * costOfDebt * (1.0 - taxRate), "WACC");
    }
}
