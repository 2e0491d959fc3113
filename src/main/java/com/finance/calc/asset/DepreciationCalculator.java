package com.finance.calc.asset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.finance.calc.api.FinanceException;
import com.finance.calc.safety.SafeMath;

import static com.finance.calc.safety.Validators.validateNonNegative;
import static com.finance.calc.safety.Validators.validatePositive;

/**
 * Yearly depreciation schedules. Every schedule has {@code usefulLifeYears}
 * entries and ends at a book value equal to the salvage value.
 */
public final class DepreciationCalculator {
    private final SafeMath math;

    public DepreciationCalculator() {
        this(SafeMath.standard());
    }

    public DepreciationCalculator(SafeMath math) {
        this.math = math;
    }

    public List<DepreciationEntry> schedule(DepreciationMethod method, double cost, double salvageValue,
            int usefulLifeYears) {
        return switch (method) {
            case STRAIGHT_LINE -> straightLine(cost, salvageValue, usefulLifeYears);
            case DOUBLE_DECLINING_BALANCE -> doubleDecliningBalance(cost, salvageValue, usefulLifeYears);
        };
    }

    /** Equal charge of {@code (cost - salvage) / life} every year. */
    public List<DepreciationEntry> straightLine(double cost, double salvageValue, int usefulLifeYears) {
        validate(cost, salvageValue, usefulLifeYears);
        double annual = math.divide(cost - salvageValue, usefulLifeYears);

        List<DepreciationEntry> entries = new ArrayList<>(usefulLifeYears);
        double accumulated = 0.0;
        for (int year = 1; year <= usefulLifeYears; year++) {
            double charge = year == usefulLifeYears ? (cost - salvageValue) - accumulated : annual;
            accumulated += charge;
            entries.add(new DepreciationEntry(year, charge, accumulated, cost - accumulated));
        }
        return Collections.unmodifiableList(entries);
    }

    /**
     * Charges {@code 2 / life} of the opening book value each year, never
     * below salvage. The final year books whatever remains above salvage.
     */
    public List<DepreciationEntry> doubleDecliningBalance(double cost, double salvageValue, int usefulLifeYears) {
        validate(cost, salvageValue, usefulLifeYears);
        double rate = math.divide(2.0, usefulLifeYears);

        List<DepreciationEntry> entries = new ArrayList<>(usefulLifeYears);
        double bookValue = cost;
        double accumulated = 0.0;
        for (int year = 1; year <= usefulLifeYears; year++) {
            double charge = year == usefulLifeYears
                    ? bookValue - salvageValue
                    : Math.min(bookValue * rate, bookValue - salvageValue);
            charge = Math.max(charge, 0.0);
            bookValue -= charge;
            accumulated += charge;
            entries.add(new DepreciationEntry(year, charge, accumulated, bookValue));
        }
        return Collections.unmodifiableList(entries);
    }

    private void validate(double cost, double salvageValue, int usefulLifeYears) {
        validatePositive(cost, "Asset cost");
        validateNonNegative(salvageValue, "Salvage value");
        math.validateCalculationRange(cost, "Asset cost");
        if (salvageValue > cost)
            throw FinanceException.invalidInput("Salvage value", salvageValue,
                    "Salvage value cannot exceed asset cost (" + cost + ")");
        if (usefulLifeYears <= 0)
            throw FinanceException.invalidInput("Useful life", usefulLifeYears,
                    "Useful life must be positive: " + usefulLifeYears);
    }
}
