package com.finance.calc.asset;

/**
 * One year of a depreciation schedule.
 *
 * @param year                    1-based year
 * @param depreciation            charge booked this year
 * @param accumulatedDepreciation total charged up to and including this year
 * @param bookValue               cost less accumulated depreciation
 */
public record DepreciationEntry(int year, double depreciation, double accumulatedDepreciation,
        double bookValue) {
}
