package com.finance.calc.loan;

/**
 * One month of an amortization schedule.
 *
 * @param period           1-based month number
 * @param principalPortion part of the payment that reduces the balance
 * @param interestPortion  part of the payment charged as interest
 * @param remainingBalance balance after this payment; exactly 0 on the last month
 */
public record AmortizationPayment(int period, double principalPortion, double interestPortion,
        double remainingBalance) {

    /** Total cash paid this month. */
    public double payment() {
        return principalPortion + interestPortion;
    }
}
