package com.finance.calc.loan;

import java.time.LocalDate;

/** Summary of a fixed-rate mortgage. */
public record MortgageDetails(double monthlyPayment, double totalInterest, LocalDate payoffDate) {
}
