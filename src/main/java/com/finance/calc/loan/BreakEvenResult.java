package com.finance.calc.loan;

/** Units to sell and the revenue they bring at the break-even point. */
public record BreakEvenResult(double units, double revenue) {
}
