package com.finance.calc.api;

/**
 * Classification of calculation failures.
 * <p>
 * Callers branch on the kind rather than on message text. None of the kinds is
 * retry-worthy: every calculation is deterministic in its inputs.
 */
public enum FinanceErrorKind {
    /** A precondition on one or more arguments was violated. */
    INVALID_INPUT,

    /** A denominator evaluated to exactly zero at calculation time. */
    DIVISION_BY_ZERO,

    /** Finite inputs produced a NaN or infinite result. */
    OVERFLOW,

    /** An iterative solver did not reach its precision target. */
    CONVERGENCE_FAILED
}
