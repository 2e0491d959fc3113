package com.finance.calc.api;

import lombok.Getter;

/**
 * Typed failure raised by every calculation in the engine.
 * <p>
 * Carries the {@link FinanceErrorKind}, the name of the offending field (when
 * one can be blamed) and the offending value, so the presentation layer can
 * build its own message.
 */
@Getter
public class FinanceException extends RuntimeException {
    private final FinanceErrorKind kind;
    private final String field;
    private final Double value;

    public FinanceException(FinanceErrorKind kind, String field, Double value, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
        this.value = value;
    }

    public static FinanceException invalidInput(String field, double value, String message) {
        return new FinanceException(FinanceErrorKind.INVALID_INPUT, field, value, message);
    }

    public static FinanceException invalidInput(String field, String message) {
        return new FinanceException(FinanceErrorKind.INVALID_INPUT, field, null, message);
    }

    public static FinanceException divisionByZero(String field) {
        return new FinanceException(FinanceErrorKind.DIVISION_BY_ZERO, field, 0.0,
                "Division by zero: " + field + " is zero");
    }

    public static FinanceException overflow(String operation, double value) {
        return new FinanceException(FinanceErrorKind.OVERFLOW, operation, value,
                "Calculation overflow in " + operation + ": " + value);
    }

    public static FinanceException convergenceFailed(String solver, String message) {
        return new FinanceException(FinanceErrorKind.CONVERGENCE_FAILED, solver, null, message);
    }

    /** True when the failure is of the given kind. */
    public boolean is(FinanceErrorKind k) {
        return kind == k;
    }
}
