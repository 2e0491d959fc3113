package com.finance.calc.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.finance.calc.api.FinanceErrorKind;
import com.finance.calc.api.FinanceException;

import lombok.Data;

/**
 * Outcome of one {@link CalculationRequest}: either a value or a typed error.
 * A successful calculation with no answer (no payback, no mode) has
 * {@code success == true} and a null value.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CalculationResult {
    private String id;
    private String type;
    private boolean success;
    private Object value;
    private FinanceErrorKind errorKind;
    private String errorField;
    private String message;

    public static CalculationResult ok(String id, String type, Object value) {
        CalculationResult r = new CalculationResult();
        r.setId(id);
        r.setType(type);
        r.setSuccess(true);
        r.setValue(value);
        return r;
    }

    public static CalculationResult failed(String id, String type, FinanceException e) {
        CalculationResult r = new CalculationResult();
        r.setId(id);
        r.setType(type);
        r.setSuccess(false);
        r.setErrorKind(e.getKind());
        r.setErrorField(e.getField());
        r.setMessage(e.getMessage());
        return r;
    }
}
