package com.finance.calc.io;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a request for one calculation.
 * <p>
 * Example:
 *
 * <pre>
 * { "id": "car-loan", "type": "loan_payment",
 *   "params": { "principal": 20000, "annualRatePercent": 6.5, "termYears": 5 } }
 * </pre>
 *
 * {@code limits} optionally overrides the safety cutoffs for this request
 * ({@code maxMagnitude}, {@code maxExponent}).
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CalculationRequest {
    private String id;
    private String type;
    private Map<String, Object> params;
    private Map<String, Object> limits;

    public CalculationRequest(String id, String type, Map<String, Object> params) {
        this.id = id;
        this.type = type;
        this.params = params;
    }
}
