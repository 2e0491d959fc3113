package com.finance.calc.safety;

import java.util.Map;

import lombok.Getter;

/**
 * Policy cutoffs applied by {@link SafeMath}.
 * <p>
 * Neither value is derived from IEEE-754 limits. {@code maxMagnitude} keeps
 * monetary inputs far enough from {@link Double#MAX_VALUE} that chained
 * multiplications cannot reach infinity; {@code maxExponent} rejects exponents
 * too large to be a meaningful financial horizon.
 */
@Getter
public final class SafetyLimits {
    public static final double DEFAULT_MAX_MAGNITUDE = 1e15;
    public static final double DEFAULT_MAX_EXPONENT = 100.0;

    public static final SafetyLimits DEFAULT = new SafetyLimits(DEFAULT_MAX_MAGNITUDE, DEFAULT_MAX_EXPONENT);

    private final double maxMagnitude;
    private final double maxExponent;

    public SafetyLimits(double maxMagnitude, double maxExponent) {
        if (!(maxMagnitude > 0) || Double.isInfinite(maxMagnitude))
            throw new IllegalArgumentException("maxMagnitude must be positive and finite: " + maxMagnitude);
        if (!(maxExponent > 0) || Double.isInfinite(maxExponent))
            throw new IllegalArgumentException("maxExponent must be positive and finite: " + maxExponent);
        this.maxMagnitude = maxMagnitude;
        this.maxExponent = maxExponent;
    }

    /**
     * Reads limits from a property map, falling back to the defaults for
     * missing keys. Recognised keys: {@code maxMagnitude}, {@code maxExponent}.
     */
    public static SafetyLimits fromProperties(Map<String, Object> props) {
        if (props == null || props.isEmpty())
            return DEFAULT;
        return new SafetyLimits(
                getDouble(props, "maxMagnitude", DEFAULT_MAX_MAGNITUDE),
                getDouble(props, "maxExponent", DEFAULT_MAX_EXPONENT));
    }

    public SafetyLimits withMaxMagnitude(double value) {
        return new SafetyLimits(value, maxExponent);
    }

    public SafetyLimits withMaxExponent(double value) {
        return new SafetyLimits(maxMagnitude, value);
    }

    private static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    @Override
    public String toString() {
        return "SafetyLimits[maxMagnitude=" + maxMagnitude + ", maxExponent=" + maxExponent + "]";
    }
}
