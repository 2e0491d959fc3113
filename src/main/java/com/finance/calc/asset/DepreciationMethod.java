package com.finance.calc.asset;

import java.util.Locale;

public enum DepreciationMethod {
    STRAIGHT_LINE,
    DOUBLE_DECLINING_BALANCE;

    /**
     * Accepts the enum name or its dashed form, e.g. {@code straight-line}.
     */
    public static DepreciationMethod fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Depreciation method must not be null");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown depreciation method: " + s, e);
        }
    }
}
