package com.jay.dcfengine.model;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * One grid cell: the per-share value at a (cost of capital, terminal growth) pair,
 * or N/A where the terminal value is undefined.
 */
public record SensitivityCell(double costOfCapital, double terminalGrowth, double valuePerShare, boolean valid) {

    public static SensitivityCell of(double costOfCapital, double terminalGrowth, double valuePerShare) {
        return new SensitivityCell(costOfCapital, terminalGrowth, valuePerShare, true);
    }

    public static SensitivityCell notAvailable(double costOfCapital, double terminalGrowth) {
        return new SensitivityCell(costOfCapital, terminalGrowth, Double.NaN, false);
    }

    public OptionalDouble value() {
        return valid ? OptionalDouble.of(valuePerShare) : OptionalDouble.empty();
    }

    /** Display form: the value with two decimals, or "N/A". */
    public String display() {
        return valid ? String.format(Locale.ROOT, "%.2f", valuePerShare) : "N/A";
    }
}
