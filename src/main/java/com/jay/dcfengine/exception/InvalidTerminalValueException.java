package com.jay.dcfengine.exception;

import java.util.Locale;

/**
 * Gordon terminal value requested with a cost of capital at or below terminal growth,
 * where the perpetuity formula has no finite value.
 */
public class InvalidTerminalValueException extends ValuationException {

    private final double costOfCapital;
    private final double terminalGrowth;

    public InvalidTerminalValueException(double costOfCapital, double terminalGrowth) {
        super(String.format(Locale.ROOT, "Terminal value undefined: cost of capital %.4f must exceed terminal growth %.4f",
            costOfCapital, terminalGrowth));
        this.costOfCapital = costOfCapital;
        this.terminalGrowth = terminalGrowth;
    }

    public double getCostOfCapital() {
        return costOfCapital;
    }

    public double getTerminalGrowth() {
        return terminalGrowth;
    }
}
