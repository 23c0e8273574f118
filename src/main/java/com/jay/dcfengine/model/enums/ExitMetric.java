package com.jay.dcfengine.model.enums;

/** Final-year metric the exit multiple is applied to. */
public enum ExitMetric {
    EBIT,
    EBITDA
}
