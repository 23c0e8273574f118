package com.jay.dcfengine.model.enums;

public enum TerminalMethod {
    GORDON,        // perpetuity growth on final-year free cash flow
    EXIT_MULTIPLE  // multiple applied to a final-year operating metric
}
