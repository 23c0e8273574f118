package com.jay.dcfengine.model.enums;

public enum FadeMethod {
    LINEAR,      // equal steps from start to end
    PIECEWISE,   // fast fade over the first years, slower thereafter
    EXPONENTIAL  // stays elevated early, converges fast late
}
