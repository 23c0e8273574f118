package com.jay.dcfengine.model.enums;

public enum ScenarioCase {
    BASE,
    BULL,
    BEAR;

    /** Lower-case key used by downstream reporting ("base", "bull", "bear"). */
    public String key() {
        return name().toLowerCase();
    }
}
