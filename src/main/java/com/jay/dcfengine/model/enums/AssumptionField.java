package com.jay.dcfengine.model.enums;

/**
 * Numeric assumption fields that carry a provenance tag and therefore a confidence tier.
 */
public enum AssumptionField {
    START_GROWTH,
    TERMINAL_GROWTH,
    COGS_PCT,
    SGA_PCT,
    DA_PCT,
    CAPEX_PCT,
    NWC_PCT,
    SBC_PCT,
    TAX_RATE,
    COST_OF_CAPITAL,
    EXIT_MULTIPLE
}
