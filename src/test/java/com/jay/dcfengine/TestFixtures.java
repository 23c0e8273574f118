package com.jay.dcfengine;

import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.DriverPath;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.FadeMethod;
import com.jay.dcfengine.model.enums.Provenance;
import com.jay.dcfengine.model.enums.TerminalMethod;

/**
 * Shared inputs: revenue 1000, 100 shares, net debt 50; 20% growth fading linearly to 3%
 * over five years, COGS 55% and SG&A 22% with D&A 3% (a 20% EBIT margin), 10% cost of
 * capital, Gordon terminal value.
 */
public final class TestFixtures {

    private TestFixtures() {}

    public static FinancialSnapshot snapshot() {
        return FinancialSnapshot.builder()
            .ticker("ACME")
            .currency("USD")
            .fiscalYear(2024)
            .revenue(1000)
            .netDebt(50)
            .sharesOutstanding(100)
            .build();
    }

    public static Assumptions.AssumptionsBuilder assumptions() {
        Assumptions.AssumptionsBuilder b = Assumptions.builder()
            .startGrowth(0.20)
            .terminalGrowth(0.03)
            .fadeMethod(FadeMethod.LINEAR)
            .horizonYears(5)
            .cogsPct(DriverPath.flat(0.55))
            .sgaPct(DriverPath.flat(0.22))
            .daPct(DriverPath.flat(0.03))
            .capexPct(DriverPath.flat(0.04))
            .nwcPct(DriverPath.flat(0.10))
            .sbcPct(DriverPath.flat(0.0))
            .taxRate(0.25)
            .costOfCapital(0.10)
            .terminalMethod(TerminalMethod.GORDON);
        for (AssumptionField field : AssumptionField.values()) {
            b.tag(field, Provenance.FILED);
        }
        return b;
    }
}
