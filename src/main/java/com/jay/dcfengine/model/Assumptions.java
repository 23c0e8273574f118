package com.jay.dcfengine.model;

import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.ExitMetric;
import com.jay.dcfengine.model.enums.FadeMethod;
import com.jay.dcfengine.model.enums.Provenance;
import com.jay.dcfengine.model.enums.TerminalMethod;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Driver assumptions for one scenario. Immutable: scenario variants are produced with
 * {@code toBuilder()}, never by mutating a shared instance.
 */
@Value
@Builder(toBuilder = true)
public class Assumptions {

    // Revenue growth
    double startGrowth;
    double terminalGrowth;
    FadeMethod fadeMethod;
    int horizonYears;

    // Cost and intensity drivers (% of revenue; NWC as % of revenue change)
    DriverPath cogsPct;      // cost of goods sold excluding D&A
    DriverPath sgaPct;
    @Builder.Default
    DriverPath daPct = DriverPath.flat(0);
    @Builder.Default
    DriverPath capexPct = DriverPath.flat(0);
    @Builder.Default
    DriverPath nwcPct = DriverPath.flat(0);
    @Builder.Default
    DriverPath sbcPct = DriverPath.flat(0);
    @Builder.Default
    FadeMethod marginFadeMethod = FadeMethod.LINEAR;
    double taxRate;

    // Discounting
    double costOfCapital;
    TerminalMethod terminalMethod;
    Double exitMultiple;
    @Builder.Default
    ExitMetric exitMetric = ExitMetric.EBIT;

    @Singular("tag")
    Map<AssumptionField, Provenance> provenance;

    public Provenance provenanceOf(AssumptionField field) {
        return provenance.get(field);
    }
}
