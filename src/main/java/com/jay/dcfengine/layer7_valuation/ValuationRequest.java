package com.jay.dcfengine.layer7_valuation;

import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.enums.FadeMethod;
import com.jay.dcfengine.model.enums.TerminalMethod;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Run parameters for valuing one company when the Base assumptions are derived from
 * its snapshot. Null horizon and axes fall back to engine.yaml.
 */
@Value
@Builder
public class ValuationRequest {
    @NonNull FinancialSnapshot snapshot;
    Integer horizonYears;
    @Builder.Default
    FadeMethod fadeMethod = FadeMethod.LINEAR;
    @Builder.Default
    TerminalMethod terminalMethod = TerminalMethod.GORDON;
    Double exitMultiple;
    List<Double> costOfCapitalAxis;
    List<Double> terminalGrowthAxis;
}
