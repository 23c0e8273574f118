package com.jay.dcfengine.layer7_valuation;

import com.jay.dcfengine.model.ScenarioSet;
import com.jay.dcfengine.model.SensitivityGrid;
import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.ConfidenceTier;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** Everything the reporting and export layers consume for one run. */
@Value
@Builder
public class ValuationReport {
    String ticker;
    String currency;
    ScenarioSet scenarios;
    SensitivityGrid sensitivity;

    public Map<AssumptionField, ConfidenceTier> baseConfidence() {
        return scenarios.getBase().getConfidence();
    }
}
