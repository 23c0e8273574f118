package com.jay.dcfengine.model;

import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.ConfidenceTier;
import com.jay.dcfengine.model.enums.ScenarioCase;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ValuationResult {

    ScenarioCase scenario;
    Assumptions assumptions;
    Map<AssumptionField, ConfidenceTier> confidence;

    List<ForecastYear> forecast;   // ascending by year index
    double terminalValue;
    double pvTerminalValue;
    double enterpriseValue;
    double equityValue;
    double valuePerShare;

    /** Share of enterprise value contributed by the terminal value. */
    public double terminalValueShare() {
        return enterpriseValue != 0 ? pvTerminalValue / enterpriseValue : 0;
    }
}
