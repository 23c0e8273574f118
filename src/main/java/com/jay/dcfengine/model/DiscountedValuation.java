package com.jay.dcfengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of discounting a forecast: rows with discount factors filled in plus the
 * enterprise-to-equity bridge.
 */
@Value
@Builder
public class DiscountedValuation {
    List<ForecastYear> forecast;
    double sumOfPresentValues;
    double terminalValue;
    double pvTerminalValue;
    double enterpriseValue;
    double equityValue;
    double valuePerShare;
}
