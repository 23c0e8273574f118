package com.jay.dcfengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * One projected year of the operating forecast. Discount factor and present value stay at
 * zero until the forecast has been through the discount engine.
 */
@Value
@Builder(toBuilder = true)
public class ForecastYear {

    int yearIndex;           // 1-based position in the horizon
    Integer fiscalYear;
    double growthRate;

    double revenue;
    double cogs;             // excluding D&A
    double sga;
    double operatingMargin;  // EBIT / revenue
    double ebit;
    double depreciationAmortization;
    double ebitda;
    double taxes;
    double nopat;

    // Cash flow bridge
    double daAddback;
    double sbcAddback;
    double deltaNwc;
    double capex;
    double unleveredFcf;

    double discountFactor;
    double presentValue;
}
