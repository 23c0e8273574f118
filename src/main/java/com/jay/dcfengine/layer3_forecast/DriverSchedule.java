package com.jay.dcfengine.layer3_forecast;

import java.util.List;

/**
 * Materialised per-year driver paths, one entry per forecast year.
 */
public record DriverSchedule(
        List<Double> growth,
        List<Double> cogsPct,
        List<Double> sgaPct,
        List<Double> daPct,
        List<Double> capexPct,
        List<Double> nwcPct,
        List<Double> sbcPct) {

    public int years() {
        return growth == null ? 0 : growth.size();
    }
}
