package com.jay.dcfengine.layer3_forecast;

import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.DriverPath;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.ForecastYear;
import com.jay.dcfengine.model.enums.FadeMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Layer 3: Forecast Builder.
 * Projects revenue and the free cash flow bridge year by year from the base snapshot.
 *
 * Per year:
 *   revenue  = previous revenue * (1 + growth)
 *   EBIT     = revenue - COGS - SG&A - D&A;  EBITDA = EBIT + D&A
 *   NOPAT    = EBIT - max(0, EBIT * tax rate)
 *   UFCF     = NOPAT + D&A + SBC - ΔNWC - capex
 * with COGS (excluding D&A), SG&A, D&A, SBC and capex as % of revenue and ΔNWC as % of the revenue change.
 * Discounting is left to the discount engine.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastBuilder {

    private final FadeScheduler fadeScheduler;

    /** Growth fades with the growth method; each cost driver fades on its own with the margin method. */
    public DriverSchedule schedule(Assumptions a) {
        int years = a.getHorizonYears();
        if (a.getCogsPct() == null || a.getSgaPct() == null) {
            throw new InvalidAssumptionException("COGS and SG&A paths are required");
        }
        FadeMethod marginMethod = a.getMarginFadeMethod();
        return new DriverSchedule(
            fadeScheduler.schedule(a.getStartGrowth(), a.getTerminalGrowth(), years, a.getFadeMethod()),
            fade(a.getCogsPct(), years, marginMethod),
            fade(a.getSgaPct(), years, marginMethod),
            fade(a.getDaPct(), years, marginMethod),
            fade(a.getCapexPct(), years, marginMethod),
            fade(a.getNwcPct(), years, marginMethod),
            fade(a.getSbcPct(), years, marginMethod));
    }

    public List<ForecastYear> build(FinancialSnapshot snapshot, Assumptions assumptions) {
        return build(snapshot, assumptions, schedule(assumptions));
    }

    public List<ForecastYear> build(FinancialSnapshot snapshot, Assumptions assumptions, DriverSchedule drivers) {
        if (!(snapshot.getRevenue() > 0)) {
            throw new InvalidAssumptionException(String.format(Locale.ROOT,
                "Base revenue must be > 0, was %.2f", snapshot.getRevenue()));
        }
        if (drivers.growth() == null || drivers.growth().isEmpty()) {
            throw new InvalidAssumptionException("Growth path is empty");
        }
        int years = drivers.years();
        requireLength("COGS", drivers.cogsPct(), years);
        requireLength("SG&A", drivers.sgaPct(), years);
        requireLength("D&A", drivers.daPct(), years);
        requireLength("capex", drivers.capexPct(), years);
        requireLength("working capital", drivers.nwcPct(), years);
        requireLength("SBC", drivers.sbcPct(), years);

        double taxRate = assumptions.getTaxRate();
        List<ForecastYear> forecast = new ArrayList<>(years);
        double previousRevenue = snapshot.getRevenue();

        for (int i = 0; i < years; i++) {
            double growth  = drivers.growth().get(i);
            double revenue = previousRevenue * (1 + growth);

            double cogs    = revenue * drivers.cogsPct().get(i);
            double sga     = revenue * drivers.sgaPct().get(i);
            double da      = revenue * drivers.daPct().get(i);
            double ebit    = revenue - cogs - sga - da;
            double taxes   = Math.max(0, ebit * taxRate);
            double nopat   = ebit - taxes;
            double sbc     = revenue * drivers.sbcPct().get(i);
            double dNwc    = (revenue - previousRevenue) * drivers.nwcPct().get(i);
            double capex   = revenue * drivers.capexPct().get(i);
            double ufcf    = nopat + da + sbc - dNwc - capex;

            forecast.add(ForecastYear.builder()
                .yearIndex(i + 1)
                .fiscalYear(snapshot.getFiscalYear() != null ? snapshot.getFiscalYear() + i + 1 : null)
                .growthRate(growth)
                .revenue(revenue)
                .cogs(cogs)
                .sga(sga)
                .operatingMargin(ebit / revenue)
                .ebit(ebit)
                .depreciationAmortization(da)
                .ebitda(ebit + da)
                .taxes(taxes)
                .nopat(nopat)
                .daAddback(da)
                .sbcAddback(sbc)
                .deltaNwc(dNwc)
                .capex(capex)
                .unleveredFcf(ufcf)
                .build());
            previousRevenue = revenue;
        }

        log.debug("Forecast for {}: {} years, final revenue {}, final UFCF {}",
            snapshot.getTicker(), years, previousRevenue, forecast.get(years - 1).getUnleveredFcf());
        return Collections.unmodifiableList(forecast);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private List<Double> fade(DriverPath path, int years, FadeMethod method) {
        DriverPath p = path != null ? path : DriverPath.flat(0);
        return fadeScheduler.schedule(p.start(), p.end(), years, method);
    }

    private static void requireLength(String driver, List<Double> path, int years) {
        if (path == null || path.size() != years) {
            throw new InvalidAssumptionException(String.format(Locale.ROOT,
                "%s path has %d entries, growth path has %d", driver, path == null ? 0 : path.size(), years));
        }
    }
}
