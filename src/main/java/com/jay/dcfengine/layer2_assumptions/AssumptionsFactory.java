package com.jay.dcfengine.layer2_assumptions;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.DriverPath;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.FadeMethod;
import com.jay.dcfengine.model.enums.Provenance;
import com.jay.dcfengine.model.enums.TerminalMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Derives Base-case assumptions from a financial snapshot.
 * Each value is tagged with where it came from: filed figures first, historical averages
 * next, configured norms and defaults last.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssumptionsFactory {

    private final EngineConfig config;
    private final WaccCalculator waccCalculator;
    private final ConfidenceLabeler labeler;

    public Assumptions baseCase(FinancialSnapshot snapshot, int horizonYears, FadeMethod fadeMethod,
                                TerminalMethod terminalMethod, Double exitMultiple) {
        if (fadeMethod == null || terminalMethod == null) {
            throw new InvalidAssumptionException("Fade method and terminal method are required");
        }
        EngineConfig.Defaults d = config.defaults();
        Assumptions.AssumptionsBuilder b = Assumptions.builder()
            .horizonYears(horizonYears)
            .fadeMethod(fadeMethod)
            .terminalMethod(terminalMethod);

        // ── Revenue growth ────────────────────────────────────────────────────
        Double cagr = revenueCagr(snapshot);
        if (cagr != null) {
            double capped = Math.max(-d.getMaxStartGrowth(), Math.min(d.getMaxStartGrowth(), cagr));
            b.startGrowth(capped).tag(AssumptionField.START_GROWTH, Provenance.HISTORICAL_AVERAGE);
        } else {
            b.startGrowth(d.getStartGrowth()).tag(AssumptionField.START_GROWTH, Provenance.HEURISTIC_DEFAULT);
        }
        b.terminalGrowth(d.getTerminalGrowth()).tag(AssumptionField.TERMINAL_GROWTH, Provenance.HEURISTIC_DEFAULT);

        // ── Cash flow intensities ─────────────────────────────────────────────
        double revenue = snapshot.getRevenue();
        double daPct = intensity(b, AssumptionField.DA_PCT, snapshot.getDepreciationAmortization(), revenue, d.getDaPct());
        intensity(b, AssumptionField.CAPEX_PCT, snapshot.getCapitalExpenditure(), revenue, d.getCapexPct());
        intensity(b, AssumptionField.SBC_PCT, snapshot.getStockBasedCompensation(), revenue, d.getSbcPct());
        intensity(b, AssumptionField.NWC_PCT, snapshot.getNetWorkingCapital(), revenue, d.getNwcPct());

        // ── Operating costs: filed base year fading to the historical margin ──
        double cogsStart;
        double sgaStart;
        Provenance costSource;
        if (snapshot.getCostOfRevenue() != null && snapshot.getSellingGeneralAdministrative() != null && revenue > 0) {
            cogsStart = snapshot.getCostOfRevenue() / revenue;
            sgaStart = snapshot.getSellingGeneralAdministrative() / revenue;
            costSource = Provenance.FILED;
        } else if (snapshot.getOperatingMargin() != null) {
            // only the margin is filed: split the implied cost base in the norm proportions
            double[] split = splitCosts(1 - snapshot.getOperatingMargin() - daPct, d.getCogsPct(), d.getSgaPct());
            cogsStart = split[0];
            sgaStart = split[1];
            costSource = Provenance.INTERPOLATED;
        } else {
            cogsStart = d.getCogsPct();
            sgaStart = d.getSgaPct();
            costSource = Provenance.INDUSTRY_NORM;
        }

        List<Double> marginHistory = snapshot.getOperatingMarginHistory();
        if (marginHistory != null && !marginHistory.isEmpty()) {
            double avgMargin = marginHistory.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
            double[] end = splitCosts(1 - avgMargin - daPct, cogsStart, sgaStart);
            Provenance source = labeler.weaker(costSource, Provenance.HISTORICAL_AVERAGE);
            b.cogsPct(new DriverPath(cogsStart, end[0])).tag(AssumptionField.COGS_PCT, source);
            b.sgaPct(new DriverPath(sgaStart, end[1])).tag(AssumptionField.SGA_PCT, source);
        } else {
            b.cogsPct(DriverPath.flat(cogsStart)).tag(AssumptionField.COGS_PCT, costSource);
            b.sgaPct(DriverPath.flat(sgaStart)).tag(AssumptionField.SGA_PCT, costSource);
        }

        // ── Tax and cost of capital ───────────────────────────────────────────
        Double filedTax = snapshot.getEffectiveTaxRate();
        double taxRate;
        if (filedTax != null && filedTax >= 0 && filedTax < 1) {
            taxRate = filedTax;
            b.tag(AssumptionField.TAX_RATE, Provenance.FILED);
        } else {
            taxRate = config.wacc().getTaxRate();
            b.tag(AssumptionField.TAX_RATE, Provenance.HEURISTIC_DEFAULT);
        }
        b.taxRate(taxRate);
        b.costOfCapital(waccCalculator.compute(config.wacc(), taxRate).wacc())
            .tag(AssumptionField.COST_OF_CAPITAL, Provenance.HEURISTIC_DEFAULT);

        // ── Exit multiple ─────────────────────────────────────────────────────
        if (exitMultiple != null) {
            b.exitMultiple(exitMultiple).tag(AssumptionField.EXIT_MULTIPLE, Provenance.HEURISTIC_DEFAULT);
        } else if (terminalMethod == TerminalMethod.EXIT_MULTIPLE) {
            b.exitMultiple(d.getExitMultiple()).tag(AssumptionField.EXIT_MULTIPLE, Provenance.INDUSTRY_NORM);
        }

        Assumptions assumptions = b.build();
        log.info("Base assumptions for {}: growth {} -> {}, COGS {}, SG&A {}, WACC {}, {} over {}y",
            snapshot.getTicker(), fmt(assumptions.getStartGrowth()), fmt(assumptions.getTerminalGrowth()),
            assumptions.getCogsPct(), assumptions.getSgaPct(), fmt(assumptions.getCostOfCapital()),
            terminalMethod, horizonYears);
        return assumptions;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** Compound annual growth from the oldest reported revenue to the base year; null when unknown. */
    Double revenueCagr(FinancialSnapshot snapshot) {
        List<Double> history = snapshot.getRevenueHistory();
        if (history == null || history.isEmpty()) return null;
        Double oldest = history.get(0);
        if (oldest == null || oldest <= 0 || snapshot.getRevenue() <= 0) return null;
        int years = history.size();
        return Math.pow(snapshot.getRevenue() / oldest, 1.0 / years) - 1;
    }

    /** Splits a total cost share between COGS and SG&A in the proportion of the two weights. */
    static double[] splitCosts(double totalCost, double cogsWeight, double sgaWeight) {
        double weights = cogsWeight + sgaWeight;
        double cogsShare = weights > 0 ? cogsWeight / weights : 0.5;
        return new double[] {totalCost * cogsShare, totalCost * (1 - cogsShare)};
    }

    private double intensity(Assumptions.AssumptionsBuilder b, AssumptionField field,
                           Double filedAmount, double revenue, double norm) {
        double pct;
        Provenance source;
        if (filedAmount != null && revenue > 0) {
            // capex is often reported as a negative outflow
            pct = (field == AssumptionField.CAPEX_PCT ? Math.abs(filedAmount) : filedAmount) / revenue;
            source = Provenance.FILED;
        } else {
            pct = norm;
            source = Provenance.INDUSTRY_NORM;
        }
        DriverPath path = DriverPath.flat(pct);
        switch (field) {
            case DA_PCT -> b.daPct(path);
            case CAPEX_PCT -> b.capexPct(path);
            case SBC_PCT -> b.sbcPct(path);
            case NWC_PCT -> b.nwcPct(path);
            default -> throw new IllegalArgumentException("Not an intensity driver: " + field);
        }
        b.tag(field, source);
        return pct;
    }

    private static String fmt(double rate) {
        return String.format(Locale.ROOT, "%.2f%%", rate * 100);
    }
}
