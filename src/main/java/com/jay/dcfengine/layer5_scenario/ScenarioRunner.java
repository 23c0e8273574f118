package com.jay.dcfengine.layer5_scenario;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.ValuationException;
import com.jay.dcfengine.layer2_assumptions.ConfidenceLabeler;
import com.jay.dcfengine.layer3_forecast.ForecastBuilder;
import com.jay.dcfengine.layer4_discount.DiscountEngine;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.DiscountedValuation;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.ForecastYear;
import com.jay.dcfengine.model.ScenarioSet;
import com.jay.dcfengine.model.ValuationResult;
import com.jay.dcfengine.model.enums.AssumptionField;
import com.jay.dcfengine.model.enums.ConfidenceTier;
import com.jay.dcfengine.model.enums.Provenance;
import com.jay.dcfengine.model.enums.ScenarioCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Layer 5: Scenario Runner.
 * Values Base, Bull and Bear independently. Bull and Bear are pure shifts of the Base
 * assumptions; nothing is shared between the three computations except immutable inputs.
 * One failing scenario fails the run: downstream reporting always expects all three.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenarioRunner {

    private final ForecastBuilder forecastBuilder;
    private final DiscountEngine discountEngine;
    private final ConfidenceLabeler labeler;
    private final EngineConfig config;
    private final ExecutorService valuationExecutor;

    public ScenarioSet run(FinancialSnapshot snapshot, Assumptions base) {
        log.info("Running Base/Bull/Bear scenarios for {}", snapshot.getTicker());

        Map<ScenarioCase, CompletableFuture<ValuationResult>> futures = new EnumMap<>(ScenarioCase.class);
        for (ScenarioCase scenario : ScenarioCase.values()) {
            Assumptions assumptions = derive(base, scenario);
            futures.put(scenario, CompletableFuture.supplyAsync(
                () -> evaluate(snapshot, assumptions, scenario), valuationExecutor));
        }

        Map<ScenarioCase, ValuationResult> results = new EnumMap<>(ScenarioCase.class);
        for (Map.Entry<ScenarioCase, CompletableFuture<ValuationResult>> e : futures.entrySet()) {
            try {
                results.put(e.getKey(), e.getValue().join());
            } catch (CompletionException ex) {
                futures.values().forEach(f -> f.cancel(true));
                log.error("{} scenario failed for {} — aborting run: {}",
                    e.getKey(), snapshot.getTicker(), ex.getCause().getMessage());
                throw unwrap(ex);
            }
        }

        ScenarioSet set = ScenarioSet.builder()
            .base(results.get(ScenarioCase.BASE))
            .bull(results.get(ScenarioCase.BULL))
            .bear(results.get(ScenarioCase.BEAR))
            .build();
        log.info("Scenarios for {}: bear {} / base {} / bull {} per share, terminal value {}% of base EV",
            snapshot.getTicker(), fmt(set.getBear().getValuePerShare()), fmt(set.getBase().getValuePerShare()),
            fmt(set.getBull().getValuePerShare()), fmt(set.getBase().terminalValueShare() * 100));
        return set;
    }

    /**
     * Assumptions for a scenario: Base as given, Bull/Bear shifted by the configured deltas.
     * Shifted fields are re-tagged as heuristic since the shift itself is a rule of thumb.
     */
    public Assumptions derive(Assumptions base, ScenarioCase scenario) {
        EngineConfig.Delta delta = switch (scenario) {
            case BASE -> null;
            case BULL -> config.scenarios().getBull();
            case BEAR -> config.scenarios().getBear();
        };
        if (delta == null) return base;

        Assumptions.AssumptionsBuilder b = base.toBuilder();
        if (delta.getGrowthShift() != 0) {
            b.startGrowth(base.getStartGrowth() + delta.getGrowthShift())
                .tag(AssumptionField.START_GROWTH, Provenance.HEURISTIC_DEFAULT);
        }
        if (delta.getMarginShift() != 0 && base.getSgaPct() != null) {
            // a wider margin is a lighter overhead line; COGS keeps its filed trajectory
            b.sgaPct(base.getSgaPct().shift(-delta.getMarginShift()))
                .tag(AssumptionField.SGA_PCT, Provenance.HEURISTIC_DEFAULT);
        }
        if (delta.getCostOfCapitalShift() != 0) {
            b.costOfCapital(base.getCostOfCapital() + delta.getCostOfCapitalShift())
                .tag(AssumptionField.COST_OF_CAPITAL, Provenance.HEURISTIC_DEFAULT);
        }
        if (delta.getTerminalGrowthShift() != 0) {
            b.terminalGrowth(base.getTerminalGrowth() + delta.getTerminalGrowthShift())
                .tag(AssumptionField.TERMINAL_GROWTH, Provenance.HEURISTIC_DEFAULT);
        }
        return b.build();
    }

    /** Forecast, discount and label one scenario. */
    public ValuationResult evaluate(FinancialSnapshot snapshot, Assumptions assumptions, ScenarioCase scenario) {
        Map<AssumptionField, ConfidenceTier> confidence = labeler.annotate(assumptions);
        List<ForecastYear> forecast = forecastBuilder.build(snapshot, assumptions);
        DiscountedValuation valuation = discountEngine.discount(forecast, assumptions, snapshot);

        log.debug("{} scenario for {}: EV {} equity {} per share {}", scenario, snapshot.getTicker(),
            valuation.getEnterpriseValue(), valuation.getEquityValue(), valuation.getValuePerShare());

        return ValuationResult.builder()
            .scenario(scenario)
            .assumptions(assumptions)
            .confidence(confidence)
            .forecast(valuation.getForecast())
            .terminalValue(valuation.getTerminalValue())
            .pvTerminalValue(valuation.getPvTerminalValue())
            .enterpriseValue(valuation.getEnterpriseValue())
            .equityValue(valuation.getEquityValue())
            .valuePerShare(valuation.getValuePerShare())
            .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static RuntimeException unwrap(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException re) return re;
        return new ValuationException("Scenario computation failed", cause);
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
