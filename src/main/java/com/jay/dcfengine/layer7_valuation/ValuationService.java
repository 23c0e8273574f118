package com.jay.dcfengine.layer7_valuation;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.layer1_validation.ValuationValidator;
import com.jay.dcfengine.layer2_assumptions.AssumptionsFactory;
import com.jay.dcfengine.layer5_scenario.ScenarioRunner;
import com.jay.dcfengine.layer6_sensitivity.SensitivityAnalyzer;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.ScenarioSet;
import com.jay.dcfengine.model.SensitivityGrid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Full valuation run for one company: validate, value the three scenarios, then build the
 * sensitivity grid around the Base case. Pure computation; identical inputs give equal reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValuationService {

    private final ValuationValidator validator;
    private final AssumptionsFactory assumptionsFactory;
    private final ScenarioRunner scenarioRunner;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final EngineConfig config;

    /** Derives Base assumptions from the snapshot, then runs the pipeline. */
    public ValuationReport value(ValuationRequest request) {
        FinancialSnapshot snapshot = request.getSnapshot();
        int horizon = request.getHorizonYears() != null
            ? request.getHorizonYears() : config.defaults().getHorizonYears();
        log.info("Valuation requested for {}: {}y {} fade, {} terminal value",
            snapshot.getTicker(), horizon, request.getFadeMethod(), request.getTerminalMethod());

        Assumptions base = assumptionsFactory.baseCase(snapshot, horizon, request.getFadeMethod(),
            request.getTerminalMethod(), request.getExitMultiple());
        return value(snapshot, base, request.getCostOfCapitalAxis(), request.getTerminalGrowthAxis());
    }

    /** Runs the pipeline on caller-supplied Base assumptions with configured sensitivity axes. */
    public ValuationReport value(FinancialSnapshot snapshot, Assumptions base) {
        return value(snapshot, base, null, null);
    }

    public ValuationReport value(FinancialSnapshot snapshot, Assumptions base,
                                 List<Double> costOfCapitalAxis, List<Double> terminalGrowthAxis) {
        validator.validate(snapshot, base);

        ScenarioSet scenarios = scenarioRunner.run(snapshot, base);
        SensitivityGrid grid = (costOfCapitalAxis == null || terminalGrowthAxis == null)
            ? sensitivityAnalyzer.analyze(snapshot, scenarios.getBase())
            : sensitivityAnalyzer.analyze(snapshot, scenarios.getBase(), costOfCapitalAxis, terminalGrowthAxis);

        log.info("Valuation complete for {}: base value per share {} {}", snapshot.getTicker(),
            String.format(Locale.ROOT, "%.2f", scenarios.getBase().getValuePerShare()), snapshot.getCurrency());
        return ValuationReport.builder()
            .ticker(snapshot.getTicker())
            .currency(snapshot.getCurrency())
            .scenarios(scenarios)
            .sensitivity(grid)
            .build();
    }
}
