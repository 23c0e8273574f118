package com.jay.dcfengine.layer6_sensitivity;

import com.jay.dcfengine.TestFixtures;
import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.layer2_assumptions.ConfidenceLabeler;
import com.jay.dcfengine.layer3_forecast.FadeScheduler;
import com.jay.dcfengine.layer3_forecast.ForecastBuilder;
import com.jay.dcfengine.layer4_discount.DiscountEngine;
import com.jay.dcfengine.layer5_scenario.ScenarioRunner;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.SensitivityGrid;
import com.jay.dcfengine.model.ValuationResult;
import com.jay.dcfengine.model.enums.ScenarioCase;
import com.jay.dcfengine.model.enums.TerminalMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SensitivityAnalyzer")
class SensitivityAnalyzerTest {

    private ExecutorService executor;
    private ScenarioRunner runner;
    private SensitivityAnalyzer analyzer;
    private FinancialSnapshot snapshot;

    @BeforeEach
    void setUp() {
        EngineConfig config = new EngineConfig();
        executor = Executors.newFixedThreadPool(4);
        DiscountEngine discountEngine = new DiscountEngine();
        runner = new ScenarioRunner(new ForecastBuilder(new FadeScheduler(config)), discountEngine,
            new ConfidenceLabeler(), config, executor);
        analyzer = new SensitivityAnalyzer(discountEngine, config, executor);
        snapshot = TestFixtures.snapshot();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ValuationResult base(Assumptions assumptions) {
        return runner.evaluate(snapshot, assumptions, ScenarioCase.BASE);
    }

    @Test
    void centreCellMatchesBaseValuation() {
        ValuationResult base = base(TestFixtures.assumptions().build());

        SensitivityGrid grid = analyzer.analyze(snapshot, base);

        assertThat(grid.rows()).isEqualTo(5);
        assertThat(grid.columns()).isEqualTo(5);
        assertThat(grid.getCostOfCapitalAxis().get(2)).isEqualTo(0.10);
        assertThat(grid.getTerminalGrowthAxis().get(2)).isEqualTo(0.03);
        assertThat(grid.cell(2, 2).valuePerShare()).isCloseTo(base.getValuePerShare(), within(1e-9));
        assertThat(grid.find(0.10, 0.03).orElseThrow().valid()).isTrue();
    }

    @Test
    void undefinedCellsAreMarkedNotAvailable() {
        ValuationResult base = base(TestFixtures.assumptions().build());

        SensitivityGrid grid = analyzer.analyze(snapshot, base, List.of(0.02, 0.03, 0.10), List.of(0.03, 0.04));

        assertThat(grid.cell(0, 0).valid()).isFalse();
        assertThat(grid.cell(0, 1).valid()).isFalse();
        assertThat(grid.cell(1, 0).valid()).isFalse();
        assertThat(grid.cell(1, 1).display()).isEqualTo("N/A");
        assertThat(grid.cell(2, 0).value()).isPresent();
        assertThat(grid.cell(2, 1).valid()).isTrue();
        assertThat(grid.invalidCellCount()).isEqualTo(4);
    }

    @Test
    void lowBaseCostOfCapitalMarksNonPositiveRowsNotAvailable() {
        // default axis around 1.5% in 1% steps reaches -0.5%
        ValuationResult base = base(TestFixtures.assumptions().costOfCapital(0.015).terminalGrowth(0.0).build());

        SensitivityGrid grid = analyzer.analyze(snapshot, base);

        assertThat(grid.getCostOfCapitalAxis().get(0)).isNegative();
        for (int c = 0; c < grid.columns(); c++) {
            assertThat(grid.cell(0, c).display()).isEqualTo("N/A");
        }
        assertThat(grid.cell(2, 2).valuePerShare()).isCloseTo(base.getValuePerShare(), within(1e-9));
        assertThat(grid.cell(1, 0).valid()).isTrue();
    }

    @Test
    void zeroCostOfCapitalIsNotAvailable() {
        ValuationResult base = base(TestFixtures.assumptions().build());

        SensitivityGrid grid = analyzer.analyze(snapshot, base, List.of(0.0, 0.10), List.of(-0.01, 0.03));

        assertThat(grid.cell(0, 0).valid()).isFalse();
        assertThat(grid.cell(0, 1).valid()).isFalse();
        assertThat(grid.cell(1, 1).valid()).isTrue();
        assertThat(grid.invalidCellCount()).isEqualTo(2);
    }

    @Test
    void valueFallsWithCostOfCapitalAndRisesWithGrowth() {
        SensitivityGrid grid = analyzer.analyze(snapshot, base(TestFixtures.assumptions().build()));

        for (int r = 1; r < grid.rows(); r++) {
            assertThat(grid.cell(r, 2).valuePerShare()).isLessThan(grid.cell(r - 1, 2).valuePerShare());
        }
        for (int c = 1; c < grid.columns(); c++) {
            assertThat(grid.cell(2, c).valuePerShare()).isGreaterThan(grid.cell(2, c - 1).valuePerShare());
        }
    }

    @Test
    void exitMultipleGridUsesBaseMethod() {
        Assumptions exit = TestFixtures.assumptions()
            .terminalMethod(TerminalMethod.EXIT_MULTIPLE).exitMultiple(10.0).build();
        ValuationResult base = base(exit);

        SensitivityGrid grid = analyzer.analyze(snapshot, base);

        assertThat(grid.cell(2, 2).valuePerShare()).isCloseTo(base.getValuePerShare(), within(1e-9));
        assertThat(grid.cell(2, 0).valuePerShare()).isEqualTo(grid.cell(2, 4).valuePerShare());
    }

    @Test
    void identicalInputsGiveEqualGrids() {
        ValuationResult base = base(TestFixtures.assumptions().build());

        assertThat(analyzer.analyze(snapshot, base)).isEqualTo(analyzer.analyze(snapshot, base));
    }

    @Test
    void centeredAxisIsSymmetric() {
        List<Double> axis = analyzer.centeredAxis(0.09, 0.01, 7);

        assertThat(axis).hasSize(7).isSorted();
        assertThat(axis.get(3)).isEqualTo(0.09);
        assertThat(axis.get(0)).isCloseTo(0.06, within(1e-12));
        assertThat(axis.get(6)).isCloseTo(0.12, within(1e-12));
    }

    @Test
    void rejectsMalformedAxes() {
        ValuationResult base = base(TestFixtures.assumptions().build());

        assertThatThrownBy(() -> analyzer.centeredAxis(0.1, 0.01, 4)).isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> analyzer.analyze(snapshot, base, List.of(), List.of(0.03)))
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> analyzer.analyze(snapshot, base, List.of(Double.NaN, 0.1), List.of(0.03)))
            .isInstanceOf(InvalidAssumptionException.class);
    }
}
