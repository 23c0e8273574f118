package com.jay.dcfengine.layer2_assumptions;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WaccCalculatorTest {

    private final WaccCalculator calculator = new WaccCalculator();

    @Test
    void buildsUpFromDefaults() {
        WaccCalculator.WaccBreakdown w = calculator.compute(new EngineConfig.Wacc(), 0.21);

        assertThat(w.costOfEquity()).isCloseTo(0.10, within(1e-12));
        assertThat(w.afterTaxCostOfDebt()).isCloseTo(0.0395, within(1e-12));
        assertThat(w.debtWeight()).isCloseTo(0.3 / 1.3, within(1e-12));
        assertThat(w.equityWeight() + w.debtWeight()).isCloseTo(1.0, within(1e-12));
        assertThat(w.wacc()).isCloseTo(0.10 / 1.3 + 0.0395 * 0.3 / 1.3, within(1e-12));
    }

    @Test
    void allEquityIsCostOfEquity() {
        assertThat(calculator.compute(0.03, 0.05, 1.2, 0.06, 0, 0.25).wacc()).isCloseTo(0.09, within(1e-12));
    }

    @Test
    void rejectsNegativeLeverageAndBadTaxRate() {
        assertThatThrownBy(() -> calculator.compute(0.04, 0.06, 1, 0.05, -0.1, 0.2))
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> calculator.compute(0.04, 0.06, 1, 0.05, 0.3, 1.0))
            .isInstanceOf(InvalidAssumptionException.class);
    }
}
