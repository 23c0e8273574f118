package com.jay.dcfengine.layer4_discount;

import com.jay.dcfengine.TestFixtures;
import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.DivisionByZeroException;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.exception.InvalidTerminalValueException;
import com.jay.dcfengine.layer3_forecast.FadeScheduler;
import com.jay.dcfengine.layer3_forecast.ForecastBuilder;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.DiscountedValuation;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.ForecastYear;
import com.jay.dcfengine.model.enums.ExitMetric;
import com.jay.dcfengine.model.enums.TerminalMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DiscountEngine")
class DiscountEngineTest {

    private DiscountEngine engine;
    private FinancialSnapshot snapshot;
    private Assumptions assumptions;
    private List<ForecastYear> forecast;

    @BeforeEach
    void setUp() {
        engine = new DiscountEngine();
        snapshot = TestFixtures.snapshot();
        assumptions = TestFixtures.assumptions().build();
        forecast = new ForecastBuilder(new FadeScheduler(new EngineConfig())).build(snapshot, assumptions);
    }

    @Test
    void discountFactorsStrictlyDecrease() {
        List<Double> factors = engine.discountFactors(0.08, 10);

        assertThat(factors.get(0)).isCloseTo(1 / 1.08, within(1e-12));
        for (int i = 1; i < factors.size(); i++) {
            assertThat(factors.get(i)).isLessThan(factors.get(i - 1));
        }
    }

    @Test
    void gordonExampleBridgesToValuePerShare() {
        DiscountedValuation v = engine.discount(forecast, assumptions, snapshot);

        double lastFcf = forecast.get(4).getUnleveredFcf();
        assertThat(v.getTerminalValue()).isCloseTo(lastFcf * 1.03 / (0.10 - 0.03), within(1e-6));
        assertThat(v.getPvTerminalValue()).isCloseTo(v.getTerminalValue() / Math.pow(1.10, 5), within(1e-6));

        double sumPv = 0;
        for (int i = 0; i < 5; i++) {
            sumPv += forecast.get(i).getUnleveredFcf() / Math.pow(1.10, i + 1);
        }
        assertThat(v.getSumOfPresentValues()).isCloseTo(sumPv, within(1e-6));
        assertThat(v.getEnterpriseValue()).isCloseTo(sumPv + v.getPvTerminalValue(), within(1e-6));
        assertThat(v.getEquityValue()).isCloseTo(v.getEnterpriseValue() - 50, within(1e-9));
        assertThat(v.getValuePerShare()).isCloseTo(v.getEquityValue() / 100, within(1e-9));
    }

    @Test
    void discountedRowsCarryFactorAndPresentValue() {
        DiscountedValuation v = engine.discount(forecast, assumptions, snapshot);

        assertThat(v.getForecast()).hasSize(5).allSatisfy(y -> {
            assertThat(y.getDiscountFactor()).isCloseTo(1 / Math.pow(1.10, y.getYearIndex()), within(1e-12));
            assertThat(y.getPresentValue()).isCloseTo(y.getUnleveredFcf() * y.getDiscountFactor(), within(1e-9));
        });
        // input rows stay undiscounted
        assertThat(forecast.get(0).getDiscountFactor()).isZero();
    }

    @Test
    void gordonRejectsCostOfCapitalAtTerminalGrowth() {
        assertThatThrownBy(() -> engine.terminalValue(forecast, TerminalMethod.GORDON, 0.03, 0.03, null, null))
            .isInstanceOfSatisfying(InvalidTerminalValueException.class, e -> {
                assertThat(e.getCostOfCapital()).isEqualTo(0.03);
                assertThat(e.getTerminalGrowth()).isEqualTo(0.03);
            })
            .hasMessageContaining("0.0300");
    }

    @Test
    void gordonRejectsCostOfCapitalBelowTerminalGrowth() {
        Assumptions inverted = TestFixtures.assumptions().costOfCapital(0.04).terminalGrowth(0.05).build();

        assertThatThrownBy(() -> engine.discount(forecast, inverted, snapshot))
            .isInstanceOf(InvalidTerminalValueException.class);
    }

    @Test
    void exitMultipleAppliesToFinalYearMetric() {
        ForecastYear last = forecast.get(4);

        assertThat(engine.terminalValue(forecast, TerminalMethod.EXIT_MULTIPLE, 0.10, 0.03, 8.0, ExitMetric.EBIT))
            .isCloseTo(8.0 * last.getEbit(), within(1e-9));
        assertThat(engine.terminalValue(forecast, TerminalMethod.EXIT_MULTIPLE, 0.10, 0.03, 8.0, ExitMetric.EBITDA))
            .isCloseTo(8.0 * last.getEbitda(), within(1e-9));
    }

    @Test
    void exitMultipleIgnoresTerminalGrowth() {
        Assumptions exit = TestFixtures.assumptions()
            .terminalMethod(TerminalMethod.EXIT_MULTIPLE).exitMultiple(12.0)
            .costOfCapital(0.03).terminalGrowth(0.03)
            .build();

        assertThat(engine.discount(forecast, exit, snapshot).getTerminalValue())
            .isCloseTo(12.0 * forecast.get(4).getEbit(), within(1e-9));
    }

    @Test
    void exitMultipleRequiresPositiveMultiple() {
        assertThatThrownBy(() -> engine.terminalValue(forecast, TerminalMethod.EXIT_MULTIPLE, 0.10, 0.03, null, ExitMetric.EBIT))
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> engine.terminalValue(forecast, TerminalMethod.EXIT_MULTIPLE, 0.10, 0.03, -2.0, ExitMetric.EBIT))
            .isInstanceOf(InvalidAssumptionException.class);
    }

    @Test
    void rejectsNonPositiveShareCount() {
        FinancialSnapshot noShares = snapshot.toBuilder().sharesOutstanding(0).build();

        assertThatThrownBy(() -> engine.discount(forecast, assumptions, noShares))
            .isInstanceOf(DivisionByZeroException.class);
    }

    @Test
    void rejectsNonPositiveCostOfCapital() {
        assertThatThrownBy(() -> engine.discountFactors(0, 5))
            .isInstanceOf(InvalidAssumptionException.class);
    }

    @Test
    void valuePerShareMatchesFullDiscount() {
        double direct = engine.valuePerShare(forecast, 0.09, 0.02, assumptions, snapshot);

        assertThat(direct).isEqualTo(engine.discount(forecast, 0.09, 0.02, assumptions, snapshot).getValuePerShare());
        assertThat(direct).isGreaterThan(0);
    }
}
