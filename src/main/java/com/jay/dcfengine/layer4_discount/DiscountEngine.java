package com.jay.dcfengine.layer4_discount;

import com.jay.dcfengine.exception.DivisionByZeroException;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.exception.InvalidTerminalValueException;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.DiscountedValuation;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.ForecastYear;
import com.jay.dcfengine.model.enums.ExitMetric;
import com.jay.dcfengine.model.enums.TerminalMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Layer 4: Discount Engine.
 * End-of-year discounting of forecast free cash flow, terminal value, and the bridge from
 * enterprise value to value per share.
 */
@Slf4j
@Component
public class DiscountEngine {

    /** {@code df[i] = 1 / (1 + wacc)^(i + 1)}. */
    public List<Double> discountFactors(double costOfCapital, int years) {
        if (!(costOfCapital > 0)) {
            throw new InvalidAssumptionException(String.format(Locale.ROOT,
                "Cost of capital must be > 0, was %.4f", costOfCapital));
        }
        List<Double> factors = new ArrayList<>(years);
        for (int i = 0; i < years; i++) {
            factors.add(1.0 / Math.pow(1 + costOfCapital, i + 1));
        }
        return Collections.unmodifiableList(factors);
    }

    /**
     * Value of all cash flows beyond the horizon, as of the final forecast year.
     *
     * @throws InvalidTerminalValueException Gordon method with cost of capital at or below terminal growth
     * @throws InvalidAssumptionException    exit-multiple method without a positive multiple
     */
    public double terminalValue(List<ForecastYear> forecast, TerminalMethod method, double costOfCapital,
                                double terminalGrowth, Double exitMultiple, ExitMetric exitMetric) {
        if (forecast == null || forecast.isEmpty()) {
            throw new InvalidAssumptionException("Cannot compute terminal value of an empty forecast");
        }
        if (method == null) {
            throw new InvalidAssumptionException("Terminal value method is required");
        }
        ForecastYear last = forecast.get(forecast.size() - 1);
        return switch (method) {
            case GORDON -> {
                if (costOfCapital <= terminalGrowth) {
                    throw new InvalidTerminalValueException(costOfCapital, terminalGrowth);
                }
                yield last.getUnleveredFcf() * (1 + terminalGrowth) / (costOfCapital - terminalGrowth);
            }
            case EXIT_MULTIPLE -> {
                if (exitMultiple == null || !(exitMultiple > 0)) {
                    throw new InvalidAssumptionException("Exit-multiple terminal value needs a positive multiple, got "
                        + exitMultiple);
                }
                double metric = exitMetric == ExitMetric.EBITDA ? last.getEbitda() : last.getEbit();
                yield exitMultiple * metric;
            }
        };
    }

    /** Discounts the forecast under the assumptions' own cost of capital and terminal growth. */
    public DiscountedValuation discount(List<ForecastYear> forecast, Assumptions assumptions, FinancialSnapshot snapshot) {
        return discount(forecast, assumptions.getCostOfCapital(), assumptions.getTerminalGrowth(), assumptions, snapshot);
    }

    /**
     * Discounts the forecast at an explicit cost of capital and terminal growth; the terminal
     * method and exit multiple still come from the assumptions.
     */
    public DiscountedValuation discount(List<ForecastYear> forecast, double costOfCapital, double terminalGrowth,
                                        Assumptions assumptions, FinancialSnapshot snapshot) {
        if (forecast == null || forecast.isEmpty()) {
            throw new InvalidAssumptionException("Cannot discount an empty forecast");
        }
        List<Double> factors = discountFactors(costOfCapital, forecast.size());
        double terminalValue = terminalValue(forecast, assumptions.getTerminalMethod(), costOfCapital,
            terminalGrowth, assumptions.getExitMultiple(), assumptions.getExitMetric());

        List<ForecastYear> discounted = new ArrayList<>(forecast.size());
        double sumPv = 0;
        for (int i = 0; i < forecast.size(); i++) {
            ForecastYear year = forecast.get(i);
            double df = factors.get(i);
            double pv = year.getUnleveredFcf() * df;
            sumPv += pv;
            discounted.add(year.toBuilder().discountFactor(df).presentValue(pv).build());
        }

        double pvTerminal   = terminalValue * factors.get(factors.size() - 1);
        double enterprise   = sumPv + pvTerminal;
        double equity       = enterprise - snapshot.getNetDebt();
        double perShare     = perShare(equity, snapshot.getSharesOutstanding());

        log.debug("Discounted at WACC {} g {}: EV {} = PV(FCF) {} + PV(TV) {}; per share {}",
            costOfCapital, terminalGrowth, enterprise, sumPv, pvTerminal, perShare);

        return DiscountedValuation.builder()
            .forecast(Collections.unmodifiableList(discounted))
            .sumOfPresentValues(sumPv)
            .terminalValue(terminalValue)
            .pvTerminalValue(pvTerminal)
            .enterpriseValue(enterprise)
            .equityValue(equity)
            .valuePerShare(perShare)
            .build();
    }

    /** Re-prices a fixed forecast; used for sensitivity cells. */
    public double valuePerShare(List<ForecastYear> forecast, double costOfCapital, double terminalGrowth,
                                Assumptions assumptions, FinancialSnapshot snapshot) {
        return discount(forecast, costOfCapital, terminalGrowth, assumptions, snapshot).getValuePerShare();
    }

    public double perShare(double equityValue, double sharesOutstanding) {
        if (!(sharesOutstanding > 0)) {
            throw new DivisionByZeroException(String.format(Locale.ROOT,
                "Cannot compute value per share: share count is %.2f", sharesOutstanding));
        }
        return equityValue / sharesOutstanding;
    }
}
