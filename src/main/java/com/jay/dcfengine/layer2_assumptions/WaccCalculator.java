package com.jay.dcfengine.layer2_assumptions;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Cost of capital build-up: CAPM cost of equity, after-tax cost of debt, weights from the
 * debt-to-equity ratio.
 */
@Slf4j
@Component
public class WaccCalculator {

    public record WaccBreakdown(double costOfEquity, double afterTaxCostOfDebt,
                                double equityWeight, double debtWeight, double wacc) {}

    public WaccBreakdown compute(EngineConfig.Wacc inputs, double taxRate) {
        return compute(inputs.getRiskFreeRate(), inputs.getEquityRiskPremium(), inputs.getBeta(),
            inputs.getCostOfDebt(), inputs.getDebtToEquity(), taxRate);
    }

    public WaccBreakdown compute(double riskFreeRate, double equityRiskPremium, double beta,
                                 double costOfDebt, double debtToEquity, double taxRate) {
        if (debtToEquity < 0) {
            throw new InvalidAssumptionException(String.format(Locale.ROOT,
                "Debt-to-equity ratio must be >= 0, was %.4f", debtToEquity));
        }
        if (taxRate < 0 || taxRate >= 1) {
            throw new InvalidAssumptionException(String.format(Locale.ROOT,
                "Tax rate must be in [0, 1), was %.4f", taxRate));
        }
        double costOfEquity = riskFreeRate + beta * equityRiskPremium;
        double afterTaxCostOfDebt = costOfDebt * (1 - taxRate);
        double debtWeight = debtToEquity / (1 + debtToEquity);
        double equityWeight = 1 / (1 + debtToEquity);
        double wacc = equityWeight * costOfEquity + debtWeight * afterTaxCostOfDebt;

        log.debug("WACC build-up: Ke={} Kd(after tax)={} We={} Wd={} -> {}",
            costOfEquity, afterTaxCostOfDebt, equityWeight, debtWeight, wacc);
        return new WaccBreakdown(costOfEquity, afterTaxCostOfDebt, equityWeight, debtWeight, wacc);
    }
}
