package com.jay.dcfengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Base-period facts for one company, as normalised by the retrieval layer.
 * Amounts are in reporting currency units; ratios are decimals (0.25 = 25%).
 * Optional fields are null when the filings did not provide them.
 */
@Value
@Builder(toBuilder = true)
public class FinancialSnapshot {

    String ticker;
    @Builder.Default
    String currency = "USD";
    Integer fiscalYear;              // base fiscal year; forecast years continue from here

    // Income statement
    double revenue;
    @Builder.Default
    List<Double> revenueHistory = List.of();        // prior annual revenues, oldest first
    Double costOfRevenue;                            // COGS excluding D&A
    Double sellingGeneralAdministrative;
    Double operatingMargin;                          // EBIT / revenue for the base year
    @Builder.Default
    List<Double> operatingMarginHistory = List.of(); // prior annual EBIT margins
    Double effectiveTaxRate;

    // Cash flow bridge
    Double depreciationAmortization;
    Double capitalExpenditure;
    Double stockBasedCompensation;
    Double netWorkingCapital;

    // Capital structure
    @Builder.Default
    double netDebt = 0;
    double sharesOutstanding;
}
