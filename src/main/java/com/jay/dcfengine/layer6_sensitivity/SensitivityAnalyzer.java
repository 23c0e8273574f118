package com.jay.dcfengine.layer6_sensitivity;

import com.jay.dcfengine.config.EngineConfig;
import com.jay.dcfengine.exception.InvalidAssumptionException;
import com.jay.dcfengine.exception.InvalidTerminalValueException;
import com.jay.dcfengine.exception.ValuationException;
import com.jay.dcfengine.layer4_discount.DiscountEngine;
import com.jay.dcfengine.model.Assumptions;
import com.jay.dcfengine.model.FinancialSnapshot;
import com.jay.dcfengine.model.ForecastYear;
import com.jay.dcfengine.model.SensitivityCell;
import com.jay.dcfengine.model.SensitivityGrid;
import com.jay.dcfengine.model.ValuationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Layer 6: Sensitivity Analyzer.
 * Re-prices the Base forecast over a cost-of-capital x terminal-growth grid. Only the
 * discounting is repeated; the operating forecast is taken as-is from the Base result.
 * A cell whose terminal value is undefined, or whose cost of capital is not positive,
 * becomes N/A instead of failing the grid.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SensitivityAnalyzer {

    private final DiscountEngine discountEngine;
    private final EngineConfig config;
    private final ExecutorService valuationExecutor;

    /** Grid with configured axes centred on the Base cost of capital and terminal growth. */
    public SensitivityGrid analyze(FinancialSnapshot snapshot, ValuationResult base) {
        EngineConfig.Sensitivity cfg = config.sensitivity();
        Assumptions a = base.getAssumptions();
        return analyze(snapshot, base,
            centeredAxis(a.getCostOfCapital(), cfg.getCostOfCapitalStep(), cfg.getPoints()),
            centeredAxis(a.getTerminalGrowth(), cfg.getTerminalGrowthStep(), cfg.getPoints()));
    }

    public SensitivityGrid analyze(FinancialSnapshot snapshot, ValuationResult base,
                                   List<Double> costOfCapitalAxis, List<Double> terminalGrowthAxis) {
        if (costOfCapitalAxis == null || costOfCapitalAxis.isEmpty()
                || terminalGrowthAxis == null || terminalGrowthAxis.isEmpty()) {
            throw new InvalidAssumptionException("Sensitivity axes must not be empty");
        }
        for (Double wacc : costOfCapitalAxis) {
            if (wacc == null || !Double.isFinite(wacc)) {
                throw new InvalidAssumptionException("Cost-of-capital axis values must be finite, got " + wacc);
            }
        }
        for (Double g : terminalGrowthAxis) {
            if (g == null || !Double.isFinite(g)) {
                throw new InvalidAssumptionException("Terminal-growth axis values must be finite, got " + g);
            }
        }

        List<ForecastYear> forecast = base.getForecast();
        Assumptions assumptions = base.getAssumptions();
        int rows = costOfCapitalAxis.size();
        int cols = terminalGrowthAxis.size();
        SensitivityCell[][] cells = new SensitivityCell[rows][];

        // One task per row; each task writes only its own row array.
        List<CompletableFuture<Void>> tasks = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            final int row = r;
            final double wacc = costOfCapitalAxis.get(r);
            tasks.add(CompletableFuture.runAsync(() -> {
                SensitivityCell[] line = new SensitivityCell[cols];
                for (int c = 0; c < cols; c++) {
                    line[c] = price(forecast, wacc, terminalGrowthAxis.get(c), assumptions, snapshot);
                }
                cells[row] = line;
            }, valuationExecutor));
        }
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ValuationException("Sensitivity grid computation failed", cause);
        }

        SensitivityGrid grid = new SensitivityGrid(costOfCapitalAxis, terminalGrowthAxis, cells);
        long invalid = grid.invalidCellCount();
        if (invalid > 0) {
            log.warn("Sensitivity grid for {}: {} of {} cells N/A (cost of capital <= terminal growth or <= 0)",
                snapshot.getTicker(), invalid, rows * cols);
        }
        log.info("Sensitivity grid for {}: {}x{} computed", snapshot.getTicker(), rows, cols);
        return grid;
    }

    /**
     * Odd-length ascending axis whose middle element is exactly {@code center}.
     */
    public List<Double> centeredAxis(double center, double step, int points) {
        if (points < 1 || points % 2 == 0) {
            throw new InvalidAssumptionException("Sensitivity axis needs an odd, positive number of points, got " + points);
        }
        if (!(step > 0)) {
            throw new InvalidAssumptionException("Sensitivity axis step must be > 0, got " + step);
        }
        int half = points / 2;
        List<Double> axis = new ArrayList<>(points);
        for (int i = -half; i <= half; i++) {
            axis.add(i == 0 ? center : center + i * step);
        }
        return Collections.unmodifiableList(axis);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private SensitivityCell price(List<ForecastYear> forecast, double wacc, double growth,
                                  Assumptions assumptions, FinancialSnapshot snapshot) {
        if (wacc <= 0 || wacc <= growth) {
            return SensitivityCell.notAvailable(wacc, growth);
        }
        try {
            return SensitivityCell.of(wacc, growth,
                discountEngine.valuePerShare(forecast, wacc, growth, assumptions, snapshot));
        } catch (InvalidTerminalValueException e) {
            log.debug("Cell WACC {} g {} N/A: {}", wacc, growth, e.getMessage());
            return SensitivityCell.notAvailable(wacc, growth);
        }
    }
}
