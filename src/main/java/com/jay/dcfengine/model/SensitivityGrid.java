package com.jay.dcfengine.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed-size table of per-share values: rows are cost-of-capital values, columns are
 * terminal-growth values. Every position holds a cell; undefined ones are N/A.
 */
public final class SensitivityGrid {

    private final List<Double> costOfCapitalAxis;
    private final List<Double> terminalGrowthAxis;
    private final SensitivityCell[][] cells;

    public SensitivityGrid(List<Double> costOfCapitalAxis, List<Double> terminalGrowthAxis,
                           SensitivityCell[][] cells) {
        if (cells.length != costOfCapitalAxis.size()) {
            throw new IllegalArgumentException("Row count " + cells.length
                + " does not match cost-of-capital axis size " + costOfCapitalAxis.size());
        }
        this.costOfCapitalAxis = List.copyOf(costOfCapitalAxis);
        this.terminalGrowthAxis = List.copyOf(terminalGrowthAxis);
        this.cells = new SensitivityCell[cells.length][];
        for (int r = 0; r < cells.length; r++) {
            if (cells[r].length != terminalGrowthAxis.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + cells[r].length
                    + " cells, expected " + terminalGrowthAxis.size());
            }
            this.cells[r] = cells[r].clone();
        }
    }

    public List<Double> getCostOfCapitalAxis() {
        return costOfCapitalAxis;
    }

    public List<Double> getTerminalGrowthAxis() {
        return terminalGrowthAxis;
    }

    public int rows() {
        return cells.length;
    }

    public int columns() {
        return terminalGrowthAxis.size();
    }

    public SensitivityCell cell(int row, int column) {
        return cells[row][column];
    }

    /** Cell at the given axis values, matched exactly. */
    public Optional<SensitivityCell> find(double costOfCapital, double terminalGrowth) {
        int r = costOfCapitalAxis.indexOf(costOfCapital);
        int c = terminalGrowthAxis.indexOf(terminalGrowth);
        if (r < 0 || c < 0) return Optional.empty();
        return Optional.of(cells[r][c]);
    }

    public long invalidCellCount() {
        return Arrays.stream(cells).flatMap(Arrays::stream).filter(c -> !c.valid()).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SensitivityGrid other)) return false;
        return costOfCapitalAxis.equals(other.costOfCapitalAxis)
            && terminalGrowthAxis.equals(other.terminalGrowthAxis)
            && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * costOfCapitalAxis.hashCode() + terminalGrowthAxis.hashCode())
            + Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WACC \\ g");
        for (Double g : terminalGrowthAxis) sb.append(String.format(Locale.ROOT, "\t%.4f", g));
        for (int r = 0; r < cells.length; r++) {
            sb.append(String.format(Locale.ROOT, "%n%.4f", costOfCapitalAxis.get(r)));
            for (SensitivityCell cell : cells[r]) sb.append('\t').append(cell.display());
        }
        return sb.toString();
    }
}
