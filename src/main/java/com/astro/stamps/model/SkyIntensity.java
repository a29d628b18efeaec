package com.astro.stamps.model;

import java.util.Arrays;

/**
 * Separable sky background. The grid is sampled through 1-based row and
 * column lookups and scaled per row, so the same background can be reported
 * on a sub-grid of a larger canvas.
 */
public final class SkyIntensity {

    private final double[][] grid;
    private final int[] rowLookup;
    private final int[] columnLookup;
    private final double[] rowScale;

    public SkyIntensity(double[][] grid, int[] rowLookup, int[] columnLookup, double[] rowScale) {
        if (grid.length == 0 || grid[0].length == 0) {
            throw new IllegalArgumentException("Sky grid is empty");
        }
        if (rowLookup.length != rowScale.length) {
            throw new IllegalArgumentException("Sky row lookup has " + rowLookup.length
                    + " entries but row scale has " + rowScale.length);
        }
        int gridH = grid.length, gridW = grid[0].length;
        for (double[] row : grid) {
            if (row.length != gridW) throw new IllegalArgumentException("Sky grid is ragged");
        }
        for (int r : rowLookup) {
            if (r < 1 || r > gridH) throw new IllegalArgumentException("Sky row lookup out of range: " + r);
        }
        for (int c : columnLookup) {
            if (c < 1 || c > gridW) throw new IllegalArgumentException("Sky column lookup out of range: " + c);
        }
        this.grid = deepCopy(grid);
        this.rowLookup = rowLookup.clone();
        this.columnLookup = columnLookup.clone();
        this.rowScale = rowScale.clone();
    }

    /** A constant background over an {@code h} x {@code w} canvas with identity lookups and unit scale. */
    public static SkyIntensity constant(double level, int h, int w) {
        double[][] grid = new double[h][w];
        for (double[] row : grid) Arrays.fill(row, level);
        int[] rows = new int[h];
        for (int i = 0; i < h; i++) rows[i] = i + 1;
        int[] cols = new int[w];
        for (int j = 0; j < w; j++) cols[j] = j + 1;
        double[] scale = new double[h];
        Arrays.fill(scale, 1.0);
        return new SkyIntensity(grid, rows, cols, scale);
    }

    /** Background at zero-based canvas position ({@code i}, {@code j}). */
    public double get(int i, int j) {
        return rowScale[i] * grid[rowLookup[i] - 1][columnLookup[j] - 1];
    }

    /** Number of canvas rows the lookups cover. */
    public int height() {
        return rowLookup.length;
    }

    /** Number of canvas columns the lookups cover. */
    public int width() {
        return columnLookup.length;
    }

    public double[][] getGrid() {
        return deepCopy(grid);
    }

    public int[] getRowLookup() {
        return rowLookup.clone();
    }

    public int[] getColumnLookup() {
        return columnLookup.clone();
    }

    public double[] getRowScale() {
        return rowScale.clone();
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] copy = new double[src.length][];
        for (int i = 0; i < src.length; i++) copy[i] = src[i].clone();
        return copy;
    }
}
