/* (C)2026 */
package com.ammann.ultrasonic.model;

import java.util.Arrays;
import java.util.stream.Stream;

/**
 * Regular lattice of interpolated index values.
 *
 * <p>{@code values[row][column]} belongs to position {@code (xAxis[column], yAxis[row])}.
 * Cells outside the convex hull of the input points hold {@link DerivedField#MISSING}.
 * The grid copies its arrays on construction and on every accessor call.
 */
public record InterpolatedGrid(double[] xAxis, double[] yAxis, double[][] values) {

    public InterpolatedGrid {
        xAxis = xAxis.clone();
        yAxis = yAxis.clone();
        values = deepCopy(values);
    }

    @Override
    public double[] xAxis() {
        return xAxis.clone();
    }

    @Override
    public double[] yAxis() {
        return yAxis.clone();
    }

    @Override
    public double[][] values() {
        return deepCopy(values);
    }

    public int columns() {
        return xAxis.length;
    }

    public int rows() {
        return yAxis.length;
    }

    public boolean isMissing(int row, int column) {
        return !Double.isFinite(values[row][column]);
    }

    /** {@code true} where the cell holds no value. */
    public boolean[][] missingMask() {
        boolean[][] mask = new boolean[rows()][columns()];
        for (int row = 0; row < rows(); row++) {
            for (int column = 0; column < columns(); column++) {
                mask[row][column] = isMissing(row, column);
            }
        }
        return mask;
    }

    public double[] finiteValues() {
        return Stream.of(values)
                .flatMapToDouble(Arrays::stream)
                .filter(Double::isFinite)
                .toArray();
    }

    private static double[][] deepCopy(double[][] source) {
        return Arrays.stream(source)
                .map(double[]::clone)
                .toArray(double[][]::new);
    }
}
