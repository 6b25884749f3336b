/* (C)2026 */
package com.ammann.ultrasonic.interpolation;

import com.ammann.ultrasonic.exception.DegenerateGeometryException;

/**
 * Maps values given at irregular 2-D positions onto a regular lattice.
 *
 * <p>Implementations must not extrapolate: every lattice position outside the convex
 * hull of the input positions receives {@link Double#NaN}.
 */
public interface ScatteredInterpolator
{
    /**
     * Interpolates the scattered samples at every {@code (xAxis[column], yAxis[row])}.
     *
     * @param x      sample x coordinates
     * @param y      sample y coordinates
     * @param values finite sample values, parallel to {@code x} and {@code y}
     * @param xAxis  lattice x positions, ascending
     * @param yAxis  lattice y positions, ascending
     * @return values indexed {@code [row][column]}, NaN outside the convex hull
     * @throws DegenerateGeometryException if the samples span no area
     */
    double[][] interpolate(double[] x, double[] y, double[] values, double[] xAxis, double[] yAxis);
}
