/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.enumeration.InterpolationStatus;
import com.ammann.ultrasonic.exception.DegenerateGeometryException;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.interpolation.ScatteredInterpolator;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.InterpolatedGrid;
import com.ammann.ultrasonic.model.InterpolationResult;
import com.ammann.ultrasonic.model.MeasurementPoint;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Maps the scattered {@code (x, y, index)} cloud onto a regular grid for heatmap rendering.
 *
 * <p>Only points with a finite index and finite coordinates take part. The grid spans the bounding box of those points
 * with {@code ceil((max - min) / step) + 1} positions per axis, each axis capped at
 * {@code stress.grid.max-cells-per-axis} (500 by default) to bound memory and compute.
 * Values come from the injected {@link ScatteredInterpolator}; cells outside the convex
 * hull stay missing.
 *
 * <p>Fewer than three finite points, or points that span no area, are reported as an
 * unavailable result rather than an exception.
 */
@ApplicationScoped
public class SpatialInterpolationService
{

    private static final Logger LOG = Logger.getLogger(SpatialInterpolationService.class);

    static final int MIN_POINTS_FOR_INTERPOLATION = 3;
    static final int DEFAULT_MAX_CELLS_PER_AXIS = 500;

    @Inject
    ScatteredInterpolator interpolator;

    @ConfigProperty(name = "stress.grid.max-cells-per-axis", defaultValue = "500")
    int maxCellsPerAxis = DEFAULT_MAX_CELLS_PER_AXIS;

    /**
     * Interpolates the index field onto a regular grid.
     *
     * @param points     measurement positions
     * @param index      index values parallel to {@code points}
     * @param meshStepMm grid spacing in millimeters, must be finite and positive
     * @return the grid, or the reason none was produced
     * @throws ValidationException if the mesh step is not a positive finite number
     */
    public InterpolationResult interpolate(List<MeasurementPoint> points, DerivedField index, double meshStepMm)
    {
        if (!Double.isFinite(meshStepMm) || meshStepMm <= 0) {
            throw ValidationException.invalidParameter("meshStepMm", meshStepMm, "positive value");
        }
        if (points.size() != index.size()) {
            throw new IllegalArgumentException(String.format(
                    "Point count %d does not match index count %d", points.size(), index.size()));
        }

        int valid = 0;
        for (int i = 0; i < points.size(); i++) {
            if (isUsable(points.get(i), index, i)) {
                valid++;
            }
        }
        if (valid < MIN_POINTS_FOR_INTERPOLATION) {
            String message = String.format(
                    "Interpolation unavailable: need at least %d valid points, got %d",
                    MIN_POINTS_FOR_INTERPOLATION, valid);
            LOG.warn(message);
            return InterpolationResult.unavailable(InterpolationStatus.INSUFFICIENT_DATA, valid, message);
        }

        double[] x = new double[valid];
        double[] y = new double[valid];
        double[] z = new double[valid];
        int j = 0;
        for (int i = 0; i < points.size(); i++) {
            if (!isUsable(points.get(i), index, i)) {
                continue;
            }
            x[j] = points.get(i).x();
            y[j] = points.get(i).y();
            z[j] = index.get(i);
            j++;
        }

        double[] xAxis = axis(x, meshStepMm);
        double[] yAxis = axis(y, meshStepMm);

        try {
            double[][] values = interpolator.interpolate(x, y, z, xAxis, yAxis);
            LOG.debugf("Interpolated %d points onto %dx%d grid (step %.3f mm)",
                    valid, xAxis.length, yAxis.length, meshStepMm);
            return InterpolationResult.available(new InterpolatedGrid(xAxis, yAxis, values), valid);
        } catch (DegenerateGeometryException e) {
            String message = "Interpolation unavailable: " + e.getMessage();
            LOG.warn(message);
            return InterpolationResult.unavailable(InterpolationStatus.DEGENERATE_GEOMETRY, valid, message);
        }
    }

    private static boolean isUsable(MeasurementPoint point, DerivedField index, int i)
    {
        return !index.isMissing(i) && Double.isFinite(point.x()) && Double.isFinite(point.y());
    }

    /**
     * Number of grid positions along an axis spanning {@code [min, max]}.
     */
    int axisLength(double min, double max, double step)
    {
        double cells = Math.ceil((max - min) / step) + 1;
        return (int) Math.max(1, Math.min(cells, maxCellsPerAxis));
    }

    /** Evenly spaced positions from the minimum to the maximum coordinate, both inclusive. */
    private double[] axis(double[] coordinates, double step)
    {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double c : coordinates) {
            min = Math.min(min, c);
            max = Math.max(max, c);
        }

        int length = axisLength(min, max, step);
        double[] axis = new double[length];
        if (length == 1) {
            axis[0] = min;
            return axis;
        }
        double spacing = (max - min) / (length - 1);
        for (int i = 0; i < length; i++) {
            axis[i] = min + i * spacing;
        }
        axis[length - 1] = max;
        return axis;
    }
}
