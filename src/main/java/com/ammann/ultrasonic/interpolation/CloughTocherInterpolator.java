/* (C)2026 */
package com.ammann.ultrasonic.interpolation;

import com.ammann.ultrasonic.exception.DegenerateGeometryException;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Piecewise-cubic, C1-smooth interpolation over a Delaunay triangulation
 * (Clough-Tocher split).
 *
 * <p>Each triangle is split at its centroid into three sub-triangles carrying cubic
 * Bezier patches. Vertex values and estimated vertex gradients fix the corner and edge
 * control points; the interior control points are chosen so that the cross-boundary
 * derivative varies linearly along every edge, which makes adjacent patches join with
 * continuous first derivatives. Positions outside every triangle receive NaN.
 *
 * <p>Samples sharing the exact same position are merged into one vertex carrying their
 * mean value.
 */
public class CloughTocherInterpolator implements ScatteredInterpolator
{
    private static final Logger LOG = Logger.getLogger(CloughTocherInterpolator.class);

    private static final double BARYCENTRIC_TOLERANCE = 1e-10;
    private static final double AXIS_TOLERANCE = 1e-9;

    private final GradientEstimator gradientEstimator;

    public CloughTocherInterpolator()
    {
        this(new GradientEstimator());
    }

    public CloughTocherInterpolator(GradientEstimator gradientEstimator)
    {
        this.gradientEstimator = gradientEstimator;
    }

    @Override
    public double[][] interpolate(double[] x, double[] y, double[] values, double[] xAxis, double[] yAxis)
    {
        if (x.length != y.length || x.length != values.length) {
            throw new IllegalArgumentException("Sample arrays differ in length");
        }

        Samples samples = Samples.merge(x, y, values);
        if (samples.size() < 3) {
            throw new DegenerateGeometryException(
                    String.format("Need at least 3 distinct positions, got %d", samples.size()));
        }

        DelaunayTriangulation triangulation = DelaunayTriangulation.of(samples.x, samples.y);
        if (triangulation.isEmpty()) {
            throw new DegenerateGeometryException(
                    String.format("All %d positions are collinear", samples.size()));
        }

        double[][] gradients = gradientEstimator.estimate(triangulation, samples.x, samples.y, samples.values);

        double[][] grid = new double[yAxis.length][xAxis.length];
        for (double[] row : grid) {
            Arrays.fill(row, Double.NaN);
        }

        double extent = Math.max(span(xAxis), span(yAxis));
        double axisTolerance = AXIS_TOLERANCE * Math.max(1.0, extent);
        int filled = 0;

        for (int t = 0; t < triangulation.triangleCount(); t++) {
            CubicPatch patch = CubicPatch.of(triangulation, t, samples, gradients);

            int firstColumn = firstAtLeast(xAxis, patch.minX() - axisTolerance);
            int lastColumn = lastAtMost(xAxis, patch.maxX() + axisTolerance);
            int firstRow = firstAtLeast(yAxis, patch.minY() - axisTolerance);
            int lastRow = lastAtMost(yAxis, patch.maxY() + axisTolerance);

            for (int row = firstRow; row <= lastRow; row++) {
                for (int column = firstColumn; column <= lastColumn; column++) {
                    if (!Double.isNaN(grid[row][column])) {
                        continue;
                    }
                    double[] b = patch.barycentric(xAxis[column], yAxis[row]);
                    if (b[0] >= -BARYCENTRIC_TOLERANCE && b[1] >= -BARYCENTRIC_TOLERANCE
                            && b[2] >= -BARYCENTRIC_TOLERANCE) {
                        grid[row][column] = patch.value(b);
                        filled++;
                    }
                }
            }
        }

        LOG.debugf("Clough-Tocher interpolation: %d samples, %d triangles, %d of %d cells inside hull",
                samples.size(), triangulation.triangleCount(), filled, xAxis.length * yAxis.length);
        return grid;
    }

    private static double span(double[] axis)
    {
        return axis.length == 0 ? 0.0 : axis[axis.length - 1] - axis[0];
    }

    private static int firstAtLeast(double[] axis, double value)
    {
        int index = Arrays.binarySearch(axis, value);
        if (index < 0) {
            index = -index - 1;
        }
        while (index > 0 && axis[index - 1] >= value) {
            index--;
        }
        return index;
    }

    private static int lastAtMost(double[] axis, double value)
    {
        int index = Arrays.binarySearch(axis, value);
        if (index < 0) {
            index = -index - 2;
        }
        while (index + 1 < axis.length && axis[index + 1] <= value) {
            index++;
        }
        return index;
    }

    /** Distinct sample positions with duplicate values averaged. */
    private static final class Samples
    {
        final double[] x;
        final double[] y;
        final double[] values;

        private Samples(double[] x, double[] y, double[] values)
        {
            this.x = x;
            this.y = y;
            this.values = values;
        }

        int size()
        {
            return x.length;
        }

        static Samples merge(double[] x, double[] y, double[] values)
        {
            Map<Position, double[]> merged = new LinkedHashMap<>();
            for (int i = 0; i < x.length; i++) {
                double[] acc = merged.computeIfAbsent(new Position(x[i], y[i]), p -> new double[2]);
                acc[0] += values[i];
                acc[1] += 1.0;
            }
            if (merged.size() < x.length) {
                LOG.debugf("Merged %d duplicate sample positions", x.length - merged.size());
            }

            double[] mx = new double[merged.size()];
            double[] my = new double[merged.size()];
            double[] mv = new double[merged.size()];
            int i = 0;
            for (Map.Entry<Position, double[]> entry : merged.entrySet()) {
                mx[i] = entry.getKey().x();
                my[i] = entry.getKey().y();
                mv[i] = entry.getValue()[0] / entry.getValue()[1];
                i++;
            }
            return new Samples(mx, my, mv);
        }

        private record Position(double x, double y)
        {
        }
    }

    /** Control net of the three cubic sub-patches of one triangle. */
    private static final class CubicPatch
    {
        private final double x0, y0, x1, y1, x2, y2;
        private final double det;

        private double c3000, c0300, c0030, c0003;
        private double c2100, c2010, c1200, c0210, c1020, c0120;
        private double c2001, c0201, c0021;
        private double c1101, c1011, c0111;
        private double c1002, c0102, c0012;

        private CubicPatch(double x0, double y0, double x1, double y1, double x2, double y2)
        {
            this.x0 = x0;
            this.y0 = y0;
            this.x1 = x1;
            this.y1 = y1;
            this.x2 = x2;
            this.y2 = y2;
            this.det = (x1 - x0) * (y2 - y0) - (x2 - x0) * (y1 - y0);
        }

        static CubicPatch of(DelaunayTriangulation triangulation, int t, Samples samples, double[][] gradients)
        {
            int[] v = triangulation.triangle(t);
            double[] px = samples.x;
            double[] py = samples.y;
            CubicPatch patch = new CubicPatch(px[v[0]], py[v[0]], px[v[1]], py[v[1]], px[v[2]], py[v[2]]);

            double e12x = patch.x1 - patch.x0, e12y = patch.y1 - patch.y0;
            double e23x = patch.x2 - patch.x1, e23y = patch.y2 - patch.y1;
            double e31x = patch.x0 - patch.x2, e31y = patch.y0 - patch.y2;

            double f1 = samples.values[v[0]];
            double f2 = samples.values[v[1]];
            double f3 = samples.values[v[2]];
            double[] g1 = gradients[v[0]];
            double[] g2 = gradients[v[1]];
            double[] g3 = gradients[v[2]];

            double df12 = g1[0] * e12x + g1[1] * e12y;
            double df21 = -(g2[0] * e12x + g2[1] * e12y);
            double df23 = g2[0] * e23x + g2[1] * e23y;
            double df32 = -(g3[0] * e23x + g3[1] * e23y);
            double df31 = g3[0] * e31x + g3[1] * e31y;
            double df13 = -(g1[0] * e31x + g1[1] * e31y);

            patch.c3000 = f1;
            patch.c2100 = (df12 + 3 * f1) / 3;
            patch.c2010 = (df13 + 3 * f1) / 3;
            patch.c0300 = f2;
            patch.c1200 = (df21 + 3 * f2) / 3;
            patch.c0210 = (df23 + 3 * f2) / 3;
            patch.c0030 = f3;
            patch.c1020 = (df31 + 3 * f3) / 3;
            patch.c0120 = (df32 + 3 * f3) / 3;

            patch.c2001 = (patch.c2100 + patch.c2010 + patch.c3000) / 3;
            patch.c0201 = (patch.c1200 + patch.c0300 + patch.c0210) / 3;
            patch.c0021 = (patch.c1020 + patch.c0120 + patch.c0030) / 3;

            double[] g = new double[3];
            for (int k = 0; k < 3; k++) {
                int neighbor = triangulation.neighbor(t, k);
                if (neighbor == -1) {
                    g[k] = -0.5;
                    continue;
                }
                int[] w = triangulation.triangle(neighbor);
                double cx = (px[w[0]] + px[w[1]] + px[w[2]]) / 3;
                double cy = (py[w[0]] + py[w[1]] + py[w[2]]) / 3;
                double[] c = patch.barycentric(cx, cy);
                if (k == 0) {
                    g[k] = (2 * c[2] + c[1] - 1) / (2 - 3 * c[2] - 3 * c[1]);
                } else if (k == 1) {
                    g[k] = (2 * c[0] + c[2] - 1) / (2 - 3 * c[0] - 3 * c[2]);
                } else {
                    g[k] = (2 * c[1] + c[0] - 1) / (2 - 3 * c[1] - 3 * c[0]);
                }
            }

            patch.c0111 = (g[0] * (-patch.c0300 + 3 * patch.c0210 - 3 * patch.c0120 + patch.c0030)
                    + (-patch.c0300 + 2 * patch.c0210 - patch.c0120 + patch.c0021 + patch.c0201)) / 2;
            patch.c1011 = (g[1] * (-patch.c0030 + 3 * patch.c1020 - 3 * patch.c2010 + patch.c3000)
                    + (-patch.c0030 + 2 * patch.c1020 - patch.c2010 + patch.c2001 + patch.c0021)) / 2;
            patch.c1101 = (g[2] * (-patch.c3000 + 3 * patch.c2100 - 3 * patch.c1200 + patch.c0300)
                    + (-patch.c3000 + 2 * patch.c2100 - patch.c1200 + patch.c2001 + patch.c0201)) / 2;

            patch.c1002 = (patch.c1101 + patch.c1011 + patch.c2001) / 3;
            patch.c0102 = (patch.c1101 + patch.c0111 + patch.c0201) / 3;
            patch.c0012 = (patch.c1011 + patch.c0111 + patch.c0021) / 3;
            patch.c0003 = (patch.c1002 + patch.c0102 + patch.c0012) / 3;

            return patch;
        }

        double minX()
        {
            return Math.min(x0, Math.min(x1, x2));
        }

        double maxX()
        {
            return Math.max(x0, Math.max(x1, x2));
        }

        double minY()
        {
            return Math.min(y0, Math.min(y1, y2));
        }

        double maxY()
        {
            return Math.max(y0, Math.max(y1, y2));
        }

        double[] barycentric(double x, double y)
        {
            double b1 = ((x - x0) * (y2 - y0) - (x2 - x0) * (y - y0)) / det;
            double b2 = ((x1 - x0) * (y - y0) - (x - x0) * (y1 - y0)) / det;
            return new double[]{1.0 - b1 - b2, b1, b2};
        }

        double value(double[] b)
        {
            double minval = Math.min(b[0], Math.min(b[1], b[2]));
            double b1 = b[0] - minval;
            double b2 = b[1] - minval;
            double b3 = b[2] - minval;
            double b4 = 3 * minval;

            if (b[0] == minval) {
                return b4 * b4 * b4 * c0003 + 3 * b4 * b4 * b2 * c0102 + 3 * b4 * b4 * b3 * c0012
                        + 3 * b4 * b2 * b2 * c0201 + 6 * b4 * b2 * b3 * c0111 + 3 * b4 * b3 * b3 * c0021
                        + b2 * b2 * b2 * c0300 + 3 * b2 * b2 * b3 * c0210 + 3 * b2 * b3 * b3 * c0120
                        + b3 * b3 * b3 * c0030;
            }
            if (b[1] == minval) {
                return b1 * b1 * b1 * c3000 + 3 * b1 * b1 * b3 * c2010 + 3 * b1 * b1 * b4 * c2001
                        + 3 * b1 * b3 * b3 * c1020 + 6 * b1 * b3 * b4 * c1011 + 3 * b1 * b4 * b4 * c1002
                        + b3 * b3 * b3 * c0030 + 3 * b3 * b3 * b4 * c0021 + 3 * b3 * b4 * b4 * c0012
                        + b4 * b4 * b4 * c0003;
            }
            return b1 * b1 * b1 * c3000 + 3 * b1 * b1 * b2 * c2100 + 3 * b1 * b1 * b4 * c2001
                    + 3 * b1 * b2 * b2 * c1200 + 6 * b1 * b2 * b4 * c1101 + 3 * b1 * b4 * b4 * c1002
                    + b2 * b2 * b2 * c0300 + 3 * b2 * b2 * b4 * c0201 + 3 * b2 * b4 * b4 * c0102
                    + b4 * b4 * b4 * c0003;
        }
    }
}
