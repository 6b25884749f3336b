/* (C)2026 */
package com.ammann.ultrasonic.interpolation;

import org.jboss.logging.Logger;

/**
 * Estimates the gradient of a scattered function at each triangulation vertex by
 * minimizing the second derivative of the piecewise-cubic interpolant along every edge.
 *
 * <p>Gauss-Seidel sweeps solve one 2x2 system per vertex until the largest relative
 * gradient change drops below the tolerance or the sweep budget runs out. Exact for
 * linear functions; a constant function yields zero gradients.
 */
public class GradientEstimator
{
    private static final Logger LOG = Logger.getLogger(GradientEstimator.class);

    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 400;

    private final double tolerance;
    private final int maxIterations;

    public GradientEstimator()
    {
        this(DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS);
    }

    public GradientEstimator(double tolerance, int maxIterations)
    {
        if (tolerance <= 0 || maxIterations <= 0) {
            throw new IllegalArgumentException("Gradient tolerance and iteration budget must be positive");
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * @return gradients indexed {@code [point][0 = d/dx, 1 = d/dy]}
     */
    public double[][] estimate(DelaunayTriangulation triangulation, double[] x, double[] y, double[] values)
    {
        int n = x.length;
        int[][] adjacency = triangulation.vertexNeighbors();
        double[][] gradient = new double[n][2];

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double error = 0.0;

            for (int i = 0; i < n; i++) {
                double q00 = 0.0, q01 = 0.0, q11 = 0.0;
                double s0 = 0.0, s1 = 0.0;

                for (int j : adjacency[i]) {
                    double ex = x[j] - x[i];
                    double ey = y[j] - y[i];
                    double length = Math.hypot(ex, ey);
                    double l3 = length * length * length;
                    double df2 = -ex * gradient[j][0] - ey * gradient[j][1];
                    double rhs = 6.0 * (values[i] - values[j]) - 2.0 * df2;

                    q00 += 4.0 * ex * ex / l3;
                    q01 += 4.0 * ex * ey / l3;
                    q11 += 4.0 * ey * ey / l3;
                    s0 += rhs * ex / l3;
                    s1 += rhs * ey / l3;
                }

                double det = q00 * q11 - q01 * q01;
                if (det == 0.0 || !Double.isFinite(det)) {
                    continue;
                }
                double r0 = (q11 * s0 - q01 * s1) / det;
                double r1 = (-q01 * s0 + q00 * s1) / det;

                double change = Math.max(Math.abs(gradient[i][0] + r0), Math.abs(gradient[i][1] + r1));
                gradient[i][0] = -r0;
                gradient[i][1] = -r1;

                change /= Math.max(1.0, Math.max(Math.abs(r0), Math.abs(r1)));
                error = Math.max(error, change);
            }

            if (error < tolerance) {
                LOG.debugf("Gradient estimation converged after %d sweeps over %d points", iteration + 1, n);
                return gradient;
            }
        }

        LOG.debugf("Gradient estimation stopped after %d sweeps without reaching tolerance %.1e",
                Integer.valueOf(maxIterations), Double.valueOf(tolerance));
        return gradient;
    }

    public double getTolerance()
    {
        return tolerance;
    }

    public int getMaxIterations()
    {
        return maxIterations;
    }
}
