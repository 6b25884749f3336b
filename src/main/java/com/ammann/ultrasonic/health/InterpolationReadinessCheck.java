/* (C)2026 */
package com.ammann.ultrasonic.health;

import com.ammann.ultrasonic.interpolation.ScatteredInterpolator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check that interpolates a constant field over a unit square and verifies
 * that the centre of the grid reproduces the constant.
 */
@Readiness
@ApplicationScoped
public class InterpolationReadinessCheck implements HealthCheck
{
    private static final Logger LOG = Logger.getLogger(InterpolationReadinessCheck.class);

    private static final String HEALTH_CHECK_NAME = "interpolation-engine";
    private static final double PROBE_VALUE = 0.5;
    private static final double PROBE_TOLERANCE = 1e-9;

    @Inject
    ScatteredInterpolator interpolator;

    @Override
    public HealthCheckResponse call()
    {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("interpolator", interpolator.getClass().getSimpleName());
        try {
            double[][] grid = interpolator.interpolate(
                    new double[]{0, 1, 0, 1},
                    new double[]{0, 0, 1, 1},
                    new double[]{PROBE_VALUE, PROBE_VALUE, PROBE_VALUE, PROBE_VALUE},
                    new double[]{0, 0.5, 1},
                    new double[]{0, 0.5, 1});
            double centre = grid[1][1];
            boolean ok = Math.abs(centre - PROBE_VALUE) <= PROBE_TOLERANCE;
            return builder.status(ok).withData("probe", String.valueOf(centre)).build();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Interpolation self-test failed");
            return builder.down().withData("error", String.valueOf(e.getMessage())).build();
        }
    }
}
