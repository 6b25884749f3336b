/* (C)2026 */
package com.ammann.ultrasonic.config;

import com.ammann.ultrasonic.interpolation.CloughTocherInterpolator;
import com.ammann.ultrasonic.interpolation.GradientEstimator;
import com.ammann.ultrasonic.interpolation.ScatteredInterpolator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * CDI producer for the scattered-data interpolator used by the spatial interpolation stage.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>stress.gradient.tolerance</li>
 *   <li>stress.gradient.max-iterations</li>
 * </ul>
 */
@ApplicationScoped
public class InterpolatorProducer {

    @ConfigProperty(name = "stress.gradient.tolerance", defaultValue = "1e-6")
    double gradientTolerance;

    @ConfigProperty(name = "stress.gradient.max-iterations", defaultValue = "400")
    int gradientMaxIterations;

    /**
     * Produces the piecewise cubic C1 interpolator.
     *
     * @return stateless interpolator shared by all requests
     */
    @Produces
    @ApplicationScoped
    public ScatteredInterpolator createInterpolator() {
        return new CloughTocherInterpolator(new GradientEstimator(gradientTolerance, gradientMaxIterations));
    }
}
