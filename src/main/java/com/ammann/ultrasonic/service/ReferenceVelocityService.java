/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.config.ReferenceSettings;
import com.ammann.ultrasonic.config.RoiBounds;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.MeasurementPoint;
import com.ammann.ultrasonic.model.ReferenceVelocity;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Determines the unstressed reference velocity.
 *
 * <p>A fixed value is used as supplied. A region of interest yields the arithmetic mean of
 * the finite velocities of all points inside the closed rectangle. When the region holds no
 * such point, the configured default {@code stress.reference.fallback-velocity} (5900 m/s
 * unless overridden) is substituted and a warning is attached to the result.
 */
@ApplicationScoped
public class ReferenceVelocityService
{

    private static final Logger LOG = Logger.getLogger(ReferenceVelocityService.class);

    static final double DEFAULT_FALLBACK_VELOCITY = 5900.0;

    @ConfigProperty(name = "stress.reference.fallback-velocity", defaultValue = "5900.0")
    double fallbackVelocity = DEFAULT_FALLBACK_VELOCITY;

    /**
     * Resolves the reference velocity for a dataset. Neither argument is modified.
     *
     * @param points     measurement positions
     * @param velocities velocities parallel to {@code points}
     * @param settings   strategy and its parameters
     * @return the reference velocity with its provenance
     * @throws ValidationException if the settings are incomplete or malformed
     */
    public ReferenceVelocity resolve(List<MeasurementPoint> points, DerivedField velocities, ReferenceSettings settings)
    {
        if (settings == null || settings.mode() == null) {
            throw ValidationException.missingParameter("referenceMode", "longitudinal mode");
        }
        if (points.size() != velocities.size()) {
            throw new IllegalArgumentException(String.format(
                    "Point count %d does not match velocity count %d", points.size(), velocities.size()));
        }

        return switch (settings.mode()) {
            case FIXED -> resolveFixed(settings);
            case ROI -> resolveFromRoi(points, velocities, settings.roi());
        };
    }

    private ReferenceVelocity resolveFixed(ReferenceSettings settings)
    {
        if (settings.fixedVelocity() == null) {
            throw ValidationException.missingParameter("referenceVelocity", "fixed reference mode");
        }
        LOG.debugf("Reference velocity set manually: %.2f m/s", settings.fixedVelocity());
        return ReferenceVelocity.fixed(settings.fixedVelocity());
    }

    private ReferenceVelocity resolveFromRoi(List<MeasurementPoint> points, DerivedField velocities, RoiBounds roi)
    {
        if (roi == null) {
            throw ValidationException.missingParameter("roi", "region-of-interest reference mode");
        }
        if (!roi.isWellFormed()) {
            throw ValidationException.invalidParameter("roi", roi, "finite bounds with min <= max");
        }

        double sum = 0.0;
        int selected = 0;
        int usable = 0;
        for (int i = 0; i < points.size(); i++) {
            MeasurementPoint point = points.get(i);
            if (!roi.contains(point.x(), point.y())) {
                continue;
            }
            selected++;
            if (!velocities.isMissing(i)) {
                sum += velocities.get(i);
                usable++;
            }
        }

        if (usable == 0) {
            String warning = selected == 0
                    ? String.format("Region of interest contains no points; using default reference %.1f m/s",
                            fallbackVelocity)
                    : String.format("Region of interest contains %d points but none with a valid velocity; "
                            + "using default reference %.1f m/s", selected, fallbackVelocity);
            LOG.warn(warning);
            return ReferenceVelocity.fallback(fallbackVelocity, warning);
        }

        double mean = sum / usable;
        LOG.debugf("Reference velocity from ROI: %.2f m/s (%d points, %d selected)", mean, usable, selected);
        return ReferenceVelocity.fromRoi(mean, usable);
    }

    public double getFallbackVelocity()
    {
        return fallbackVelocity;
    }
}
