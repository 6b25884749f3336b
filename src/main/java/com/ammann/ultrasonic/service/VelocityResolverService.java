/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.config.ThermalCorrection;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.MeasurementPoint;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Derives longitudinal ultrasonic velocity from pulse-echo time-of-flight.
 *
 * <p>Computes {@code v = 2 * d / TOF} with the thickness converted from millimeters to
 * meters and the time-of-flight from microseconds to seconds. A non-positive or
 * non-finite time-of-flight produces the missing-value sentinel for that point only.
 *
 * <p>An optional linear thermal correction {@code v + alpha * (T - T_ref)} is applied
 * uniformly when the temperature difference exceeds
 * {@code stress.thermal.tolerance-celsius} (default 0.1 °C).
 */
@ApplicationScoped
public class VelocityResolverService
{

    private static final Logger LOG = Logger.getLogger(VelocityResolverService.class);

    static final double DEFAULT_THERMAL_TOLERANCE_CELSIUS = 0.1;
    private static final double MM_PER_M = 1_000.0;
    private static final double US_PER_S = 1_000_000.0;

    @ConfigProperty(name = "stress.thermal.tolerance-celsius", defaultValue = "0.1")
    double thermalToleranceCelsius = DEFAULT_THERMAL_TOLERANCE_CELSIUS;

    /**
     * Velocity of a single pulse-echo measurement.
     *
     * @param tofUs       round-trip time-of-flight in microseconds
     * @param thicknessMm component thickness in millimeters
     * @return velocity in m/s, or {@link DerivedField#MISSING} if it cannot be computed
     */
    public double velocity(double tofUs, double thicknessMm)
    {
        if (!Double.isFinite(tofUs) || tofUs <= 0) {
            return DerivedField.MISSING;
        }
        double thicknessM = thicknessMm / MM_PER_M;
        double tofS = tofUs / US_PER_S;
        double velocity = (2 * thicknessM) / tofS;
        return Double.isFinite(velocity) ? velocity : DerivedField.MISSING;
    }

    /**
     * Resolves the velocity of every point, element-wise.
     *
     * @param points      longitudinal measurements
     * @param thicknessMm component thickness in millimeters, must be finite and positive
     * @return velocities in m/s, parallel to {@code points}
     * @throws ValidationException if the thickness is missing, non-finite or not positive
     */
    public DerivedField resolveVelocities(List<MeasurementPoint> points, Double thicknessMm)
    {
        validateThickness(thicknessMm);

        double[] velocities = new double[points.size()];
        for (int i = 0; i < velocities.length; i++) {
            velocities[i] = velocity(points.get(i).tofUs(), thicknessMm);
        }
        DerivedField field = DerivedField.of(velocities);

        if (field.missingCount() > 0) {
            LOG.debugf("Velocity undefined for %d of %d points (non-positive or non-finite TOF)",
                    field.missingCount(), field.size());
        }
        return field;
    }

    /**
     * Returns {@code true} if a correction is configured and the temperature difference
     * exceeds the configured tolerance.
     */
    public boolean isThermalCorrectionRequired(ThermalCorrection correction)
    {
        return correction != null && Math.abs(correction.deltaT()) > thermalToleranceCelsius;
    }

    /**
     * Applies {@code v + coefficient * (measured - reference)} to every finite entry.
     * Missing entries stay missing.
     */
    public DerivedField applyThermalCorrection(DerivedField velocities, ThermalCorrection correction)
    {
        if (!Double.isFinite(correction.coefficient()) || !Double.isFinite(correction.deltaT())) {
            throw ValidationException.invalidParameter(
                    "thermalCorrection", correction, "finite coefficient and temperatures");
        }

        double offset = correction.coefficient() * correction.deltaT();
        double[] corrected = velocities.toArray();
        for (int i = 0; i < corrected.length; i++) {
            corrected[i] += offset;
        }

        LOG.debugf("Thermal correction applied: dT=%.2f C, offset=%.3f m/s", correction.deltaT(), offset);
        return DerivedField.of(corrected);
    }

    private void validateThickness(Double thicknessMm)
    {
        if (thicknessMm == null) {
            throw ValidationException.missingParameter("thicknessMm", "longitudinal mode");
        }
        if (!Double.isFinite(thicknessMm) || thicknessMm <= 0) {
            throw ValidationException.invalidParameter("thicknessMm", thicknessMm, "positive value");
        }
    }
}
