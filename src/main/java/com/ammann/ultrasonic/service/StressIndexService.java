/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.MeasurementPoint;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Computes the dimensionless acoustoelastic indices.
 *
 * <p>Longitudinal mode uses the relative velocity deviation {@code (v - v_ref) / v_ref};
 * shear mode uses the birefringence {@code (v1 - v2) / ((v1 + v2) / 2)}. Every point is
 * computed independently; an undefined result becomes the missing-value sentinel and
 * never affects other points.
 */
@ApplicationScoped
public class StressIndexService
{

    private static final Logger LOG = Logger.getLogger(StressIndexService.class);

    /** Relative index of one velocity, {@link DerivedField#MISSING} if undefined. */
    public double relativeIndex(double velocity, double referenceVelocity)
    {
        if (!Double.isFinite(referenceVelocity) || referenceVelocity == 0.0) {
            return DerivedField.MISSING;
        }
        double index = (velocity - referenceVelocity) / referenceVelocity;
        return Double.isFinite(index) ? index : DerivedField.MISSING;
    }

    /**
     * Relative index for every velocity. A zero or non-finite reference makes every entry missing.
     */
    public DerivedField relativeIndex(DerivedField velocities, double referenceVelocity)
    {
        if (!Double.isFinite(referenceVelocity) || referenceVelocity == 0.0) {
            LOG.warnf("Reference velocity %.3f is not usable; stress index undefined for all %d points",
                    referenceVelocity, velocities.size());
            return DerivedField.allMissing(velocities.size());
        }

        double[] index = new double[velocities.size()];
        for (int i = 0; i < index.length; i++) {
            index[i] = relativeIndex(velocities.get(i), referenceVelocity);
        }
        return DerivedField.of(index);
    }

    /** Birefringence of one polarization pair, {@link DerivedField#MISSING} if undefined. */
    public double birefringence(double v1, double v2)
    {
        double mean = (v1 + v2) / 2;
        if (!Double.isFinite(mean) || mean == 0.0) {
            return DerivedField.MISSING;
        }
        double index = (v1 - v2) / mean;
        return Double.isFinite(index) ? index : DerivedField.MISSING;
    }

    /** Birefringence index of every shear measurement. */
    public DerivedField birefringenceIndex(List<MeasurementPoint> points)
    {
        double[] index = new double[points.size()];
        for (int i = 0; i < index.length; i++) {
            MeasurementPoint point = points.get(i);
            index[i] = birefringence(point.v1(), point.v2());
        }
        DerivedField field = DerivedField.of(index);

        if (field.missingCount() > 0) {
            LOG.debugf("Birefringence undefined for %d of %d points", field.missingCount(), field.size());
        }
        return field;
    }

    /**
     * Mean of the per-point polarization averages {@code (v1 + v2) / 2} over the finite
     * entries; {@link Double#NaN} when there is none.
     */
    public double meanShearVelocity(List<MeasurementPoint> points)
    {
        return points.stream()
                .mapToDouble(p -> (p.v1() + p.v2()) / 2)
                .filter(Double::isFinite)
                .average()
                .orElse(Double.NaN);
    }
}
