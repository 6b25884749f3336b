/* (C)2026 */
package com.ammann.ultrasonic.model;

import com.ammann.ultrasonic.enumeration.ReferenceSource;

/**
 * Baseline (unstressed) velocity used by the relative stress index.
 *
 * @param velocity       reference velocity in m/s
 * @param source         where the value came from
 * @param selectedPoints number of points inside the region of interest that contributed
 *                       to the mean; 0 for fixed and fallback values
 * @param warning        non-fatal warning raised while resolving, {@code null} if none
 */
public record ReferenceVelocity(double velocity, ReferenceSource source, int selectedPoints, String warning) {

    public static ReferenceVelocity fixed(double velocity) {
        return new ReferenceVelocity(velocity, ReferenceSource.FIXED, 0, null);
    }

    public static ReferenceVelocity fromRoi(double velocity, int selectedPoints) {
        return new ReferenceVelocity(velocity, ReferenceSource.ROI, selectedPoints, null);
    }

    public static ReferenceVelocity fallback(double velocity, String warning) {
        return new ReferenceVelocity(velocity, ReferenceSource.FALLBACK, 0, warning);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
