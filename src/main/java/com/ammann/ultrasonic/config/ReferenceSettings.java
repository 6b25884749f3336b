/* (C)2026 */
package com.ammann.ultrasonic.config;

import com.ammann.ultrasonic.enumeration.ReferenceMode;

/**
 * Selects how the reference velocity is obtained.
 *
 * @param mode          strategy to apply
 * @param fixedVelocity reference velocity in m/s, used by {@link ReferenceMode#FIXED}
 * @param roi           region of interest, used by {@link ReferenceMode#ROI}
 */
public record ReferenceSettings(ReferenceMode mode, Double fixedVelocity, RoiBounds roi) {

    public static ReferenceSettings fixed(double velocity) {
        return new ReferenceSettings(ReferenceMode.FIXED, velocity, null);
    }

    public static ReferenceSettings roi(RoiBounds bounds) {
        return new ReferenceSettings(ReferenceMode.ROI, null, bounds);
    }
}
