/* (C)2026 */
package com.ammann.ultrasonic.model;

import com.ammann.ultrasonic.enumeration.InterpolationStatus;

/**
 * Outcome of the scattered-to-grid interpolation.
 *
 * @param status      whether a grid was produced
 * @param grid        the grid, {@code null} unless {@code status} is available
 * @param validPoints number of finite points that entered the interpolation
 * @param message     informational text for unavailable results, {@code null} otherwise
 */
public record InterpolationResult(InterpolationStatus status, InterpolatedGrid grid, int validPoints, String message) {

    public static InterpolationResult available(InterpolatedGrid grid, int validPoints) {
        return new InterpolationResult(InterpolationStatus.AVAILABLE, grid, validPoints, null);
    }

    public static InterpolationResult unavailable(InterpolationStatus status, int validPoints, String message) {
        return new InterpolationResult(status, null, validPoints, message);
    }

    public boolean isAvailable() {
        return status.isAvailable();
    }
}
