/* (C)2026 */
package com.ammann.ultrasonic.config;

/**
 * Closed axis-aligned rectangle (millimeters) selecting the stress-free reference region.
 */
public record RoiBounds(double xMin, double xMax, double yMin, double yMax) {

    /**
     * Returns {@code true} if the coordinate lies inside or on the border of the rectangle.
     */
    public boolean contains(double x, double y) {
        return x >= xMin && x <= xMax && y >= yMin && y <= yMax;
    }

    /** Returns {@code true} if both ranges are finite and non-inverted. */
    public boolean isWellFormed() {
        return Double.isFinite(xMin) && Double.isFinite(xMax)
                && Double.isFinite(yMin) && Double.isFinite(yMax)
                && xMin <= xMax && yMin <= yMax;
    }
}
