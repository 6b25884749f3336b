/* (C)2026 */
package com.ammann.ultrasonic.enumeration;

/**
 * Outcome of mapping the scattered index field onto a regular grid.
 */
public enum InterpolationStatus {
    /** A grid was produced */
    AVAILABLE,
    /** Fewer than three finite index values */
    INSUFFICIENT_DATA,
    /** All finite points lie on a single line, no triangle can be formed */
    DEGENERATE_GEOMETRY;

    public boolean isAvailable() {
        return this == AVAILABLE;
    }
}
