/* (C)2026 */
package com.ammann.ultrasonic.enumeration;

/**
 * Origin of a resolved reference velocity.
 */
public enum ReferenceSource {
    /** Taken verbatim from the configuration */
    FIXED,
    /** Averaged over the points inside the region of interest */
    ROI,
    /** Region of interest held no usable point; configured default substituted */
    FALLBACK
}
