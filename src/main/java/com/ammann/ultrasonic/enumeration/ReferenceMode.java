/* (C)2026 */
package com.ammann.ultrasonic.enumeration;

/**
 * Strategy used to establish the unstressed reference velocity.
 */
public enum ReferenceMode {
    /** Externally supplied velocity value */
    FIXED,
    /** Mean velocity inside a rectangular region of interest */
    ROI
}
