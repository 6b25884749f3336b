/* (C)2026 */
package com.ammann.ultrasonic.model;

/**
 * Colour scale limits derived from the interpolated grid for heatmap renderers.
 *
 * @param min      lower limit
 * @param max      upper limit
 * @param fallback {@code true} when no grid value was available and fixed limits were used
 */
public record ColorScaleLimits(double min, double max, boolean fallback) {
}
