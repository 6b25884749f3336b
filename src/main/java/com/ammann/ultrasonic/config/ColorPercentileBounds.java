/* (C)2026 */
package com.ammann.ultrasonic.config;

/**
 * Percentile pair used by heatmap renderers to clip the colour scale.
 * Carried through the pipeline unchanged.
 */
public record ColorPercentileBounds(double low, double high) {

    public static final ColorPercentileBounds DEFAULT = new ColorPercentileBounds(1.0, 99.0);
}
