/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.config.ColorPercentileBounds;
import com.ammann.ultrasonic.model.ColorScaleLimits;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Colour scale hints for heatmap rendering")
public record ColorScaleDTO(
        @Schema(description = "Lower percentile as configured")
        Double percentileLow,

        @Schema(description = "Upper percentile as configured")
        Double percentileHigh,

        @Schema(description = "Grid value at the lower percentile")
        Double min,

        @Schema(description = "Grid value at the upper percentile")
        Double max,

        @Schema(description = "True when no grid value was available and fixed limits apply")
        Boolean fallback
) {
    static ColorScaleDTO from(ColorPercentileBounds bounds, ColorScaleLimits limits) {
        return new ColorScaleDTO(bounds.low(), bounds.high(), limits.min(), limits.max(), limits.fallback());
    }
}
