/* (C)2026 */
package com.ammann.ultrasonic.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Request to summarize an already computed index field.
 */
@Schema(description = "Index values to summarize, with an optional calibration constant")
public record StatisticsRequestDTO(
        @Schema(description = "Index values; null entries are treated as missing", required = true)
        List<Double> values,

        @Schema(description = "Optional acoustoelastic constant K")
        Double calibrationConstant
) {
}
