/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Tabular scan dataset as produced by an external CSV/Excel loader.
 *
 * <p>Each row holds one value per header column; {@code null} cells are treated as
 * non-computable values. Coordinates are in millimeters, time-of-flight in microseconds,
 * velocities in m/s.
 */
@Schema(description = "Ultrasonic scan data in column/row form")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeasurementTableDTO(
        @Schema(description = "Column names, e.g. x, y, tof_us or x, y, v1, v2", required = true)
        List<String> columns,

        @Schema(description = "Rows of numeric cells aligned with the column names", required = true)
        List<List<Double>> rows
) {
}
