/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One row of the augmented point table: the input columns plus computed values.
 * Absent payloads and non-computable results are omitted.
 */
@Schema(description = "Input measurement with its computed velocity and index")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AugmentedPointDTO(
        @Schema(description = "X position in mm")
        Double x,

        @Schema(description = "Y position in mm")
        Double y,

        @Schema(description = "Time-of-flight in microseconds (longitudinal mode)")
        Double tofUs,

        @Schema(description = "First polarization velocity in m/s (shear mode)")
        Double v1,

        @Schema(description = "Second polarization velocity in m/s (shear mode)")
        Double v2,

        @Schema(description = "Velocity in m/s after optional thermal correction (longitudinal mode)")
        Double velocity,

        @Schema(description = "Stress index dv/v or birefringence index; absent when undefined")
        Double stressIndex
) {
}
