/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.enumeration.ReferenceSource;
import com.ammann.ultrasonic.model.ReferenceVelocity;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Reference velocity used for the relative stress index")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReferenceVelocityDTO(
        @Schema(description = "Reference velocity in m/s")
        Double velocity,

        @Schema(description = "Origin of the value")
        ReferenceSource source,

        @Schema(description = "Number of ROI points averaged")
        Integer selectedPoints,

        @Schema(description = "Warning raised while resolving the reference")
        String warning
) {
    static ReferenceVelocityDTO from(ReferenceVelocity reference) {
        if (reference == null) {
            return null;
        }
        return new ReferenceVelocityDTO(
                DtoValues.finiteOrNull(reference.velocity()),
                reference.source(),
                reference.selectedPoints(),
                reference.warning()
        );
    }
}
