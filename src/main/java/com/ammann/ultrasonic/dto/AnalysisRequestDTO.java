/* (C)2026 */
package com.ammann.ultrasonic.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Scan dataset together with the analysis parameters")
public record AnalysisRequestDTO(
        @Schema(description = "Tabular scan data", required = true)
        MeasurementTableDTO table,

        @Schema(description = "Analysis parameters", required = true)
        AnalysisParametersDTO parameters
) {
}
