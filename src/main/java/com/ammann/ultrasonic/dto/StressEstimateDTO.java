/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.model.StressEstimate;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Qualitative stress estimate sigma = (dv/v) / K")
public record StressEstimateDTO(
        @Schema(description = "Mean estimated stress")
        Double meanStress,

        @Schema(description = "One-sigma variation of the estimated stress")
        Double stressUncertainty,

        @Schema(description = "Acoustoelastic constant K used")
        Double calibrationConstant,

        @Schema(description = "Unit of the estimate")
        String unit,

        @Schema(description = "Always true: the estimate is uncalibrated")
        Boolean qualitative
) {
    static StressEstimateDTO from(StressEstimate estimate) {
        if (estimate == null) {
            return null;
        }
        return new StressEstimateDTO(
                estimate.meanStress(),
                estimate.stressUncertainty(),
                estimate.calibrationConstant(),
                estimate.unit(),
                estimate.qualitative()
        );
    }
}
