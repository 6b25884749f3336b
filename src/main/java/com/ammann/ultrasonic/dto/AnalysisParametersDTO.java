/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.config.AnalysisConfiguration;
import com.ammann.ultrasonic.config.ColorPercentileBounds;
import com.ammann.ultrasonic.config.ReferenceSettings;
import com.ammann.ultrasonic.config.RoiBounds;
import com.ammann.ultrasonic.config.ThermalCorrection;
import com.ammann.ultrasonic.enumeration.MeasurementMode;
import com.ammann.ultrasonic.enumeration.ReferenceMode;
import com.ammann.ultrasonic.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Analysis parameters as entered on the client's parameter surface.
 */
@Schema(description = "Parameters of an acoustoelastic stress analysis")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisParametersDTO(
        @Schema(description = "Measurement mode", required = true)
        MeasurementMode mode,

        @Schema(description = "Component thickness in mm (longitudinal mode)")
        Double thicknessMm,

        @Schema(description = "Reference velocity strategy (longitudinal mode)")
        ReferenceMode referenceMode,

        @Schema(description = "Fixed reference velocity in m/s")
        Double referenceVelocity,

        @Schema(description = "Region of interest for the ROI reference strategy, in mm")
        RoiBounds roi,

        @Schema(description = "Optional linear thermal correction")
        ThermalCorrection thermalCorrection,

        @Schema(description = "Optional acoustoelastic constant K for the qualitative stress estimate")
        Double calibrationConstant,

        @Schema(description = "Interpolation grid step in mm (default 1.0)")
        Double meshStepMm,

        @Schema(description = "Lower colour-scale percentile (default 1)")
        Double colorPercentileLow,

        @Schema(description = "Upper colour-scale percentile (default 99)")
        Double colorPercentileHigh
) {
    /**
     * Converts the parameters into the immutable configuration consumed by the pipeline.
     *
     * @param defaultMeshStepMm mesh step used when none was sent
     * @throws ValidationException if the mode is missing or the percentile bounds are inconsistent
     */
    public AnalysisConfiguration toConfiguration(double defaultMeshStepMm) {
        if (mode == null) {
            throw ValidationException.missingParameter("mode", "every analysis");
        }

        ColorPercentileBounds bounds = new ColorPercentileBounds(
                colorPercentileLow != null ? colorPercentileLow : ColorPercentileBounds.DEFAULT.low(),
                colorPercentileHigh != null ? colorPercentileHigh : ColorPercentileBounds.DEFAULT.high());
        if (!(bounds.low() >= 0 && bounds.low() < bounds.high() && bounds.high() <= 100)) {
            throw ValidationException.invalidParameter(
                    "colorPercentileLow/colorPercentileHigh",
                    bounds.low() + "/" + bounds.high(),
                    "0 <= low < high <= 100");
        }

        ReferenceSettings reference = null;
        if (referenceMode != null) {
            reference = new ReferenceSettings(referenceMode, referenceVelocity, roi);
        }

        return AnalysisConfiguration.builder(mode)
                .thicknessMm(thicknessMm)
                .reference(reference)
                .thermalCorrection(thermalCorrection)
                .calibrationConstant(calibrationConstant)
                .meshStepMm(meshStepMm != null ? meshStepMm : defaultMeshStepMm)
                .colorPercentileBounds(bounds)
                .build();
    }
}
