/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.enumeration.MeasurementMode;
import com.ammann.ultrasonic.model.AnalysisResult;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.MeasurementPoint;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

@Schema(description = "Complete result of an acoustoelastic stress analysis")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResponseDTO(
        @Schema(description = "Measurement mode used")
        MeasurementMode mode,

        @Schema(description = "Number of input points")
        Integer pointCount,

        @Schema(description = "Input rows augmented with velocity and index")
        List<AugmentedPointDTO> points,

        @Schema(description = "Reference velocity (longitudinal mode)")
        ReferenceVelocityDTO reference,

        @Schema(description = "Mean shear velocity in m/s (shear mode)")
        Double meanShearVelocity,

        @Schema(description = "Temperature difference applied by the thermal correction")
        Double thermalDeltaT,

        @Schema(description = "Interpolated grid")
        InterpolatedGridDTO grid,

        @Schema(description = "Statistics report")
        StatisticsReportDTO report,

        @Schema(description = "Colour scale hints")
        ColorScaleDTO colorScale,

        @Schema(description = "Non-fatal warnings raised during the analysis")
        List<String> warnings,

        @Schema(description = "Processing time in nanoseconds")
        Long processingTimeNs
) {
    /**
     * Converts a pipeline result to DTO.
     *
     * @param result           pipeline output
     * @param processingTimeNs wall time spent in the pipeline
     * @return DTO ready for JSON serialization
     */
    public static AnalysisResponseDTO from(AnalysisResult result, long processingTimeNs) {
        List<MeasurementPoint> points = result.points();
        DerivedField velocities = result.velocities();
        DerivedField index = result.index();
        boolean longitudinal = result.mode() == MeasurementMode.LONGITUDINAL;

        List<AugmentedPointDTO> rows = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            MeasurementPoint p = points.get(i);
            rows.add(new AugmentedPointDTO(
                    DtoValues.finiteOrNull(p.x()),
                    DtoValues.finiteOrNull(p.y()),
                    longitudinal ? DtoValues.finiteOrNull(p.tofUs()) : null,
                    longitudinal ? null : DtoValues.finiteOrNull(p.v1()),
                    longitudinal ? null : DtoValues.finiteOrNull(p.v2()),
                    velocities != null ? DtoValues.finiteOrNull(velocities.get(i)) : null,
                    DtoValues.finiteOrNull(index.get(i))
            ));
        }

        return new AnalysisResponseDTO(
                result.mode(),
                points.size(),
                rows,
                ReferenceVelocityDTO.from(result.reference()),
                DtoValues.finiteOrNull(result.meanShearVelocity()),
                result.thermalDeltaT(),
                InterpolatedGridDTO.from(result.interpolation()),
                StatisticsReportDTO.from(result.report()),
                ColorScaleDTO.from(result.colorPercentileBounds(), result.colorScale()),
                result.warnings(),
                processingTimeNs
        );
    }
}
