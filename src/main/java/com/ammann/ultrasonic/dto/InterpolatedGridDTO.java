/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.enumeration.InterpolationStatus;
import com.ammann.ultrasonic.model.InterpolatedGrid;
import com.ammann.ultrasonic.model.InterpolationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Interpolated index grid for heatmap rendering. Grid fields are absent when
 * interpolation was unavailable.
 */
@Schema(description = "Regular grid of interpolated stress index values")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InterpolatedGridDTO(
        @Schema(description = "Whether a grid could be produced")
        InterpolationStatus status,

        @Schema(description = "Number of valid points that entered the interpolation")
        Integer validPoints,

        @Schema(description = "Reason the grid is unavailable")
        String message,

        @Schema(description = "Grid x positions in mm (columns)")
        double[] xAxis,

        @Schema(description = "Grid y positions in mm (rows)")
        double[] yAxis,

        @Schema(description = "Values indexed [row][column]; null outside the convex hull")
        Double[][] values,

        @Schema(description = "True where the cell holds no value")
        boolean[][] missingMask
) {
    /**
     * Converts the service-layer interpolation result to its JSON form.
     *
     * @param result interpolation outcome
     * @return DTO with the grid populated when available
     */
    public static InterpolatedGridDTO from(InterpolationResult result) {
        if (!result.isAvailable()) {
            return new InterpolatedGridDTO(
                    result.status(), result.validPoints(), result.message(), null, null, null, null);
        }

        InterpolatedGrid grid = result.grid();
        double[][] cells = grid.values();
        Double[][] values = new Double[grid.rows()][grid.columns()];
        for (int row = 0; row < grid.rows(); row++) {
            for (int column = 0; column < grid.columns(); column++) {
                values[row][column] = DtoValues.finiteOrNull(cells[row][column]);
            }
        }
        return new InterpolatedGridDTO(
                result.status(),
                result.validPoints(),
                null,
                grid.xAxis(),
                grid.yAxis(),
                values,
                grid.missingMask()
        );
    }
}
