/* (C)2026 */
package com.ammann.ultrasonic.model;

import com.ammann.ultrasonic.config.ColorPercentileBounds;
import com.ammann.ultrasonic.enumeration.MeasurementMode;
import java.util.List;

/**
 * Complete output of one pipeline run.
 *
 * @param mode                  acquisition mode the run used
 * @param points                input points, in input order
 * @param velocities            per-point velocity (longitudinal mode), {@code null} for shear
 * @param index                 per-point stress or birefringence index
 * @param reference             resolved reference velocity (longitudinal mode), {@code null} for shear
 * @param meanShearVelocity     mean of the polarization averages (shear mode), {@code null} otherwise
 * @param thermalDeltaT         temperature difference applied, {@code null} when no correction ran
 * @param interpolation         grid or the reason none was produced
 * @param report                statistics and optional stress estimate
 * @param colorScale            colour limits for renderers
 * @param colorPercentileBounds percentile bounds as configured
 * @param warnings              non-fatal conditions recovered during the run
 */
public record AnalysisResult(
        MeasurementMode mode,
        List<MeasurementPoint> points,
        DerivedField velocities,
        DerivedField index,
        ReferenceVelocity reference,
        Double meanShearVelocity,
        Double thermalDeltaT,
        InterpolationResult interpolation,
        StatisticsReport report,
        ColorScaleLimits colorScale,
        ColorPercentileBounds colorPercentileBounds,
        List<String> warnings
) {
}
