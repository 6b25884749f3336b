/* (C)2026 */
package com.ammann.ultrasonic.config;

import com.ammann.ultrasonic.enumeration.MeasurementMode;

/**
 * Immutable parameter set for a single analysis run.
 *
 * <p>Replaces any ambient or session-held state: every stage receives the values it
 * needs from this object.
 *
 * @param mode                  acquisition mode
 * @param thicknessMm           component thickness in millimeters (longitudinal mode only)
 * @param reference             reference velocity strategy (longitudinal mode only)
 * @param thermalCorrection     optional temperature compensation, {@code null} when disabled
 * @param calibrationConstant   optional acoustoelastic constant K, {@code null} when unknown
 * @param meshStepMm            interpolation grid spacing in millimeters
 * @param colorPercentileBounds colour clipping percentiles for renderers
 */
public record AnalysisConfiguration(
        MeasurementMode mode,
        Double thicknessMm,
        ReferenceSettings reference,
        ThermalCorrection thermalCorrection,
        Double calibrationConstant,
        double meshStepMm,
        ColorPercentileBounds colorPercentileBounds
) {
    public static final double DEFAULT_MESH_STEP_MM = 1.0;

    public static Builder builder(MeasurementMode mode) {
        return new Builder(mode);
    }

    /**
     * Fluent builder with the documented defaults (1 mm mesh, 1st/99th colour percentiles).
     */
    public static final class Builder {
        private final MeasurementMode mode;
        private Double thicknessMm;
        private ReferenceSettings reference;
        private ThermalCorrection thermalCorrection;
        private Double calibrationConstant;
        private double meshStepMm = DEFAULT_MESH_STEP_MM;
        private ColorPercentileBounds colorPercentileBounds = ColorPercentileBounds.DEFAULT;

        private Builder(MeasurementMode mode) {
            this.mode = mode;
        }

        public Builder thicknessMm(Double thicknessMm) {
            this.thicknessMm = thicknessMm;
            return this;
        }

        public Builder reference(ReferenceSettings reference) {
            this.reference = reference;
            return this;
        }

        public Builder thermalCorrection(ThermalCorrection thermalCorrection) {
            this.thermalCorrection = thermalCorrection;
            return this;
        }

        public Builder calibrationConstant(Double calibrationConstant) {
            this.calibrationConstant = calibrationConstant;
            return this;
        }

        public Builder meshStepMm(double meshStepMm) {
            this.meshStepMm = meshStepMm;
            return this;
        }

        public Builder colorPercentileBounds(ColorPercentileBounds colorPercentileBounds) {
            this.colorPercentileBounds = colorPercentileBounds;
            return this;
        }

        public AnalysisConfiguration build() {
            return new AnalysisConfiguration(
                    mode,
                    thicknessMm,
                    reference,
                    thermalCorrection,
                    calibrationConstant,
                    meshStepMm,
                    colorPercentileBounds
            );
        }
    }
}
