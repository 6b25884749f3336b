/* (C)2026 */
package com.ammann.ultrasonic.model;

/**
 * Single scan position with its raw ultrasonic payload.
 *
 * <p>Coordinates are in millimeters. Longitudinal points carry a time-of-flight in
 * microseconds; shear points carry the two polarization velocities in m/s. Payload
 * fields that do not belong to the point's mode hold {@link Double#NaN}.
 */
public record MeasurementPoint(double x, double y, double tofUs, double v1, double v2) {

    public static MeasurementPoint longitudinal(double x, double y, double tofUs) {
        return new MeasurementPoint(x, y, tofUs, Double.NaN, Double.NaN);
    }

    public static MeasurementPoint shear(double x, double y, double v1, double v2) {
        return new MeasurementPoint(x, y, Double.NaN, v1, v2);
    }
}
