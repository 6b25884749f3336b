/* (C)2026 */
package com.ammann.ultrasonic.enumeration;

import java.util.List;
import java.util.stream.Stream;

/**
 * Acquisition mode of an ultrasonic scan.
 *
 * <p>Each mode defines the tabular columns an input dataset must carry in addition
 * to the {@code x}/{@code y} coordinates.
 */
public enum MeasurementMode
{
    /** Longitudinal wave time-of-flight; index is the relative velocity deviation. */
    LONGITUDINAL(List.of("tof_us")),
    /** Two shear wave polarizations; index is the birefringence. */
    SHEAR(List.of("v1", "v2"));

    public static final String COLUMN_X = "x";
    public static final String COLUMN_Y = "y";

    private final List<String> payloadColumns;

    MeasurementMode(List<String> payloadColumns) {
        this.payloadColumns = payloadColumns;
    }

    /**
     * Returns every column required for this mode, coordinates first.
     *
     * @return ordered list of required column names
     */
    public List<String> requiredColumns() {
        return Stream.concat(Stream.of(COLUMN_X, COLUMN_Y), payloadColumns.stream()).toList();
    }

    public List<String> getPayloadColumns() { return payloadColumns; }
}
