/* (C)2026 */
package com.ammann.ultrasonic.dto;

/**
 * Conversion of missing-value sentinels to JSON {@code null}.
 */
final class DtoValues {

    private DtoValues() {}

    static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    static Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }
}
