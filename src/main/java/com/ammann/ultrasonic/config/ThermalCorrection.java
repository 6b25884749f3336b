/* (C)2026 */
package com.ammann.ultrasonic.config;

/**
 * Linear temperature compensation {@code v + coefficient * (measured - reference)}.
 *
 * @param coefficient          velocity change per degree, (m/s)/°C; signed
 * @param referenceTemperature temperature the reference state refers to, °C
 * @param measuredTemperature  temperature during the scan, °C
 */
public record ThermalCorrection(double coefficient, double referenceTemperature, double measuredTemperature) {

    public double deltaT() {
        return measuredTemperature - referenceTemperature;
    }
}
