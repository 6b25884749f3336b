/* (C)2026 */
package com.ammann.ultrasonic.model;

/**
 * Linear-scaled stress estimate {@code sigma = index / K}. Always qualitative: K is
 * supplied externally and the result has not been validated against an absolute technique.
 *
 * @param meanStress          mean index divided by K
 * @param stressUncertainty   index standard deviation divided by K (one sigma)
 * @param calibrationConstant the constant K used
 * @param unit                engineering unit of the estimate
 */
public record StressEstimate(double meanStress, double stressUncertainty, double calibrationConstant, String unit) {

    public static final String UNIT_MPA = "MPa";

    public boolean qualitative() {
        return true;
    }
}
