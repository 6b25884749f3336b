/* (C)2026 */
package com.ammann.ultrasonic.model;

/**
 * Descriptive statistics over the finite entries of an index field.
 *
 * <p>When no finite value exists every statistic is {@code null} and {@link #isDefined()}
 * returns {@code false}; zero is never substituted.
 */
public record SummaryStatistics(
        long count,
        Double mean,
        Double standardDeviation,
        Double median,
        Double min,
        Double max,
        Double percentile5,
        Double percentile95
) {
    public static SummaryStatistics undefined() {
        return new SummaryStatistics(0, null, null, null, null, null, null, null);
    }

    public boolean isDefined() {
        return count > 0;
    }
}
