/* (C)2026 */
package com.ammann.ultrasonic.model;

/**
 * Statistics summary plus the optional stress estimate.
 *
 * @param statistics     descriptive statistics of the index
 * @param stressEstimate estimate in engineering units, {@code null} without a usable K
 * @param note           explanation of the units the report is expressed in
 */
public record StatisticsReport(SummaryStatistics statistics, StressEstimate stressEstimate, String note) {

    public boolean hasStressEstimate() {
        return stressEstimate != null;
    }
}
