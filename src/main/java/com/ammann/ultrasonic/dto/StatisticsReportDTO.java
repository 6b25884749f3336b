/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.model.StatisticsReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Statistics summary with the optional stress estimate")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatisticsReportDTO(
        @Schema(description = "Descriptive statistics of the index")
        SummaryStatisticsDTO statistics,

        @Schema(description = "Stress estimate, absent without a usable K")
        StressEstimateDTO stressEstimate,

        @Schema(description = "Units and validity note")
        String note
) {
    /**
     * Converts the service-layer report to its JSON form.
     */
    public static StatisticsReportDTO from(StatisticsReport report) {
        return new StatisticsReportDTO(
                SummaryStatisticsDTO.from(report.statistics()),
                StressEstimateDTO.from(report.stressEstimate()),
                report.note()
        );
    }
}
