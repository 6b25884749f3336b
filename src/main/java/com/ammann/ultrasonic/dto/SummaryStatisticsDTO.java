/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.model.SummaryStatistics;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Descriptive statistics of the stress index. Every statistic is {@code null} when no
 * finite index value exists; {@code defined} is then {@code false}.
 */
@Schema(description = "Descriptive statistics of the finite stress index values")
@JsonInclude(JsonInclude.Include.ALWAYS)
public record SummaryStatisticsDTO(
        @Schema(description = "Whether any finite value was available")
        Boolean defined,

        @Schema(description = "Number of finite values analyzed")
        Long count,

        @Schema(description = "Mean index")
        Double mean,

        @Schema(description = "Population standard deviation")
        Double standardDeviation,

        @Schema(description = "Median index")
        Double median,

        @Schema(description = "Minimum index")
        Double min,

        @Schema(description = "Maximum index")
        Double max,

        @Schema(description = "5th percentile")
        Double percentile5,

        @Schema(description = "95th percentile")
        Double percentile95
) {
    static SummaryStatisticsDTO from(SummaryStatistics stats) {
        return new SummaryStatisticsDTO(
                stats.isDefined(),
                stats.count(),
                stats.mean(),
                stats.standardDeviation(),
                stats.median(),
                stats.min(),
                stats.max(),
                stats.percentile5(),
                stats.percentile95()
        );
    }
}
