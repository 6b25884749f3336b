/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.config.ColorPercentileBounds;
import com.ammann.ultrasonic.enumeration.InterpolationStatus;
import com.ammann.ultrasonic.model.ColorScaleLimits;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.InterpolatedGrid;
import com.ammann.ultrasonic.model.InterpolationResult;
import com.ammann.ultrasonic.model.StatisticsReport;
import com.ammann.ultrasonic.model.SummaryStatistics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StressStatisticsService}.
 *
 * <p>Expected percentiles follow linear interpolation between closest ranks.
 */
class StressStatisticsServiceTest
{

    private final StressStatisticsService service = new StressStatisticsService();

    @Test
    void summarizeComputesAllStatistics()
    {
        SummaryStatistics stats = service.summarize(DerivedField.of(5.0, 1.0, 4.0, 2.0, 3.0));

        assertThat(stats.isDefined()).isTrue();
        assertThat(stats.count()).isEqualTo(5);
        assertThat(stats.mean()).isCloseTo(3.0, within(1e-12));
        assertThat(stats.standardDeviation()).isCloseTo(Math.sqrt(2.0), within(1e-12));
        assertThat(stats.median()).isCloseTo(3.0, within(1e-12));
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(5.0);
        assertThat(stats.percentile5()).isCloseTo(1.2, within(1e-12));
        assertThat(stats.percentile95()).isCloseTo(4.8, within(1e-12));
    }

    @Test
    void summarizeIgnoresMissingValues()
    {
        SummaryStatistics stats = service.summarize(DerivedField.of(1.0, Double.NaN, 3.0, Double.POSITIVE_INFINITY));

        assertThat(stats.count()).isEqualTo(2);
        assertThat(stats.mean()).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void singleValueHasZeroSpread()
    {
        SummaryStatistics stats = service.summarize(DerivedField.of(0.002));

        assertThat(stats.standardDeviation()).isZero();
        assertThat(stats.percentile5()).isEqualTo(0.002);
        assertThat(stats.percentile95()).isEqualTo(0.002);
    }

    @Test
    void allMissingYieldsUndefinedStatistics()
    {
        SummaryStatistics stats = service.summarize(DerivedField.allMissing(4));

        assertThat(stats.isDefined()).isFalse();
        assertThat(stats.count()).isZero();
        assertThat(stats.mean()).isNull();
        assertThat(stats.standardDeviation()).isNull();
        assertThat(stats.percentile95()).isNull();
    }

    @Test
    void reportWithPositiveConstantScalesMeanAndSpread()
    {
        StatisticsReport report = service.report(DerivedField.of(0.001, 0.003), 1e-5);

        assertThat(report.hasStressEstimate()).isTrue();
        assertThat(report.stressEstimate().meanStress()).isCloseTo(200.0, within(1e-9));
        assertThat(report.stressEstimate().stressUncertainty()).isCloseTo(100.0, within(1e-9));
        assertThat(report.stressEstimate().unit()).isEqualTo("MPa");
        assertThat(report.stressEstimate().qualitative()).isTrue();
        assertThat(report.note()).isEqualTo(StressStatisticsService.NOTE_QUALITATIVE);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1e-5, Double.NaN})
    void reportWithoutUsableConstantStaysRelative(double k)
    {
        StatisticsReport report = service.report(DerivedField.of(0.001, 0.003), k);

        assertThat(report.hasStressEstimate()).isFalse();
        assertThat(report.statistics().isDefined()).isTrue();
        assertThat(report.note()).isEqualTo(StressStatisticsService.NOTE_RELATIVE);
    }

    @Test
    void reportWithoutConstant()
    {
        StatisticsReport report = service.report(DerivedField.of(0.001), null);

        assertThat(report.stressEstimate()).isNull();
        assertThat(report.note()).isEqualTo(StressStatisticsService.NOTE_RELATIVE);
    }

    @Test
    void reportOnUndefinedStatisticsHasNoEstimate()
    {
        StatisticsReport report = service.report(DerivedField.allMissing(3), 1e-5);

        assertThat(report.statistics().isDefined()).isFalse();
        assertThat(report.stressEstimate()).isNull();
        assertThat(report.note()).isEqualTo(StressStatisticsService.NOTE_UNDEFINED);
    }

    @Test
    void colorScaleLimitsAtPercentilesOfGrid()
    {
        InterpolatedGrid grid = new InterpolatedGrid(
                new double[]{0, 1, 2, 3, 4},
                new double[]{0},
                new double[][]{{1.0, 2.0, 3.0, 4.0, 5.0}});

        ColorScaleLimits limits = service.colorScaleLimits(
                InterpolationResult.available(grid, 5), ColorPercentileBounds.DEFAULT);

        assertThat(limits.fallback()).isFalse();
        assertThat(limits.min()).isCloseTo(1.04, within(1e-12));
        assertThat(limits.max()).isCloseTo(4.96, within(1e-12));
    }

    @Test
    void colorScaleLimitsWithZeroPercentileUsesMinimum()
    {
        InterpolatedGrid grid = new InterpolatedGrid(
                new double[]{0, 1, 2},
                new double[]{0},
                new double[][]{{Double.NaN, -2.0, 6.0}});

        ColorScaleLimits limits = service.colorScaleLimits(
                InterpolationResult.available(grid, 3), new ColorPercentileBounds(0, 100));

        assertThat(limits.min()).isEqualTo(-2.0);
        assertThat(limits.max()).isEqualTo(6.0);
    }

    @Test
    void colorScaleLimitsFallBackWithoutGrid()
    {
        ColorScaleLimits limits = service.colorScaleLimits(
                InterpolationResult.unavailable(InterpolationStatus.INSUFFICIENT_DATA, 2, "too few"),
                ColorPercentileBounds.DEFAULT);

        assertThat(limits.fallback()).isTrue();
        assertThat(limits.min()).isEqualTo(-StressStatisticsService.FALLBACK_COLOR_LIMIT);
        assertThat(limits.max()).isEqualTo(StressStatisticsService.FALLBACK_COLOR_LIMIT);
    }
}
