/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.config.ColorPercentileBounds;
import com.ammann.ultrasonic.model.ColorScaleLimits;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.InterpolationResult;
import com.ammann.ultrasonic.model.StatisticsReport;
import com.ammann.ultrasonic.model.StressEstimate;
import com.ammann.ultrasonic.model.SummaryStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.jboss.logging.Logger;

/**
 * Descriptive statistics and the optional engineering-unit estimate for an index field.
 *
 * <p>All statistics run over the finite entries only. The standard deviation is the
 * population form (divisor n); percentiles interpolate linearly between closest ranks
 * ({@link Percentile.EstimationType#R_7}). An empty finite subset yields
 * {@link SummaryStatistics#undefined()}, never zeros.
 *
 * <p>Given a positive calibration constant K, {@code sigma = index / K} is reported as a
 * qualitative estimate in MPa.
 */
@ApplicationScoped
public class StressStatisticsService
{

    private static final Logger LOG = Logger.getLogger(StressStatisticsService.class);

    static final double FALLBACK_COLOR_LIMIT = 0.001;

    static final String NOTE_QUALITATIVE =
            "Qualitative estimate sigma = (dv/v) / K. Requires experimental calibration of K for the "
                    + "material and validation against an absolute technique.";
    static final String NOTE_RELATIVE =
            "No usable calibration constant K; values remain in relative (dimensionless) dv/v units.";
    static final String NOTE_UNDEFINED =
            "No finite index values; statistics cannot be computed.";

    /**
     * Summarizes the finite entries of an index field.
     */
    public SummaryStatistics summarize(DerivedField index)
    {
        double[] values = index.finiteValues();
        if (values.length == 0) {
            LOG.warnf("Statistics undefined: none of %d index values is finite", index.size());
            return SummaryStatistics.undefined();
        }

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);

        SummaryStatistics statistics = new SummaryStatistics(
                values.length,
                new Mean().evaluate(values),
                new StandardDeviation(false).evaluate(values),
                percentile.evaluate(50.0),
                StatUtils.min(values),
                StatUtils.max(values),
                percentile.evaluate(5.0),
                percentile.evaluate(95.0)
        );

        LOG.debugf("Index statistics over %d values: mean=%.6e, std=%.6e",
                values.length, statistics.mean(), statistics.standardDeviation());
        return statistics;
    }

    /**
     * Builds the statistics report, adding a stress estimate when K is positive and finite.
     *
     * @param index               index field
     * @param calibrationConstant acoustoelastic constant K, may be {@code null}
     */
    public StatisticsReport report(DerivedField index, Double calibrationConstant)
    {
        SummaryStatistics statistics = summarize(index);
        if (!statistics.isDefined()) {
            return new StatisticsReport(statistics, null, NOTE_UNDEFINED);
        }

        if (calibrationConstant == null || !Double.isFinite(calibrationConstant) || calibrationConstant <= 0) {
            return new StatisticsReport(statistics, null, NOTE_RELATIVE);
        }

        StressEstimate estimate = new StressEstimate(
                statistics.mean() / calibrationConstant,
                statistics.standardDeviation() / calibrationConstant,
                calibrationConstant,
                StressEstimate.UNIT_MPA
        );
        LOG.debugf("Stress estimate with K=%.3e: %.2f +/- %.2f MPa",
                calibrationConstant, estimate.meanStress(), estimate.stressUncertainty());
        return new StatisticsReport(statistics, estimate, NOTE_QUALITATIVE);
    }

    /**
     * Colour scale limits at the configured percentiles of the finite grid values.
     * Falls back to {@code (-0.001, 0.001)} when no grid value is available.
     */
    public ColorScaleLimits colorScaleLimits(InterpolationResult interpolation, ColorPercentileBounds bounds)
    {
        double[] values = interpolation != null && interpolation.isAvailable()
                ? interpolation.grid().finiteValues()
                : new double[0];
        if (values.length == 0) {
            return new ColorScaleLimits(-FALLBACK_COLOR_LIMIT, FALLBACK_COLOR_LIMIT, true);
        }

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return new ColorScaleLimits(
                percentileOrMinimum(percentile, values, bounds.low()),
                percentileOrMinimum(percentile, values, bounds.high()),
                false);
    }

    // commons-math rejects p = 0, which is the minimum under R_7 anyway
    private static double percentileOrMinimum(Percentile percentile, double[] values, double p)
    {
        return p <= 0.0 ? StatUtils.min(values) : percentile.evaluate(p);
    }
}
