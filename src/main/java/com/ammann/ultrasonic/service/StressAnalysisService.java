/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.config.AnalysisConfiguration;
import com.ammann.ultrasonic.config.ColorPercentileBounds;
import com.ammann.ultrasonic.enumeration.MeasurementMode;
import com.ammann.ultrasonic.enumeration.ReferenceSource;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.model.AnalysisResult;
import com.ammann.ultrasonic.model.ColorScaleLimits;
import com.ammann.ultrasonic.model.DerivedField;
import com.ammann.ultrasonic.model.InterpolationResult;
import com.ammann.ultrasonic.model.MeasurementPoint;
import com.ammann.ultrasonic.model.ReferenceVelocity;
import com.ammann.ultrasonic.model.StatisticsReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the complete stress index pipeline for one dataset.
 *
 * <p>Stages: velocity resolution and optional thermal correction (longitudinal),
 * reference resolution, index computation, interpolation onto a regular grid,
 * statistics with the optional stress estimate, and colour scale limits.
 *
 * <p>Every run is a pure function of the points and the configuration; no state is
 * carried between runs apart from the metrics.
 */
@ApplicationScoped
public class StressAnalysisService
{

    private static final Logger LOG = Logger.getLogger(StressAnalysisService.class);

    private final VelocityResolverService velocityResolver;
    private final ReferenceVelocityService referenceResolver;
    private final StressIndexService indexCalculator;
    private final SpatialInterpolationService interpolationService;
    private final StressStatisticsService statisticsService;
    private final MeterRegistry meterRegistry;

    private Timer analysisTimer;
    private Counter analysisRunsCounter;
    private Counter referenceFallbackCounter;

    @Inject
    public StressAnalysisService(VelocityResolverService velocityResolver,
                                 ReferenceVelocityService referenceResolver,
                                 StressIndexService indexCalculator,
                                 SpatialInterpolationService interpolationService,
                                 StressStatisticsService statisticsService,
                                 MeterRegistry meterRegistry)
    {
        this.velocityResolver = velocityResolver;
        this.referenceResolver = referenceResolver;
        this.indexCalculator = indexCalculator;
        this.interpolationService = interpolationService;
        this.statisticsService = statisticsService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics()
    {
        analysisTimer = Timer.builder("stress_analysis_duration")
                .description("Duration of a full stress analysis run")
                .register(meterRegistry);
        analysisRunsCounter = Counter.builder("stress_analysis_runs_total")
                .description("Completed stress analysis runs")
                .register(meterRegistry);
        referenceFallbackCounter = Counter.builder("stress_reference_fallback_total")
                .description("Runs that fell back to the default reference velocity")
                .register(meterRegistry);
    }

    /**
     * Runs the pipeline.
     *
     * @param points        measurement points in input order
     * @param configuration parameters of this run
     * @return the augmented points, derived fields, grid, report and warnings
     * @throws ValidationException if a parameter required by the selected mode is missing or invalid
     */
    public AnalysisResult analyze(List<MeasurementPoint> points, AnalysisConfiguration configuration)
    {
        if (configuration == null || configuration.mode() == null) {
            throw ValidationException.missingParameter("mode", "every analysis");
        }
        if (points == null) {
            throw ValidationException.missingParameter("points", "every analysis");
        }

        if (analysisTimer == null) {
            return runPipeline(points, configuration);
        }
        AnalysisResult result = analysisTimer.record(() -> runPipeline(points, configuration));
        analysisRunsCounter.increment();
        return result;
    }

    /**
     * Statistics report for an index that was computed elsewhere.
     *
     * @param values              index values; {@code null} entries count as missing
     * @param calibrationConstant optional acoustoelastic constant K
     * @return statistics report
     */
    public StatisticsReport summarize(List<Double> values, Double calibrationConstant)
    {
        if (values == null) {
            throw ValidationException.missingParameter("values", "a statistics request");
        }
        double[] raw = new double[values.size()];
        for (int i = 0; i < raw.length; i++) {
            Double value = values.get(i);
            raw[i] = value != null ? value : DerivedField.MISSING;
        }
        return statisticsService.report(DerivedField.of(raw), calibrationConstant);
    }

    private AnalysisResult runPipeline(List<MeasurementPoint> points, AnalysisConfiguration configuration)
    {
        MeasurementMode mode = configuration.mode();
        List<String> warnings = new ArrayList<>();

        DerivedField velocities = null;
        DerivedField index;
        ReferenceVelocity reference = null;
        Double meanShearVelocity = null;
        Double thermalDeltaT = null;

        if (mode == MeasurementMode.LONGITUDINAL) {
            velocities = velocityResolver.resolveVelocities(points, configuration.thicknessMm());
            if (velocityResolver.isThermalCorrectionRequired(configuration.thermalCorrection())) {
                velocities = velocityResolver.applyThermalCorrection(velocities, configuration.thermalCorrection());
                thermalDeltaT = configuration.thermalCorrection().deltaT();
            }
            if (velocities.missingCount() > 0) {
                warnings.add(String.format("Velocity undefined for %d of %d points (time-of-flight not positive)",
                        velocities.missingCount(), velocities.size()));
            }

            reference = referenceResolver.resolve(points, velocities, configuration.reference());
            if (reference.source() == ReferenceSource.FALLBACK) {
                warnings.add(reference.warning());
                if (referenceFallbackCounter != null) {
                    referenceFallbackCounter.increment();
                }
            }
            if (!Double.isFinite(reference.velocity()) || reference.velocity() == 0.0) {
                warnings.add(String.format("Reference velocity %s cannot normalize the index; index undefined",
                        reference.velocity()));
            }

            index = indexCalculator.relativeIndex(velocities, reference.velocity());
        } else {
            index = indexCalculator.birefringenceIndex(points);
            double meanShear = indexCalculator.meanShearVelocity(points);
            meanShearVelocity = Double.isFinite(meanShear) ? meanShear : null;
            if (index.missingCount() > 0) {
                warnings.add(String.format("Birefringence undefined for %d of %d points",
                        index.missingCount(), index.size()));
            }
        }

        InterpolationResult interpolation = interpolationService.interpolate(points, index, configuration.meshStepMm());
        if (!interpolation.isAvailable()) {
            warnings.add(interpolation.message());
        }

        StatisticsReport report = statisticsService.report(index, configuration.calibrationConstant());
        ColorPercentileBounds bounds = configuration.colorPercentileBounds() != null
                ? configuration.colorPercentileBounds()
                : ColorPercentileBounds.DEFAULT;
        ColorScaleLimits colorScale = statisticsService.colorScaleLimits(interpolation, bounds);

        LOG.infof("Stress analysis complete: mode=%s, points=%d, finiteIndex=%d, grid=%s, warnings=%d",
                mode, points.size(), index.finiteCount(), interpolation.status(), warnings.size());

        return new AnalysisResult(
                mode,
                List.copyOf(points),
                velocities,
                index,
                reference,
                meanShearVelocity,
                thermalDeltaT,
                interpolation,
                report,
                colorScale,
                bounds,
                List.copyOf(warnings)
        );
    }
}
