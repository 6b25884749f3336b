/* (C)2026 */
package com.ammann.ultrasonic.service;

import com.ammann.ultrasonic.config.AnalysisConfiguration;
import com.ammann.ultrasonic.config.ReferenceSettings;
import com.ammann.ultrasonic.config.RoiBounds;
import com.ammann.ultrasonic.config.ThermalCorrection;
import com.ammann.ultrasonic.enumeration.InterpolationStatus;
import com.ammann.ultrasonic.enumeration.MeasurementMode;
import com.ammann.ultrasonic.enumeration.ReferenceSource;
import com.ammann.ultrasonic.exception.ValidationException;
import com.ammann.ultrasonic.interpolation.CloughTocherInterpolator;
import com.ammann.ultrasonic.model.AnalysisResult;
import com.ammann.ultrasonic.model.MeasurementPoint;
import com.ammann.ultrasonic.model.StatisticsReport;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end tests of the analysis pipeline with real stage services.
 */
class StressAnalysisServiceTest
{

    private MeterRegistry registry;
    private StressAnalysisService service;

    @BeforeEach
    void setUp()
    {
        SpatialInterpolationService interpolation = new SpatialInterpolationService();
        interpolation.interpolator = new CloughTocherInterpolator();

        registry = new SimpleMeterRegistry();
        service = new StressAnalysisService(
                new VelocityResolverService(),
                new ReferenceVelocityService(),
                new StressIndexService(),
                interpolation,
                new StressStatisticsService(),
                registry);
        service.initMetrics();
    }

    private static List<MeasurementPoint> plate()
    {
        return List.of(
                MeasurementPoint.longitudinal(0, 0, 3.39),
                MeasurementPoint.longitudinal(10, 0, 3.40),
                MeasurementPoint.longitudinal(0, 10, 3.38),
                MeasurementPoint.longitudinal(10, 10, 3.41)
        );
    }

    @Test
    void longitudinalPlateWithFixedReference()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.fixed(5900.0))
                .build();

        AnalysisResult result = service.analyze(plate(), configuration);

        assertThat(result.velocities().get(0)).isCloseTo(5899.705, within(1e-3));
        assertThat(result.velocities().get(3)).isCloseTo(5865.103, within(1e-3));
        assertThat(result.index().get(0)).isCloseTo(-5.0e-5, within(1e-7));
        assertThat(result.reference().source()).isEqualTo(ReferenceSource.FIXED);

        assertThat(result.report().statistics().count()).isEqualTo(4);
        assertThat(result.report().statistics().mean()).isCloseTo(-0.0015118, within(1e-6));
        assertThat(result.report().statistics().standardDeviation()).isCloseTo(0.0032882, within(1e-6));
        assertThat(result.report().hasStressEstimate()).isFalse();

        assertThat(result.interpolation().status()).isEqualTo(InterpolationStatus.AVAILABLE);
        assertThat(result.interpolation().grid().columns()).isEqualTo(11);
        assertThat(result.interpolation().grid().rows()).isEqualTo(11);
        assertThat(result.colorScale().fallback()).isFalse();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.thermalDeltaT()).isNull();
        assertThat(result.meanShearVelocity()).isNull();
    }

    @Test
    void calibrationConstantProducesStressEstimate()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.fixed(5900.0))
                .calibrationConstant(-1.2e-5)
                .build();

        StatisticsReport report = service.analyze(plate(), configuration).report();

        assertThat(report.hasStressEstimate()).isTrue();
        assertThat(report.stressEstimate().meanStress()).isCloseTo(-0.0015118 / -1.2e-5, within(0.1));
    }

    @Test
    void emptyRoiFallsBackAndWarns()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.roi(new RoiBounds(50, 60, 50, 60)))
                .build();

        AnalysisResult result = service.analyze(plate(), configuration);

        assertThat(result.reference().source()).isEqualTo(ReferenceSource.FALLBACK);
        assertThat(result.reference().velocity()).isEqualTo(5900.0);
        assertThat(result.warnings()).anyMatch(w -> w.contains("Region of interest"));
        assertThat(registry.counter("stress_reference_fallback_total").count()).isEqualTo(1.0);
    }

    @Test
    void thermalCorrectionIsAppliedAndRecorded()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.fixed(5900.0))
                .thermalCorrection(new ThermalCorrection(-0.6, 20.0, 30.0))
                .build();

        AnalysisResult result = service.analyze(plate(), configuration);

        assertThat(result.thermalDeltaT()).isEqualTo(10.0);
        assertThat(result.velocities().get(0)).isCloseTo(5899.705 - 6.0, within(1e-3));
    }

    @Test
    void thermalCorrectionWithinToleranceIsSkipped()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.fixed(5900.0))
                .thermalCorrection(new ThermalCorrection(-0.6, 20.0, 20.05))
                .build();

        AnalysisResult result = service.analyze(plate(), configuration);

        assertThat(result.thermalDeltaT()).isNull();
        assertThat(result.velocities().get(0)).isCloseTo(5899.705, within(1e-3));
    }

    @Test
    void zeroReferenceLeavesIndexUndefined()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.fixed(0.0))
                .build();

        AnalysisResult result = service.analyze(plate(), configuration);

        assertThat(result.index().finiteCount()).isZero();
        assertThat(result.report().statistics().isDefined()).isFalse();
        assertThat(result.interpolation().status()).isEqualTo(InterpolationStatus.INSUFFICIENT_DATA);
        assertThat(result.colorScale().fallback()).isTrue();
        assertThat(result.warnings()).hasSize(2);
    }

    @Test
    void shearScanComputesBirefringence()
    {
        List<MeasurementPoint> points = List.of(
                MeasurementPoint.shear(0, 0, 3250.0, 3230.0),
                MeasurementPoint.shear(10, 0, 3240.0, 3240.0),
                MeasurementPoint.shear(0, 10, 3230.0, 3250.0),
                MeasurementPoint.shear(10, 10, 3245.0, 3235.0)
        );

        AnalysisResult result = service.analyze(points, AnalysisConfiguration.builder(MeasurementMode.SHEAR).build());

        assertThat(result.velocities()).isNull();
        assertThat(result.reference()).isNull();
        assertThat(result.index().get(0)).isCloseTo(20.0 / 3240.0, within(1e-12));
        assertThat(result.index().get(1)).isZero();
        assertThat(result.meanShearVelocity()).isCloseTo(3240.0, within(1e-9));
        assertThat(result.interpolation().isAvailable()).isTrue();
    }

    @Test
    void longitudinalModeRequiresThickness()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .reference(ReferenceSettings.fixed(5900.0))
                .build();

        assertThatThrownBy(() -> service.analyze(plate(), configuration))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("thicknessMm");
    }

    @Test
    void repeatedRunsGiveIdenticalResults()
    {
        AnalysisConfiguration configuration = AnalysisConfiguration.builder(MeasurementMode.LONGITUDINAL)
                .thicknessMm(10.0)
                .reference(ReferenceSettings.fixed(5900.0))
                .build();

        AnalysisResult first = service.analyze(plate(), configuration);
        AnalysisResult second = service.analyze(plate(), configuration);

        assertThat(second.index()).isEqualTo(first.index());
        assertThat(second.report()).isEqualTo(first.report());
        for (int row = 0; row < first.interpolation().grid().rows(); row++) {
            assertThat(Arrays.equals(second.interpolation().grid().values()[row],
                    first.interpolation().grid().values()[row])).isTrue();
        }
        assertThat(registry.counter("stress_analysis_runs_total").count()).isEqualTo(2.0);
        assertThat(registry.timer("stress_analysis_duration").count()).isEqualTo(2L);
    }

    @Test
    void summarizeTreatsNullEntriesAsMissing()
    {
        StatisticsReport report = service.summarize(Arrays.asList(0.001, null, 0.003), null);

        assertThat(report.statistics().count()).isEqualTo(2);
        assertThat(report.statistics().mean()).isCloseTo(0.002, within(1e-12));
    }

    @Test
    void missingConfigurationIsRejected()
    {
        assertThatThrownBy(() -> service.analyze(plate(), null))
                .isInstanceOf(ValidationException.class);
    }
}
