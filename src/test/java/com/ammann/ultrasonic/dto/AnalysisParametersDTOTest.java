/* (C)2026 */
package com.ammann.ultrasonic.dto;

import com.ammann.ultrasonic.config.AnalysisConfiguration;
import com.ammann.ultrasonic.config.RoiBounds;
import com.ammann.ultrasonic.enumeration.MeasurementMode;
import com.ammann.ultrasonic.enumeration.ReferenceMode;
import com.ammann.ultrasonic.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisParametersDTOTest
{

    @Test
    void defaultsAreFilledIn()
    {
        AnalysisParametersDTO dto = new AnalysisParametersDTO(
                MeasurementMode.LONGITUDINAL, 10.0, ReferenceMode.FIXED, 5900.0,
                null, null, null, null, null, null);

        AnalysisConfiguration configuration = dto.toConfiguration(2.5);

        assertThat(configuration.meshStepMm()).isEqualTo(2.5);
        assertThat(configuration.colorPercentileBounds().low()).isEqualTo(1.0);
        assertThat(configuration.colorPercentileBounds().high()).isEqualTo(99.0);
        assertThat(configuration.reference().mode()).isEqualTo(ReferenceMode.FIXED);
        assertThat(configuration.reference().fixedVelocity()).isEqualTo(5900.0);
        assertThat(configuration.thermalCorrection()).isNull();
    }

    @Test
    void explicitValuesWin()
    {
        RoiBounds roi = new RoiBounds(0, 5, 0, 5);
        AnalysisParametersDTO dto = new AnalysisParametersDTO(
                MeasurementMode.LONGITUDINAL, 10.0, ReferenceMode.ROI, null,
                roi, null, -1.1e-5, 0.5, 5.0, 95.0);

        AnalysisConfiguration configuration = dto.toConfiguration(1.0);

        assertThat(configuration.meshStepMm()).isEqualTo(0.5);
        assertThat(configuration.reference().roi()).isEqualTo(roi);
        assertThat(configuration.calibrationConstant()).isEqualTo(-1.1e-5);
        assertThat(configuration.colorPercentileBounds().low()).isEqualTo(5.0);
    }

    @Test
    void shearModeNeedsNoReference()
    {
        AnalysisParametersDTO dto = new AnalysisParametersDTO(
                MeasurementMode.SHEAR, null, null, null, null, null, null, null, null, null);

        assertThat(dto.toConfiguration(1.0).reference()).isNull();
    }

    @Test
    void missingModeIsRejected()
    {
        AnalysisParametersDTO dto = new AnalysisParametersDTO(
                null, 10.0, null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> dto.toConfiguration(1.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("mode");
    }

    @Test
    void invertedPercentilesAreRejected()
    {
        AnalysisParametersDTO dto = new AnalysisParametersDTO(
                MeasurementMode.SHEAR, null, null, null, null, null, null, null, 99.0, 1.0);

        assertThatThrownBy(() -> dto.toConfiguration(1.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("colorPercentileLow");
    }
}
