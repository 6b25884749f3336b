/* (C)2026 */
package com.ammann.ultrasonic.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.ultrasonic.exception.DegenerateGeometryException;
import com.ammann.ultrasonic.interpolation.CloughTocherInterpolator;
import com.ammann.ultrasonic.interpolation.ScatteredInterpolator;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InterpolationReadinessCheck")
class InterpolationReadinessCheckTest {

    @Test
    @DisplayName("should be UP when the self-test reproduces the probe value")
    void upWithWorkingInterpolator() {
        InterpolationReadinessCheck check = new InterpolationReadinessCheck();
        check.interpolator = new CloughTocherInterpolator();

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("interpolation-engine");
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get()).containsEntry("interpolator", "CloughTocherInterpolator");
    }

    @Test
    @DisplayName("should be DOWN when the interpolator fails")
    void downWhenInterpolatorThrows() {
        ScatteredInterpolator interpolator = mock(ScatteredInterpolator.class);
        when(interpolator.interpolate(any(), any(), any(), any(), any()))
                .thenThrow(new DegenerateGeometryException("broken"));
        InterpolationReadinessCheck check = new InterpolationReadinessCheck();
        check.interpolator = interpolator;

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData().get()).containsEntry("error", "broken");
    }

    @Test
    @DisplayName("should be DOWN when the probe value is not reproduced")
    void downWhenProbeIsWrong() {
        ScatteredInterpolator interpolator = mock(ScatteredInterpolator.class);
        when(interpolator.interpolate(any(), any(), any(), any(), any()))
                .thenReturn(new double[3][3]);
        InterpolationReadinessCheck check = new InterpolationReadinessCheck();
        check.interpolator = interpolator;

        assertThat(check.call().getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }
}
