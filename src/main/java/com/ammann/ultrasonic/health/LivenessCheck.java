/* (C)2026 */
package com.ammann.ultrasonic.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check that reports the stress processor as alive.
 *
 * <p>The service holds no connections or background jobs, so responding at all is the
 * liveness signal.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.up("stress-processor-alive");
    }

}
