/* (C)2026 */
package com.ammann.ultrasonic.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Stress analysis endpoints
     */
    public static final class Analysis {
        private Analysis() {}

        public static final String BASE = "/analysis";
        public static final String STATISTICS = "/statistics";
    }
}
