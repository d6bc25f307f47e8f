/* (C)2026 */
package com.ammann.qc.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Path parameter holding an analyte name. */
    public static final String ANALYTE_PARAM = "analyte";

    /**
     * Batch analysis endpoints
     */
    public static final class Qc {
        private Qc() {}

        public static final String BASE = "/qc";
        public static final String ANALYZE = "/analyze";
        public static final String ANALYTES = "/analytes";
        public static final String COMPARE = "/compare";
    }

    /**
     * Real-time monitor endpoints, relative to {@link Qc#BASE}
     */
    public static final class Monitor {
        private Monitor() {}

        public static final String BASE = "/monitor";
        public static final String ANALYTE = BASE + "/{" + ANALYTE_PARAM + "}";
        public static final String MEASUREMENTS = ANALYTE + "/measurements";
        public static final String STOP = BASE + "/stop";
        public static final String START = BASE + "/start";
    }
}
