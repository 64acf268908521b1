package com.acme.finops.ottl.util;

/**
 * Default values used when the corresponding environment variable is not set.
 */
public final class OttlDefaults {

    // ---- Processor ----
    public static final String DEFAULT_PROCESSOR_ID = "filter";

    // ---- Metrics reporter ----
    public static final long DEFAULT_METRICS_LOG_INTERVAL_SEC = 60L;
    public static final long MAX_METRICS_LOG_INTERVAL_SEC = 3_600L;

    // ---- Metrics endpoint ----
    public static final int DEFAULT_METRICS_HTTP_PORT = 9464;
    public static final String DEFAULT_METRICS_HTTP_PATH = "/metrics";
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 1024;

    // ---- HTTP status ----
    public static final int HTTP_OK = 200;
    public static final int HTTP_METHOD_NOT_ALLOWED = 405;
    public static final int HTTP_INTERNAL_ERROR = 500;

    private OttlDefaults() {
    }
}
