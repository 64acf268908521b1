package com.acme.finops.ottl.util;

/**
 * Canonical environment variable names read by the processing stages.
 */
public final class OttlEnvKeys {
    public static final String OTTL_PROCESSOR_ID = "OTTL_PROCESSOR_ID";

    public static final String OTTL_FILTER_CONFIG_FILE = "OTTL_FILTER_CONFIG_FILE";
    public static final String OTTL_FILTER_ERROR_MODE = "OTTL_FILTER_ERROR_MODE";

    public static final String OTTL_TRANSFORM_CONFIG_FILE = "OTTL_TRANSFORM_CONFIG_FILE";
    public static final String OTTL_TRANSFORM_ERROR_MODE = "OTTL_TRANSFORM_ERROR_MODE";

    public static final String OTTL_METRICS_ENABLED = "OTTL_METRICS_ENABLED";
    public static final String OTTL_METRICS_LOG_INTERVAL_SEC = "OTTL_METRICS_LOG_INTERVAL_SEC";
    public static final String OTTL_METRICS_HTTP_ENABLED = "OTTL_METRICS_HTTP_ENABLED";
    public static final String OTTL_METRICS_HTTP_PORT = "OTTL_METRICS_HTTP_PORT";
    public static final String OTTL_METRICS_HTTP_PATH = "OTTL_METRICS_HTTP_PATH";

    private OttlEnvKeys() {
    }
}
