package io.healthexporter.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_TARGET_URL = "http://localhost:9200";
    public static final long DEFAULT_TIMEOUT_SECONDS = 5L;
    public static final String DEFAULT_NAMESPACE = "pixiu";
    public static final String DEFAULT_TELEMETRY_PATH = "/metrics";

    // Environment variable to check for external config file path
    public static final String EXTERNAL_CONFIG_ENV_VAR = "EXPORTER_CONFIG_FILE";
    public static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    // Upstream health API
    public static final String CLUSTER_HEALTH_PATH = "/_cluster/health";
    public static final int HTTP_STATUS_OK = 200;

    // Metric subsystem for every series produced by the cluster health collector
    public static final String CLUSTER_HEALTH_SUBSYSTEM = "cluster_health_subsystem";
}
