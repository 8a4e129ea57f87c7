package io.healthexporter.metrics;

import java.util.StringJoiner;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {

    private MetricsUtils() {}

    /**
     * Builds a fully-qualified metric name by joining the non-empty parts with underscores.
     *
     * @param namespace the process-wide namespace, may be empty
     * @param subsystem the collector subsystem, may be empty
     * @param name the metric name, must not be empty
     * @return the fully-qualified name, or an empty string when {@code name} is empty
     */
    public static String buildFqName(String namespace, String subsystem, String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("_");
        if (namespace != null && !namespace.isEmpty()) {
            joiner.add(namespace);
        }
        if (subsystem != null && !subsystem.isEmpty()) {
            joiner.add(subsystem);
        }
        joiner.add(name);
        return joiner.toString();
    }
}
