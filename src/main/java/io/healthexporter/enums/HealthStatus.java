package io.healthexporter.enums;

/**
 * The closed set of cluster health colors published by the status metric.
 *
 * <ul>
 *   <li><strong>GREEN</strong> - all primary and replica shards are allocated</li>
 *   <li><strong>YELLOW</strong> - all primaries are allocated, some replicas are not</li>
 *   <li><strong>RED</strong> - at least one primary shard is unallocated</li>
 * </ul>
 *
 * Matching is exact string equality against the wire value, so a status the cluster
 * reports outside this set matches none of the constants.
 */
public enum HealthStatus {
    GREEN("green"),
    YELLOW("yellow"),
    RED("red");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String status) {
        return value.equals(status);
    }
}
