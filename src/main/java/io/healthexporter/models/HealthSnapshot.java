package io.healthexporter.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One decoded response of the {@code _cluster/health} API.
 * <p>
 * Immutable once decoded. Unknown fields are ignored and missing fields keep their zero value.
 * The status is kept as the raw string the cluster reported.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthSnapshot {

    @JsonProperty("cluster_name")
    private String clusterName;

    @JsonProperty("status")
    private String status;

    @JsonProperty("timed_out")
    private boolean timedOut;

    @JsonProperty("number_of_nodes")
    private int numberOfNodes;

    @JsonProperty("number_of_data_nodes")
    private int numberOfDataNodes;

    @JsonProperty("active_primary_shards")
    private int activePrimaryShards;

    @JsonProperty("active_shards")
    private int activeShards;

    @JsonProperty("relocating_shards")
    private int relocatingShards;

    @JsonProperty("initializing_shards")
    private int initializingShards;

    @JsonProperty("unassigned_shards")
    private int unassignedShards;

    @JsonProperty("delayed_unassigned_shards")
    private int delayedUnassignedShards;

    @JsonProperty("number_of_pending_tasks")
    private int numberOfPendingTasks;

    @JsonProperty("number_of_in_flight_fetch")
    private int numberOfInFlightFetch;

    @JsonProperty("task_max_waiting_in_queue_millis")
    private long taskMaxWaitingInQueueMillis;

    @JsonProperty("active_shards_percent_as_number")
    private double activeShardsPercentAsNumber;

    /**
     * A snapshot with every field at its zero value.
     */
    public static HealthSnapshot empty() {
        return new HealthSnapshot();
    }

    public String getClusterName() {
        return clusterName != null ? clusterName : "";
    }

    public String getStatus() {
        return status != null ? status : "";
    }
}
