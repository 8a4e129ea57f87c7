package io.healthexporter.metrics;

import java.util.List;

/**
 * Constants for metric names and labels published by the exporter.
 */
public class MetricsConstants {
    public final static String ACTIVE_PRIMARY_SHARDS_METRIC_NAME = "active_primary_shards";
    public final static String ACTIVE_SHARDS_METRIC_NAME = "active_shards";
    public final static String DELAYED_UNASSIGNED_SHARDS_METRIC_NAME = "delayed_unassigned_shards";
    public final static String INITIALIZING_SHARDS_METRIC_NAME = "initializing_shards";
    public final static String NUMBER_OF_DATA_NODES_METRIC_NAME = "number_of_data_nodes";
    public final static String NUMBER_OF_IN_FLIGHT_FETCH_METRIC_NAME = "number_of_in_flight_fetch";
    public final static String TASK_MAX_WAITING_IN_QUEUE_MILLIS_METRIC_NAME = "task_max_waiting_in_queue_millis";
    public final static String NUMBER_OF_NODES_METRIC_NAME = "number_of_nodes";
    public final static String NUMBER_OF_PENDING_TASKS_METRIC_NAME = "number_of_pending_tasks";
    public final static String RELOCATING_SHARDS_METRIC_NAME = "relocating_shards";
    public final static String UNASSIGNED_SHARDS_METRIC_NAME = "unassigned_shards";
    public final static String ACTIVE_SHARDS_PERCENT_METRIC_NAME = "active_shards_percent_as_number";
    public final static String TIMED_OUT_METRIC_NAME = "timed_out";
    public final static String STATUS_METRIC_NAME = "status";

    public final static String UP_METRIC_NAME = "up";
    public final static String TOTAL_SCRAPES_METRIC_NAME = "total_scrapes";
    public final static String JSON_PARSE_FAILURES_METRIC_NAME = "json_parse_failures";

    public final static String CLUSTER_LABEL = "cluster";
    public final static String COLOR_LABEL = "color";

    public final static List<String> FIELD_LABELS = List.of(CLUSTER_LABEL);
    public final static List<String> STATUS_LABELS = List.of(CLUSTER_LABEL, COLOR_LABEL);

    private MetricsConstants() {}
}
