package io.healthexporter.metrics;

import io.healthexporter.models.HealthSnapshot;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.ToDoubleFunction;

import static io.healthexporter.config.Constants.CLUSTER_HEALTH_SUBSYSTEM;
import static io.healthexporter.metrics.MetricsConstants.*;

/**
 * The fixed table of metrics derived from a cluster health snapshot.
 * <p>
 * Built once at startup for the configured namespace and shared, read-only, by every
 * {@link HealthCollector}.
 */
@Slf4j
@Getter
public class ClusterHealthMetrics {

    private final String namespace;
    private final List<FieldMetric> fieldMetrics;
    private final StatusMetric statusMetric;
    private final String upName;
    private final String totalScrapesName;
    private final String jsonParseFailuresName;

    public ClusterHealthMetrics(String namespace) {
        this.namespace = namespace;
        this.fieldMetrics = List.of(
            field(ACTIVE_PRIMARY_SHARDS_METRIC_NAME,
                "The number of primary shards in your cluster. This is an aggregate total across all indices.",
                HealthSnapshot::getActivePrimaryShards),
            field(ACTIVE_SHARDS_METRIC_NAME,
                "Aggregate total of all shards across all indices, which includes replica shards.",
                HealthSnapshot::getActiveShards),
            field(DELAYED_UNASSIGNED_SHARDS_METRIC_NAME,
                "Shards delayed to reduce reallocation overhead",
                HealthSnapshot::getDelayedUnassignedShards),
            field(INITIALIZING_SHARDS_METRIC_NAME,
                "Count of shards that are being freshly created.",
                HealthSnapshot::getInitializingShards),
            field(NUMBER_OF_DATA_NODES_METRIC_NAME,
                "Number of data nodes in the cluster.",
                HealthSnapshot::getNumberOfDataNodes),
            field(NUMBER_OF_IN_FLIGHT_FETCH_METRIC_NAME,
                "The number of ongoing shard info requests.",
                HealthSnapshot::getNumberOfInFlightFetch),
            field(TASK_MAX_WAITING_IN_QUEUE_MILLIS_METRIC_NAME,
                "Tasks max time waiting in queue.",
                HealthSnapshot::getTaskMaxWaitingInQueueMillis),
            field(NUMBER_OF_NODES_METRIC_NAME,
                "Number of nodes in the cluster.",
                HealthSnapshot::getNumberOfNodes),
            field(NUMBER_OF_PENDING_TASKS_METRIC_NAME,
                "Cluster level changes which have not yet been executed",
                HealthSnapshot::getNumberOfPendingTasks),
            field(RELOCATING_SHARDS_METRIC_NAME,
                "The number of shards that are currently moving from one node to another node.",
                HealthSnapshot::getRelocatingShards),
            field(UNASSIGNED_SHARDS_METRIC_NAME,
                "The number of shards that exist in the cluster state, but cannot be found in the cluster itself.",
                HealthSnapshot::getUnassignedShards),
            field(ACTIVE_SHARDS_PERCENT_METRIC_NAME,
                "The ratio of active shards in the cluster expressed as a percentage.",
                HealthSnapshot::getActiveShardsPercentAsNumber),
            field(TIMED_OUT_METRIC_NAME,
                "Whether the health request timed out before returning, 1 if it did.",
                snapshot -> snapshot.isTimedOut() ? 1 : 0)
        );
        this.statusMetric = new StatusMetric(fqName(STATUS_METRIC_NAME),
            "Whether all primary and replica shards are allocated.");
        this.upName = fqName(UP_METRIC_NAME);
        this.totalScrapesName = fqName(TOTAL_SCRAPES_METRIC_NAME);
        this.jsonParseFailuresName = fqName(JSON_PARSE_FAILURES_METRIC_NAME);

        log.info("Cluster health metric table built with {} field metrics for namespace '{}'",
            fieldMetrics.size(), namespace);
    }

    private FieldMetric field(String name, String help, ToDoubleFunction<HealthSnapshot> extractor) {
        return new FieldMetric(fqName(name), help, extractor);
    }

    private String fqName(String name) {
        return MetricsUtils.buildFqName(namespace, CLUSTER_HEALTH_SUBSYSTEM, name);
    }
}
