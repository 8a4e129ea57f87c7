package io.healthexporter.metrics;

import io.healthexporter.enums.HealthStatus;
import io.healthexporter.health.DecodeException;
import io.healthexporter.health.HealthFetchException;
import io.healthexporter.health.HealthFetcher;
import io.healthexporter.models.HealthSnapshot;
import io.prometheus.client.Collector;
import io.prometheus.client.CounterMetricFamily;
import io.prometheus.client.GaugeMetricFamily;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.healthexporter.metrics.MetricsConstants.FIELD_LABELS;
import static io.healthexporter.metrics.MetricsConstants.STATUS_LABELS;

/**
 * Prometheus collector that turns one cluster health fetch into metric samples.
 * <p>
 * Every {@link #collect()} performs exactly one fetch. On success it emits one sample per
 * field metric, three one-hot status samples and the operational counters; on any fetch
 * failure only the operational counters are emitted and {@code up} drops to 0.
 * {@link #collect()} never throws.
 */
@Slf4j
public class HealthCollector extends Collector implements Collector.Describable {

    private final HealthFetcher fetcher;
    private final ClusterHealthMetrics metrics;
    private final ScrapeCounters counters;

    public HealthCollector(HealthFetcher fetcher, ClusterHealthMetrics metrics, ScrapeCounters counters) {
        this.fetcher = fetcher;
        this.metrics = metrics;
        this.counters = counters;
    }

    /**
     * Describe every metric this collector can produce, independent of any fetch outcome.
     */
    @Override
    public List<MetricFamilySamples> describe() {
        List<MetricFamilySamples> descriptions = new ArrayList<>();
        for (FieldMetric metric : metrics.getFieldMetrics()) {
            descriptions.add(new GaugeMetricFamily(metric.getName(), metric.getHelp(), FIELD_LABELS));
        }
        StatusMetric statusMetric = metrics.getStatusMetric();
        descriptions.add(new GaugeMetricFamily(statusMetric.getName(), statusMetric.getHelp(), STATUS_LABELS));

        descriptions.add(new GaugeMetricFamily(metrics.getUpName(), ScrapeCounters.UP_HELP,
            Collections.emptyList()));
        descriptions.add(new CounterMetricFamily(metrics.getTotalScrapesName(), ScrapeCounters.TOTAL_SCRAPES_HELP,
            Collections.emptyList()));
        descriptions.add(new CounterMetricFamily(metrics.getJsonParseFailuresName(), ScrapeCounters.JSON_PARSE_FAILURES_HELP,
            Collections.emptyList()));
        return descriptions;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        counters.incrementTotalScrapes();

        List<MetricFamilySamples> families = new ArrayList<>();
        // emitted from this cycle's outcome; the shared gauge may already reflect a concurrent scrape
        double up = 0;
        try {
            HealthSnapshot snapshot = fetcher.fetch();
            List<MetricFamilySamples> fields = fieldSamples(snapshot);
            MetricFamilySamples status = statusSamples(snapshot);
            up = 1;
            counters.markUp();
            families.addAll(fields);
            families.add(status);
            log.debug("Collected cluster health for '{}' with status '{}'",
                snapshot.getClusterName(), snapshot.getStatus());
        } catch (HealthFetchException e) {
            counters.markDown();
            if (e instanceof DecodeException) {
                counters.incrementJsonParseFailures();
            }
            log.warn("Failed to fetch and decode cluster health: {}", e.getMessage());
        } catch (RuntimeException e) {
            counters.markDown();
            log.error("Unexpected error while collecting cluster health: {}", e.getMessage(), e);
        }

        families.addAll(counterSamples(up));
        return families;
    }

    private List<MetricFamilySamples> fieldSamples(HealthSnapshot snapshot) {
        List<String> labelValues = List.of(snapshot.getClusterName());
        List<MetricFamilySamples> families = new ArrayList<>(metrics.getFieldMetrics().size());
        for (FieldMetric metric : metrics.getFieldMetrics()) {
            GaugeMetricFamily family = new GaugeMetricFamily(metric.getName(), metric.getHelp(), FIELD_LABELS);
            family.addMetric(labelValues, metric.value(snapshot));
            families.add(family);
        }
        return families;
    }

    private MetricFamilySamples statusSamples(HealthSnapshot snapshot) {
        StatusMetric statusMetric = metrics.getStatusMetric();
        GaugeMetricFamily family = new GaugeMetricFamily(statusMetric.getName(), statusMetric.getHelp(), STATUS_LABELS);
        for (HealthStatus color : HealthStatus.values()) {
            family.addMetric(List.of(snapshot.getClusterName(), color.getValue()), statusMetric.value(snapshot, color));
        }
        return family;
    }

    private List<MetricFamilySamples> counterSamples(double up) {
        return List.of(
            new GaugeMetricFamily(metrics.getUpName(), ScrapeCounters.UP_HELP, up),
            new CounterMetricFamily(metrics.getTotalScrapesName(), ScrapeCounters.TOTAL_SCRAPES_HELP,
                counters.totalScrapes()),
            new CounterMetricFamily(metrics.getJsonParseFailuresName(), ScrapeCounters.JSON_PARSE_FAILURES_HELP,
                counters.jsonParseFailures())
        );
    }
}
