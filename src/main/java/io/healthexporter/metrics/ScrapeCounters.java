package io.healthexporter.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;

import java.util.Map;

/**
 * Process-wide operational counters of the cluster health collector.
 * <p>
 * Created once at startup and shared by every per-scrape {@link HealthCollector}, so the
 * counters accumulate over the life of the process and are never reset. The backing
 * meters are thread-safe, which covers concurrent scrapes.
 */
public class ScrapeCounters {

    public static final String UP_HELP = "Was the last scrape of the cluster health endpoint successful.";
    public static final String TOTAL_SCRAPES_HELP = "Current total cluster health scrapes.";
    public static final String JSON_PARSE_FAILURES_HELP = "Number of errors while parsing JSON.";

    private final AtomicDouble up;
    private final Counter totalScrapes;
    private final Counter jsonParseFailures;

    public ScrapeCounters(MetricsProvider metricsProvider, ClusterHealthMetrics metrics) {
        this.up = metricsProvider.gauge(metrics.getUpName(), UP_HELP, Map.of());
        this.totalScrapes = metricsProvider.counter(metrics.getTotalScrapesName(), TOTAL_SCRAPES_HELP, Map.of());
        this.jsonParseFailures = metricsProvider.counter(metrics.getJsonParseFailuresName(), JSON_PARSE_FAILURES_HELP, Map.of());
    }

    public void incrementTotalScrapes() {
        totalScrapes.increment();
    }

    public void incrementJsonParseFailures() {
        jsonParseFailures.increment();
    }

    public void markUp() {
        up.set(1);
    }

    public void markDown() {
        up.set(0);
    }

    public double up() {
        return up.get();
    }

    public double totalScrapes() {
        return totalScrapes.count();
    }

    public double jsonParseFailures() {
        return jsonParseFailures.count();
    }
}
