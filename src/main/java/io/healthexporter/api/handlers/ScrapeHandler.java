package io.healthexporter.api.handlers;

import io.healthexporter.api.models.responses.ErrorResponse;
import io.healthexporter.health.HealthFetcher;
import io.healthexporter.metrics.ClusterHealthMetrics;
import io.healthexporter.metrics.HealthCollector;
import io.healthexporter.metrics.ScrapeCounters;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Enumeration;
import java.util.Set;

/**
 * Prometheus scrape endpoint.
 * <p>
 * Every request gets its own {@link CollectorRegistry} holding a fresh {@link HealthCollector},
 * so concurrent scrapes never share a registry. The operational counters are the
 * process-wide {@link ScrapeCounters} and keep accumulating across requests.
 * <p>
 * Supported operations (any HTTP method):
 * - {telemetry path} - all cluster health series
 * - {telemetry path}?name[]=... - only the named series
 */
@Slf4j
@RestController
public class ScrapeHandler {

    private final HealthFetcher fetcher;
    private final ClusterHealthMetrics metrics;
    private final ScrapeCounters counters;

    public ScrapeHandler(HealthFetcher fetcher, ClusterHealthMetrics metrics, ScrapeCounters counters) {
        this.fetcher = fetcher;
        this.metrics = metrics;
        this.counters = counters;
    }

    @RequestMapping("${web.telemetryPath:/metrics}")
    public ResponseEntity<Object> scrape(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
            @RequestParam(value = "name[]", required = false) Set<String> names) {
        CollectorRegistry registry = new CollectorRegistry();
        registry.register(new HealthCollector(fetcher, metrics, counters));

        String contentType = TextFormat.chooseContentType(accept);
        StringWriter writer = new StringWriter();
        try {
            Enumeration<Collector.MetricFamilySamples> samples = names == null || names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names);
            TextFormat.writeFormat(contentType, writer, samples);
        } catch (IOException e) {
            // TextFormat declares IOException; a StringWriter never throws it
            log.error("Failed to write metrics exposition: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internalError(e.getMessage()));
        }

        log.debug("Served scrape with content type '{}'", contentType);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_TYPE, contentType)
            .body(writer.toString());
    }
}
