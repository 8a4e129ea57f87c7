package io.healthexporter;

import io.healthexporter.config.ExporterConfig;
import io.healthexporter.config.HttpClientFactory;
import io.healthexporter.health.HealthFetcher;
import io.healthexporter.metrics.ClusterHealthMetrics;
import io.healthexporter.metrics.MetricsProvider;
import io.healthexporter.metrics.ScrapeCounters;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.net.http.HttpClient;

/**
 * Main Spring Boot application class for the cluster health exporter.
 *
 * Serves a Prometheus scrape endpoint; every scrape fetches the target cluster's
 * {@code _cluster/health} API once and republishes its fields as metric samples.
 */
@Slf4j
@SpringBootApplication
public class ClusterHealthExporterApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Health Exporter");

        try {
            SpringApplication.run(ClusterHealthExporterApplication.class, args);
            log.info("Cluster Health Exporter started successfully");

        } catch (Exception e) {
            log.error("Failed to start Cluster Health Exporter: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public ExporterConfig config() {
        ExporterConfig config = new ExporterConfig();
        log.info("Loaded configuration");
        return config;
    }

    /**
     * Registry holding the process-wide operational meters.
     */
    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Outbound client shared by all scrapes.
     */
    @Bean
    public HttpClient healthHttpClient(ExporterConfig config) {
        log.info("Initializing HTTP client with connect timeout {}s", config.getTimeout().getSeconds());
        return HttpClientFactory.create(config);
    }

    @Bean
    public HealthFetcher healthFetcher(ExporterConfig config, HttpClient healthHttpClient) {
        log.info("Initializing HealthFetcher for {}", ExporterConfig.redact(config.getTargetUri()));
        return new HealthFetcher(healthHttpClient, config.getTargetUri(), config.getTimeout());
    }

    @Bean
    public ClusterHealthMetrics clusterHealthMetrics(ExporterConfig config) {
        return new ClusterHealthMetrics(config.getNamespace());
    }

    @Bean
    public ScrapeCounters scrapeCounters(MetricsProvider metricsProvider, ClusterHealthMetrics clusterHealthMetrics) {
        log.info("Initializing process-wide scrape counters");
        return new ScrapeCounters(metricsProvider, clusterHealthMetrics);
    }
}
