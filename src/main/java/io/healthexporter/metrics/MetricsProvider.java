package io.healthexporter.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/*
 * MetricsProvider creates the process-wide meters that outlive a single scrape,
 * backed by the application MeterRegistry.
 */
@Component
@Slf4j
public class MetricsProvider {

    private final MeterRegistry registry;

    @Autowired
    public MetricsProvider(MeterRegistry registry) {
        this.registry = registry;
        log.info("MetricsProvider initialized with {}", registry.getClass().getSimpleName());
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param help the description of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, String help, Map<String, String> tags) {
        return Counter.builder(name).description(help).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create a Gauge metric with the given name and tags, starting at zero.
     *
     * @param name the name of the gauge
     * @param help the description of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, String help, Map<String, String> tags) {
        AtomicDouble gaugeValue = new AtomicDouble(0);
        Gauge.builder(name, gaugeValue::get).description(help).tags(mapToTagArray(tags)).register(registry);
        return gaugeValue;
    }

    /**
     * Convert a map of tags to an array of alternating keys and values.
     *
     * @param tags the map of tags
     * @return array of alternating keys and values
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[tags.size() * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        return tagArray;
    }
}
