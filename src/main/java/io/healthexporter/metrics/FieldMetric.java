package io.healthexporter.metrics;

import io.healthexporter.models.HealthSnapshot;
import lombok.Value;

import java.util.function.ToDoubleFunction;

/**
 * A gauge read straight off one snapshot field, labeled by cluster name.
 */
@Value
public class FieldMetric {
    String name;
    String help;
    ToDoubleFunction<HealthSnapshot> extractor;

    public double value(HealthSnapshot snapshot) {
        return extractor.applyAsDouble(snapshot);
    }
}
