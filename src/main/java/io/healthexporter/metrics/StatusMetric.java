package io.healthexporter.metrics;

import io.healthexporter.enums.HealthStatus;
import io.healthexporter.models.HealthSnapshot;
import lombok.Value;

/**
 * One-hot gauge over {@link HealthStatus}: emitted once per color, 1 for the color the
 * cluster reported and 0 for the others.
 */
@Value
public class StatusMetric {
    String name;
    String help;

    public double value(HealthSnapshot snapshot, HealthStatus color) {
        return color.matches(snapshot.getStatus()) ? 1 : 0;
    }
}
