package io.ecsexporter.core.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One value of a metric family with its labels, in the family's label order.
 */
public record MetricSample(MetricFamily family, Map<String, String> labels, long value) {

    public MetricSample {
        if (!new ArrayList<>(labels.keySet()).equals(family.labelNames())) {
            throw new IllegalArgumentException("Labels " + labels.keySet() + " do not match "
                    + family.metricName() + family.labelNames());
        }
        for (Map.Entry<String, String> label : labels.entrySet()) {
            if (label.getValue() == null || label.getValue().isEmpty()) {
                throw new IllegalArgumentException("Empty value for label " + label.getKey()
                        + " of " + family.metricName());
            }
        }
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Build a sample from label values given in the family's label order.
     */
    public static MetricSample of(MetricFamily family, long value, String... labelValues) {
        if (labelValues.length != family.labelNames().size()) {
            throw new IllegalArgumentException(family.metricName() + " expects labels " + family.labelNames());
        }
        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < labelValues.length; i++) {
            labels.put(family.labelNames().get(i), labelValues[i]);
        }
        return new MetricSample(family, labels, value);
    }
}
