package io.ecsexporter.core.model;

import java.util.Optional;

/**
 * Capacity dimensions a container instance reports.
 * Only CPU and MEMORY carry a metric label; the rest are recognized and ignored.
 */
public enum ResourceKind {
    CPU("CPU", "cpu"),
    MEMORY("MEMORY", "ram"),
    PORTS("PORTS", null),
    PORTS_UDP("PORTS_UDP", null),
    GPU("GPU", null);

    private final String apiName;
    private final String metricLabel;

    ResourceKind(String apiName, String metricLabel) {
        this.apiName = apiName;
        this.metricLabel = metricLabel;
    }

    public String apiName() {
        return apiName;
    }

    /**
     * Value of the {@code resource} label, empty for kinds without a metric.
     */
    public Optional<String> metricLabel() {
        return Optional.ofNullable(metricLabel);
    }

    /**
     * Resolve the resource name used by the ECS API.
     */
    public static Optional<ResourceKind> fromApiName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ResourceKind kind : values()) {
            if (kind.apiName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
