package io.ecsexporter.core.model;

import java.util.List;

/**
 * Everything one collection pass resolved for a cluster. A resource kind whose
 * pipeline failed is represented by an empty list.
 */
public record ClusterSnapshot(String clusterName,
                              List<ServiceRecord> services,
                              List<ContainerInstanceRecord> instances) {

    public ClusterSnapshot {
        if (clusterName == null || clusterName.isBlank()) {
            throw new IllegalArgumentException("clusterName must not be blank");
        }
        services = services == null ? List.of() : List.copyOf(services);
        instances = instances == null ? List.of() : List.copyOf(instances);
    }
}
