package io.ecsexporter.core.metrics;

import java.util.List;

/**
 * Metric families exposed for every scrape. Names and label sets are part of
 * the exporter's compatibility surface.
 */
public enum MetricFamily {
    SERVICE_DESIRED_TASKS("aws_ecs_service_desired_tasks",
            "Desired task count of the service",
            "cluster", "service"),
    SERVICE_TASKS("aws_ecs_service_tasks",
            "Current task count of the service by state",
            "cluster", "service", "state"),
    CONTAINER_INSTANCE_TASKS("aws_ecs_container_instance_tasks",
            "Tasks on the container instance by state",
            "cluster", "instance", "state"),
    CONTAINER_INSTANCE_RESOURCES_REGISTERED("aws_ecs_container_instance_resources_registered",
            "Total capacity registered by the container instance",
            "cluster", "instance", "resource"),
    CONTAINER_INSTANCE_RESOURCES_REMAINING("aws_ecs_container_instance_resources_remaining",
            "Unallocated capacity of the container instance",
            "cluster", "instance", "resource"),
    EXPORTER_SUCCESS("aws_ecs_exporter_success",
            "Whether retrieval of the resource from the AWS ECS API succeeded in this scrape",
            "cluster", "scraped_resource");

    private final String metricName;
    private final String help;
    private final List<String> labelNames;

    MetricFamily(String metricName, String help, String... labelNames) {
        this.metricName = metricName;
        this.help = help;
        this.labelNames = List.of(labelNames);
    }

    public String metricName() {
        return metricName;
    }

    public String help() {
        return help;
    }

    public List<String> labelNames() {
        return labelNames;
    }
}
