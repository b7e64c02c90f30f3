package io.ecsexporter.core.metrics;

import io.ecsexporter.core.model.ClusterSnapshot;
import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ResourceKind;
import io.ecsexporter.core.model.ScrapeOutcome;
import io.ecsexporter.core.model.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns collected ECS records into metric samples. No I/O.
 *
 * <p>A record without its identifying field (service name, EC2 instance id)
 * cannot be labelled, so it is skipped with a warning instead of producing a sample.
 */
public final class MetricDeriver {

    private static final Logger log = LoggerFactory.getLogger(MetricDeriver.class);

    static final String RUNNING = "running";
    static final String PENDING = "pending";

    private MetricDeriver() {
    }

    public static List<MetricSample> derive(ClusterSnapshot snapshot) {
        List<MetricSample> samples = new ArrayList<>();
        samples.addAll(deriveServices(snapshot.clusterName(), snapshot.services()));
        samples.addAll(deriveInstances(snapshot.clusterName(), snapshot.instances()));
        return samples;
    }

    public static List<MetricSample> deriveServices(String cluster, List<ServiceRecord> services) {
        List<MetricSample> samples = new ArrayList<>(services.size() * 3);
        for (ServiceRecord service : services) {
            String name = service.name();
            if (isMissing(name)) {
                log.warn("Skipping service without a name in cluster {}: {}", cluster, service);
                continue;
            }
            samples.add(MetricSample.of(MetricFamily.SERVICE_DESIRED_TASKS, service.desiredCount(), cluster, name));
            samples.add(MetricSample.of(MetricFamily.SERVICE_TASKS, service.runningCount(), cluster, name, RUNNING));
            samples.add(MetricSample.of(MetricFamily.SERVICE_TASKS, service.pendingCount(), cluster, name, PENDING));
        }
        return samples;
    }

    public static List<MetricSample> deriveInstances(String cluster, List<ContainerInstanceRecord> instances) {
        List<MetricSample> samples = new ArrayList<>();
        for (ContainerInstanceRecord instance : instances) {
            String id = instance.ec2InstanceId();
            if (isMissing(id)) {
                log.warn("Skipping container instance without an EC2 instance id in cluster {}", cluster);
                continue;
            }
            samples.add(MetricSample.of(MetricFamily.CONTAINER_INSTANCE_TASKS,
                    instance.runningTasksCount(), cluster, id, RUNNING));
            samples.add(MetricSample.of(MetricFamily.CONTAINER_INSTANCE_TASKS,
                    instance.pendingTasksCount(), cluster, id, PENDING));
            addResources(samples, MetricFamily.CONTAINER_INSTANCE_RESOURCES_REGISTERED,
                    cluster, id, instance.registeredResources());
            addResources(samples, MetricFamily.CONTAINER_INSTANCE_RESOURCES_REMAINING,
                    cluster, id, instance.remainingResources());
        }
        return samples;
    }

    /**
     * One sample per (cluster, resource kind): 1 when the pipeline succeeded, 0 otherwise.
     */
    public static List<MetricSample> deriveOutcome(ScrapeOutcome outcome) {
        List<MetricSample> samples = new ArrayList<>(outcome.entries().size());
        for (ScrapeOutcome.Entry entry : outcome.entries()) {
            samples.add(MetricSample.of(MetricFamily.EXPORTER_SUCCESS, entry.success() ? 1 : 0,
                    entry.cluster(), entry.resource().label()));
        }
        return samples;
    }

    private static void addResources(List<MetricSample> samples, MetricFamily family, String cluster,
                                     String instanceId, Map<ResourceKind, Long> resources) {
        for (Map.Entry<ResourceKind, Long> resource : resources.entrySet()) {
            resource.getKey().metricLabel().ifPresent(label ->
                    samples.add(MetricSample.of(family, resource.getValue(), cluster, instanceId, label)));
        }
    }

    private static boolean isMissing(String value) {
        return value == null || value.isEmpty();
    }
}
