package io.ecsexporter.core.metrics;

import io.ecsexporter.core.model.ClusterSnapshot;
import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ResourceKind;
import io.ecsexporter.core.model.ScrapeOutcome;
import io.ecsexporter.core.model.ScrapedResource;
import io.ecsexporter.core.model.ServiceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MetricDeriverTest {

    private static List<MetricSample> ofFamily(List<MetricSample> samples, MetricFamily family) {
        return samples.stream().filter(s -> s.family() == family).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should emit desired and per-state current counts for a service")
    void deriveServices() {
        List<MetricSample> samples = MetricDeriver.deriveServices("demo",
                List.of(new ServiceRecord("web", 4, 3, 1)));

        assertEquals(List.of(
                MetricSample.of(MetricFamily.SERVICE_DESIRED_TASKS, 4, "demo", "web"),
                MetricSample.of(MetricFamily.SERVICE_TASKS, 3, "demo", "web", "running"),
                MetricSample.of(MetricFamily.SERVICE_TASKS, 1, "demo", "web", "pending")), samples);
    }

    @Test
    @DisplayName("Should map CPU to cpu, MEMORY to ram and drop other resource kinds")
    void deriveInstances_ResourceFilter() {
        ContainerInstanceRecord instance = new ContainerInstanceRecord("i-0abc", 5, 2,
                Map.of(ResourceKind.CPU, 4096L, ResourceKind.MEMORY, 7680L, ResourceKind.GPU, 1L, ResourceKind.PORTS, 0L),
                Map.of(ResourceKind.CPU, 1024L, ResourceKind.GPU, 1L));

        List<MetricSample> samples = MetricDeriver.deriveInstances("demo", List.of(instance));

        assertEquals(List.of(
                MetricSample.of(MetricFamily.CONTAINER_INSTANCE_TASKS, 5, "demo", "i-0abc", "running"),
                MetricSample.of(MetricFamily.CONTAINER_INSTANCE_TASKS, 2, "demo", "i-0abc", "pending")),
                ofFamily(samples, MetricFamily.CONTAINER_INSTANCE_TASKS));
        assertEquals(List.of(
                MetricSample.of(MetricFamily.CONTAINER_INSTANCE_RESOURCES_REGISTERED, 4096, "demo", "i-0abc", "cpu"),
                MetricSample.of(MetricFamily.CONTAINER_INSTANCE_RESOURCES_REGISTERED, 7680, "demo", "i-0abc", "ram")),
                ofFamily(samples, MetricFamily.CONTAINER_INSTANCE_RESOURCES_REGISTERED));
        assertEquals(List.of(
                MetricSample.of(MetricFamily.CONTAINER_INSTANCE_RESOURCES_REMAINING, 1024, "demo", "i-0abc", "cpu")),
                ofFamily(samples, MetricFamily.CONTAINER_INSTANCE_RESOURCES_REMAINING));
    }

    @Test
    @DisplayName("Should produce no resource sample for a GPU-only instance")
    void deriveInstances_GpuOnly() {
        ContainerInstanceRecord instance = new ContainerInstanceRecord("i-gpu", 0, 0,
                Map.of(ResourceKind.GPU, 4L), Map.of(ResourceKind.GPU, 2L));

        List<MetricSample> samples = MetricDeriver.deriveInstances("demo", List.of(instance));

        assertEquals(2, samples.size());
        assertTrue(samples.stream().allMatch(s -> s.family() == MetricFamily.CONTAINER_INSTANCE_TASKS));
    }

    @Test
    @DisplayName("Should skip records without an identifying field")
    void derive_SkipsUnnamedRecords() {
        ClusterSnapshot snapshot = new ClusterSnapshot("demo",
                List.of(new ServiceRecord(null, 1, 1, 0), new ServiceRecord("", 1, 1, 0), new ServiceRecord("api", 1, 1, 0)),
                List.of(new ContainerInstanceRecord(null, 1, 0, Map.of(ResourceKind.CPU, 1L), Map.of())));

        List<MetricSample> samples = MetricDeriver.derive(snapshot);

        assertEquals(3, samples.size());
        assertTrue(samples.stream().allMatch(s -> "api".equals(s.labels().get("service"))));
    }

    @Test
    @DisplayName("Should emit one success sample per outcome entry")
    void deriveOutcome() {
        ScrapeOutcome outcome = new ScrapeOutcome(List.of(
                new ScrapeOutcome.Entry("A", ScrapedResource.SERVICES, true),
                new ScrapeOutcome.Entry("A", ScrapedResource.CLUSTER_INSTANCES, false)));

        List<MetricSample> samples = MetricDeriver.deriveOutcome(outcome);

        assertEquals(List.of(
                MetricSample.of(MetricFamily.EXPORTER_SUCCESS, 1, "A", "services"),
                MetricSample.of(MetricFamily.EXPORTER_SUCCESS, 0, "A", "cluster_instances")), samples);
    }

    @Test
    @DisplayName("Should reject samples with empty label values or wrong label names")
    void sample_Validation() {
        assertThrows(IllegalArgumentException.class,
                () -> MetricSample.of(MetricFamily.SERVICE_DESIRED_TASKS, 1, "demo", ""));
        assertThrows(IllegalArgumentException.class,
                () -> MetricSample.of(MetricFamily.SERVICE_DESIRED_TASKS, 1, "demo"));
        assertThrows(IllegalArgumentException.class,
                () -> new MetricSample(MetricFamily.SERVICE_DESIRED_TASKS, Map.of("cluster", "demo"), 1));
    }
}
