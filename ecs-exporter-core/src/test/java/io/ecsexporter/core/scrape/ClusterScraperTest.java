package io.ecsexporter.core.scrape;

import io.ecsexporter.core.collect.FakeEcsApi;
import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ResourceKind;
import io.ecsexporter.core.model.ScrapedResource;
import io.ecsexporter.core.model.ServiceRecord;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ClusterScraperTest {

    private static FakeEcsApi healthyCluster(FakeEcsApi api, String cluster) {
        api.servicePages(cluster, List.of(List.of(cluster + "-svc")));
        api.service(cluster + "-svc", new ServiceRecord(cluster + "-web", 3, 2, 1));
        api.instancePages(cluster, List.of(List.of(cluster + "-ci")));
        api.instance(cluster + "-ci", new ContainerInstanceRecord("i-" + cluster, 2, 1,
                Map.of(ResourceKind.CPU, 2048L, ResourceKind.MEMORY, 3904L, ResourceKind.GPU, 1L),
                Map.of(ResourceKind.CPU, 1024L, ResourceKind.MEMORY, 1952L)));
        return api;
    }

    private static Gauge gauge(PrometheusMeterRegistry registry, String name, String... tags) {
        return registry.find(name).tags(tags).gauge();
    }

    private static Set<String> meterIds(PrometheusMeterRegistry registry) {
        return registry.getMeters().stream()
                .map(Meter::getId)
                .map(id -> id.getName() + id.getTags())
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Should expose services, instances and success gauges per cluster")
    void scrape_FullCluster() {
        FakeEcsApi api = healthyCluster(new FakeEcsApi(), "B");

        PrometheusMeterRegistry registry = new ClusterScraper(api, List.of("B")).scrape().join();

        assertEquals(3.0, gauge(registry, "aws_ecs_service_desired_tasks", "cluster", "B", "service", "B-web").value());
        assertEquals(2.0, gauge(registry, "aws_ecs_service_tasks", "service", "B-web", "state", "running").value());
        assertEquals(1.0, gauge(registry, "aws_ecs_service_tasks", "service", "B-web", "state", "pending").value());
        assertEquals(1.0, gauge(registry, "aws_ecs_container_instance_tasks", "instance", "i-B", "state", "pending").value());
        assertEquals(3904.0, gauge(registry, "aws_ecs_container_instance_resources_registered",
                "instance", "i-B", "resource", "ram").value());
        assertEquals(1024.0, gauge(registry, "aws_ecs_container_instance_resources_remaining",
                "instance", "i-B", "resource", "cpu").value());
        assertEquals(2, registry.find("aws_ecs_container_instance_resources_registered").gauges().size());
        assertEquals(1.0, gauge(registry, "aws_ecs_exporter_success", "cluster", "B", "scraped_resource", "services").value());

        String text = registry.scrape();
        assertTrue(text.contains("aws_ecs_service_desired_tasks{"));
        assertFalse(text.contains("resource=\"gpu\""));
    }

    @Test
    @DisplayName("Should expose nothing for a failed kind while the other cluster stays complete")
    void scrape_PartialFailure() {
        FakeEcsApi api = new FakeEcsApi();
        healthyCluster(api, "A");
        healthyCluster(api, "B");
        api.failListing("A", ScrapedResource.CLUSTER_INSTANCES);

        PrometheusMeterRegistry registry = new ClusterScraper(api, List.of("A", "B")).scrape().join();

        assertTrue(registry.find("aws_ecs_container_instance_tasks").tag("cluster", "A").gauges().isEmpty());
        assertTrue(registry.find("aws_ecs_container_instance_resources_registered").tag("cluster", "A").gauges().isEmpty());
        assertEquals(2, registry.find("aws_ecs_container_instance_tasks").tag("cluster", "B").gauges().size());
        assertNotNull(gauge(registry, "aws_ecs_service_desired_tasks", "cluster", "A"));

        assertEquals(0.0, gauge(registry, "aws_ecs_exporter_success", "cluster", "A", "scraped_resource", "cluster_instances").value());
        assertEquals(1.0, gauge(registry, "aws_ecs_exporter_success", "cluster", "A", "scraped_resource", "services").value());
        assertEquals(1.0, gauge(registry, "aws_ecs_exporter_success", "cluster", "B", "scraped_resource", "cluster_instances").value());
        assertEquals(1.0, gauge(registry, "aws_ecs_exporter_success", "cluster", "B", "scraped_resource", "services").value());
    }

    @Test
    @DisplayName("Should still expose success gauges when every pipeline fails")
    void scrape_TotalFailure() {
        FakeEcsApi api = new FakeEcsApi()
                .failListing("A", ScrapedResource.SERVICES)
                .failListing("A", ScrapedResource.CLUSTER_INSTANCES);

        PrometheusMeterRegistry registry = new ClusterScraper(api, List.of("A")).scrape().join();

        assertEquals(2, registry.find("aws_ecs_exporter_success").gauges().size());
        assertTrue(registry.find("aws_ecs_exporter_success").gauges().stream().allMatch(g -> g.value() == 0.0));
        assertEquals(2, registry.getMeters().size());
    }

    @Test
    @DisplayName("Should build a new registry on every scrape, also when scrapes run concurrently")
    void scrape_Concurrent() throws Exception {
        FakeEcsApi api = new FakeEcsApi();
        healthyCluster(api, "A");
        healthyCluster(api, "B");
        ClusterScraper scraper = new ClusterScraper(api, List.of("A", "B"));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<PrometheusMeterRegistry> first = CompletableFuture.supplyAsync(() -> scraper.scrape().join(), pool);
            CompletableFuture<PrometheusMeterRegistry> second = CompletableFuture.supplyAsync(() -> scraper.scrape().join(), pool);

            PrometheusMeterRegistry r1 = first.get();
            PrometheusMeterRegistry r2 = second.get();

            assertNotSame(r1, r2);
            assertEquals(meterIds(r1), meterIds(r2));
            assertFalse(meterIds(r1).isEmpty());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should require at least one non-blank cluster")
    void constructor_Validation() {
        FakeEcsApi api = new FakeEcsApi();
        assertThrows(IllegalArgumentException.class, () -> new ClusterScraper(api, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ClusterScraper(api, List.of("")));
    }

    @Test
    @DisplayName("Should report a zero success gauge for every cluster and kind when the scrape is abandoned")
    void failedScrape_AllZero() {
        ClusterScraper scraper = new ClusterScraper(new FakeEcsApi(), List.of("A", "B", "A"));

        PrometheusMeterRegistry registry = scraper.failedScrape();

        assertEquals(4, registry.getMeters().size());
        for (String cluster : List.of("A", "B")) {
            for (ScrapedResource resource : ScrapedResource.values()) {
                assertEquals(0.0, gauge(registry, "aws_ecs_exporter_success",
                        "cluster", cluster, "scraped_resource", resource.label()).value());
            }
        }
        assertNotSame(registry, scraper.failedScrape());
    }
}
