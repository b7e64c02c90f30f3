package io.ecsexporter.core.collect;

import io.ecsexporter.core.api.EcsApi;
import io.ecsexporter.core.model.ClusterSnapshot;
import io.ecsexporter.core.model.CollectionResult;
import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ScrapeOutcome;
import io.ecsexporter.core.model.ScrapedResource;
import io.ecsexporter.core.model.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Collects services and container instances of one or more clusters.
 *
 * <p>Every (cluster, resource kind) pair is an independent pipeline of
 * list + describe. A pipeline that fails is logged and recorded as failed in the
 * {@link ScrapeOutcome}; it never stops the other pipelines and never fails the
 * returned future. Pipelines run concurrently; inside a pipeline all calls are sequential.
 */
public class ClusterCollector {

    private static final Logger log = LoggerFactory.getLogger(ClusterCollector.class);

    private final PaginatedLister lister;
    private final BatchDescriber describer;

    public ClusterCollector(EcsApi api) {
        this(new PaginatedLister(api), new BatchDescriber(api));
    }

    public ClusterCollector(PaginatedLister lister, BatchDescriber describer) {
        this.lister = Objects.requireNonNull(lister, "lister");
        this.describer = Objects.requireNonNull(describer, "describer");
    }

    /**
     * Collect a fresh snapshot of every named cluster.
     *
     * @param clusterNames cluster names; duplicates are collapsed, order is kept
     * @return future that always completes normally
     * @throws IllegalArgumentException if a cluster name is blank
     */
    public CompletableFuture<CollectionResult> collect(Collection<String> clusterNames) {
        for (String cluster : clusterNames) {
            if (cluster == null || cluster.isBlank()) {
                throw new IllegalArgumentException("Cluster names must not be blank: " + clusterNames);
            }
        }
        List<ClusterPipelines> pipelines = new ArrayList<>();
        for (String cluster : new LinkedHashSet<>(clusterNames)) {
            pipelines.add(new ClusterPipelines(
                    cluster,
                    isolate(cluster, ScrapedResource.SERVICES, collectServices(cluster)),
                    isolate(cluster, ScrapedResource.CLUSTER_INSTANCES, collectInstances(cluster))));
        }

        CompletableFuture<?>[] all = pipelines.stream()
                .flatMap(p -> Stream.of(p.services(), p.instances()))
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(all).thenApply(ignored -> assemble(pipelines));
    }

    private CompletableFuture<List<ServiceRecord>> collectServices(String cluster) {
        return Futures.invoke(() -> lister.listIdentifiers(cluster, ScrapedResource.SERVICES))
                .thenCompose(arns -> describer.describeServices(cluster, arns));
    }

    private CompletableFuture<List<ContainerInstanceRecord>> collectInstances(String cluster) {
        return Futures.invoke(() -> lister.listIdentifiers(cluster, ScrapedResource.CLUSTER_INSTANCES))
                .thenCompose(arns -> describer.describeContainerInstances(cluster, arns));
    }

    private static <T> CompletableFuture<Attempt<T>> isolate(String cluster, ScrapedResource resource,
                                                          CompletableFuture<List<T>> pipeline) {
        return pipeline.handle((records, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                log.warn("Failed to collect {} of cluster {}: {}", resource.label(), cluster, cause.toString());
                log.debug("Collection failure for cluster {}", cluster, cause);
                return Attempt.failed();
            }
            log.debug("Collected {} {} of cluster {}", records.size(), resource.label(), cluster);
            return Attempt.succeeded(records);
        });
    }

    private static CollectionResult assemble(List<ClusterPipelines> pipelines) {
        Map<String, ClusterSnapshot> snapshots = new LinkedHashMap<>();
        List<ScrapeOutcome.Entry> entries = new ArrayList<>();
        for (ClusterPipelines p : pipelines) {
            Attempt<ServiceRecord> services = p.services().join();
            Attempt<ContainerInstanceRecord> instances = p.instances().join();
            snapshots.put(p.cluster(), new ClusterSnapshot(p.cluster(), services.records(), instances.records()));
            entries.add(new ScrapeOutcome.Entry(p.cluster(), ScrapedResource.SERVICES, services.success()));
            entries.add(new ScrapeOutcome.Entry(p.cluster(), ScrapedResource.CLUSTER_INSTANCES, instances.success()));
        }
        return new CollectionResult(snapshots, new ScrapeOutcome(entries));
    }

    private record ClusterPipelines(String cluster,
                                    CompletableFuture<Attempt<ServiceRecord>> services,
                                    CompletableFuture<Attempt<ContainerInstanceRecord>> instances) {
    }

    private record Attempt<T>(boolean success, List<T> records) {

        static <T> Attempt<T> succeeded(List<T> records) {
            return new Attempt<>(true, records);
        }

        static <T> Attempt<T> failed() {
            return new Attempt<>(false, List.of());
        }
    }
}
