package io.ecsexporter.core.collect;

import com.google.common.collect.Lists;
import io.ecsexporter.core.api.DescribeResult;
import io.ecsexporter.core.api.EcsApi;
import io.ecsexporter.core.api.ResourceFailure;
import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ScrapedResource;
import io.ecsexporter.core.model.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Fetches details for a list of identifiers in batches of at most {@value #MAX_BATCH_SIZE}.
 *
 * <p>Batches are sent one after another in input order and their records are
 * concatenated in the same order. Two kinds of failure are handled differently:
 * <ul>
 *   <li>a failed call aborts the whole operation, and the records of batches
 *       that already succeeded are discarded;</li>
 *   <li>a resource the API reports as unresolvable is logged and left out of
 *       the result, and the operation still succeeds.</li>
 * </ul>
 */
public class BatchDescriber {

    private static final Logger log = LoggerFactory.getLogger(BatchDescriber.class);

    /**
     * Maximum number of identifiers the ECS describe calls accept.
     */
    public static final int MAX_BATCH_SIZE = 10;

    private final EcsApi api;

    public BatchDescriber(EcsApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    public CompletableFuture<List<ServiceRecord>> describeServices(String cluster, List<String> serviceArns) {
        return describe(cluster, ScrapedResource.SERVICES, serviceArns,
                batch -> api.describeServices(cluster, batch));
    }

    public CompletableFuture<List<ContainerInstanceRecord>> describeContainerInstances(String cluster,
                                                                                       List<String> instanceArns) {
        return describe(cluster, ScrapedResource.CLUSTER_INSTANCES, instanceArns,
                batch -> api.describeContainerInstances(cluster, batch));
    }

    private <T> CompletableFuture<List<T>> describe(String cluster,
                                                    ScrapedResource resource,
                                                    List<String> identifiers,
                                                    Function<List<String>, CompletableFuture<DescribeResult<T>>> call) {
        List<T> records = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

        for (List<String> partition : Lists.partition(List.copyOf(identifiers), MAX_BATCH_SIZE)) {
            List<String> batch = List.copyOf(partition);
            chain = chain
                    .thenCompose(ignored -> Futures.invoke(() -> call.apply(batch)))
                    .thenAccept(response -> {
                        logFailures(cluster, resource, response.failures());
                        records.addAll(response.records());
                    });
        }

        return chain.thenApply(ignored -> Collections.unmodifiableList(records));
    }

    private static void logFailures(String cluster, ScrapedResource resource, List<ResourceFailure> failures) {
        for (ResourceFailure failure : failures) {
            log.warn("Failed to describe {} in cluster {}: arn={}, reason={}, detail={}",
                    resource.label(), cluster, failure.arn(), failure.reason(), failure.detail());
        }
    }
}
