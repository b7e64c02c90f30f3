package io.ecsexporter.core.api;

import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ServiceRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The four ECS calls the collection pipeline depends on.
 *
 * Implementations are shared by every scrape and must not keep per-call state.
 * A call-level failure (network, auth, throttling) is reported by completing the
 * returned future exceptionally. Resources the API could not resolve inside an
 * otherwise successful describe call are reported through {@link DescribeResult#failures()}.
 */
public interface EcsApi {

    /**
     * List one page of service ARNs.
     *
     * @param cluster   cluster name
     * @param nextToken continuation token from the previous page, {@code null} for the first page
     */
    CompletableFuture<IdentifierPage> listServices(String cluster, String nextToken);

    /**
     * Describe at most {@value io.ecsexporter.core.collect.BatchDescriber#MAX_BATCH_SIZE} services.
     */
    CompletableFuture<DescribeResult<ServiceRecord>> describeServices(String cluster, List<String> services);

    /**
     * List one page of container instance ARNs.
     *
     * @param cluster   cluster name
     * @param nextToken continuation token from the previous page, {@code null} for the first page
     */
    CompletableFuture<IdentifierPage> listContainerInstances(String cluster, String nextToken);

    /**
     * Describe at most {@value io.ecsexporter.core.collect.BatchDescriber#MAX_BATCH_SIZE} container instances.
     */
    CompletableFuture<DescribeResult<ContainerInstanceRecord>> describeContainerInstances(String cluster, List<String> containerInstances);
}
