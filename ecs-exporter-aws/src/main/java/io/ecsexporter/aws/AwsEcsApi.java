package io.ecsexporter.aws;

import io.ecsexporter.core.api.DescribeResult;
import io.ecsexporter.core.api.EcsApi;
import io.ecsexporter.core.api.IdentifierPage;
import io.ecsexporter.core.api.ResourceFailure;
import io.ecsexporter.core.model.ContainerInstanceRecord;
import io.ecsexporter.core.model.ResourceKind;
import io.ecsexporter.core.model.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ecs.EcsAsyncClient;
import software.amazon.awssdk.services.ecs.model.ContainerInstance;
import software.amazon.awssdk.services.ecs.model.DescribeContainerInstancesRequest;
import software.amazon.awssdk.services.ecs.model.DescribeServicesRequest;
import software.amazon.awssdk.services.ecs.model.Failure;
import software.amazon.awssdk.services.ecs.model.ListContainerInstancesRequest;
import software.amazon.awssdk.services.ecs.model.ListServicesRequest;
import software.amazon.awssdk.services.ecs.model.Resource;
import software.amazon.awssdk.services.ecs.model.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * {@link EcsApi} backed by the AWS SDK v2 asynchronous ECS client.
 *
 * The client is thread-safe and is shared by every scrape. Retries and
 * timeouts are whatever the client was built with.
 */
public class AwsEcsApi implements EcsApi {

    private static final Logger log = LoggerFactory.getLogger(AwsEcsApi.class);

    private final EcsAsyncClient client;

    public AwsEcsApi(EcsAsyncClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<IdentifierPage> listServices(String cluster, String nextToken) {
        ListServicesRequest request = ListServicesRequest.builder()
                .cluster(cluster)
                .nextToken(nextToken)
                .build();
        return client.listServices(request)
                .thenApply(response -> new IdentifierPage(response.serviceArns(), response.nextToken()));
    }

    @Override
    public CompletableFuture<DescribeResult<ServiceRecord>> describeServices(String cluster, List<String> services) {
        DescribeServicesRequest request = DescribeServicesRequest.builder()
                .cluster(cluster)
                .services(services)
                .build();
        return client.describeServices(request)
                .thenApply(response -> new DescribeResult<>(
                        response.services().stream().map(AwsEcsApi::toServiceRecord).collect(Collectors.toList()),
                        toFailures(response.failures())));
    }

    @Override
    public CompletableFuture<IdentifierPage> listContainerInstances(String cluster, String nextToken) {
        ListContainerInstancesRequest request = ListContainerInstancesRequest.builder()
                .cluster(cluster)
                .nextToken(nextToken)
                .build();
        return client.listContainerInstances(request)
                .thenApply(response -> new IdentifierPage(response.containerInstanceArns(), response.nextToken()));
    }

    @Override
    public CompletableFuture<DescribeResult<ContainerInstanceRecord>> describeContainerInstances(String cluster,
                                                                                               List<String> containerInstances) {
        DescribeContainerInstancesRequest request = DescribeContainerInstancesRequest.builder()
                .cluster(cluster)
                .containerInstances(containerInstances)
                .build();
        return client.describeContainerInstances(request)
                .thenApply(response -> new DescribeResult<>(
                        response.containerInstances().stream()
                                .map(AwsEcsApi::toContainerInstanceRecord)
                                .collect(Collectors.toList()),
                        toFailures(response.failures())));
    }

    static ServiceRecord toServiceRecord(Service service) {
        return new ServiceRecord(
                service.serviceName(),
                count(service.desiredCount()),
                count(service.runningCount()),
                count(service.pendingCount()));
    }

    static ContainerInstanceRecord toContainerInstanceRecord(ContainerInstance instance) {
        return new ContainerInstanceRecord(
                instance.ec2InstanceId(),
                count(instance.runningTasksCount()),
                count(instance.pendingTasksCount()),
                toResources(instance.registeredResources()),
                toResources(instance.remainingResources()));
    }

    static Map<ResourceKind, Long> toResources(List<Resource> resources) {
        Map<ResourceKind, Long> result = new EnumMap<>(ResourceKind.class);
        for (Resource resource : resources) {
            ResourceKind.fromApiName(resource.name()).ifPresentOrElse(
                    kind -> result.put(kind, count(resource.integerValue())),
                    () -> log.debug("Ignoring unknown resource {}", resource.name()));
        }
        return result;
    }

    static List<ResourceFailure> toFailures(List<Failure> failures) {
        return failures.stream()
                .map(f -> new ResourceFailure(f.arn(), f.reason(), f.detail()))
                .collect(Collectors.toList());
    }

    private static long count(Integer value) {
        return value == null ? 0L : Math.max(0, value);
    }
}
