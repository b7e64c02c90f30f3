package io.ecsexporter.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static io.ecsexporter.core.model.ServiceRecord.requireNonNegative;

/**
 * Task counts and resource capacity of one container instance at scrape time.
 *
 * @param ec2InstanceId       EC2 instance id, {@code null} when the API did not return one
 * @param runningTasksCount   tasks running on the instance
 * @param pendingTasksCount   tasks pending on the instance
 * @param registeredResources total capacity per resource kind
 * @param remainingResources  unallocated capacity per resource kind
 */
public record ContainerInstanceRecord(String ec2InstanceId,
                                      long runningTasksCount,
                                      long pendingTasksCount,
                                      Map<ResourceKind, Long> registeredResources,
                                      Map<ResourceKind, Long> remainingResources) {

    public ContainerInstanceRecord {
        requireNonNegative("runningTasksCount", runningTasksCount);
        requireNonNegative("pendingTasksCount", pendingTasksCount);
        registeredResources = freeze(registeredResources);
        remainingResources = freeze(remainingResources);
    }

    private static Map<ResourceKind, Long> freeze(Map<ResourceKind, Long> resources) {
        if (resources == null || resources.isEmpty()) {
            return Collections.unmodifiableMap(new EnumMap<>(ResourceKind.class));
        }
        return Collections.unmodifiableMap(new EnumMap<>(resources));
    }
}
