package io.ecsexporter.core.model;

/**
 * Task counts of one ECS service at scrape time.
 *
 * @param name         service name, {@code null} when the API did not return one
 * @param desiredCount desired task count
 * @param runningCount running task count
 * @param pendingCount pending task count
 */
public record ServiceRecord(String name, long desiredCount, long runningCount, long pendingCount) {

    public ServiceRecord {
        requireNonNegative("desiredCount", desiredCount);
        requireNonNegative("runningCount", runningCount);
        requireNonNegative("pendingCount", pendingCount);
    }

    static void requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }
}
