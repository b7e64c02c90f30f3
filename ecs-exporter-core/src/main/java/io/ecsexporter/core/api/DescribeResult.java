package io.ecsexporter.core.api;

import java.util.List;

/**
 * Response of a single describe call: the resolved records and the per-resource failures.
 */
public record DescribeResult<T>(List<T> records, List<ResourceFailure> failures) {

    public DescribeResult {
        records = records == null ? List.of() : List.copyOf(records);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static <T> DescribeResult<T> of(List<T> records) {
        return new DescribeResult<>(records, List.of());
    }
}
