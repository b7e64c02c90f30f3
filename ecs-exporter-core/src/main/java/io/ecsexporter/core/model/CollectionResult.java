package io.ecsexporter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshots of every requested cluster, in request order, plus the outcome of each pipeline.
 */
public record CollectionResult(Map<String, ClusterSnapshot> snapshots, ScrapeOutcome outcome) {

    public CollectionResult {
        snapshots = Collections.unmodifiableMap(new LinkedHashMap<>(snapshots));
    }

    public ClusterSnapshot snapshot(String cluster) {
        return snapshots.get(cluster);
    }
}
