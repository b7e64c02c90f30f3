package io.ecsexporter.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per (cluster, resource kind) success of one collection pass.
 */
public record ScrapeOutcome(List<Entry> entries) {

    public record Entry(String cluster, ScrapedResource resource, boolean success) {
    }

    public ScrapeOutcome {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Outcome of a pass that produced nothing: every resource kind of every cluster failed.
     */
    public static ScrapeOutcome allFailed(Collection<String> clusters) {
        List<Entry> entries = new ArrayList<>();
        for (String cluster : clusters) {
            for (ScrapedResource resource : ScrapedResource.values()) {
                entries.add(new Entry(cluster, resource, false));
            }
        }
        return new ScrapeOutcome(entries);
    }

    public Optional<Boolean> success(String cluster, ScrapedResource resource) {
        return entries.stream()
                .filter(e -> e.cluster().equals(cluster) && e.resource() == resource)
                .map(Entry::success)
                .findFirst();
    }

    public boolean allSucceeded() {
        return entries.stream().allMatch(Entry::success);
    }
}
