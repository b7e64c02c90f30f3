package io.ecsexporter.core.collect;

import io.ecsexporter.core.api.EcsApi;
import io.ecsexporter.core.api.IdentifierPage;
import io.ecsexporter.core.model.ScrapedResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Enumerates every identifier of one resource kind in a cluster by following
 * the continuation token until a page comes back without one.
 *
 * Pages are requested strictly one after another. The first failed page fails
 * the whole listing, so callers never see a truncated list.
 */
public class PaginatedLister {

    private static final Logger log = LoggerFactory.getLogger(PaginatedLister.class);

    private final EcsApi api;

    public PaginatedLister(EcsApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    /**
     * List all identifiers of the given kind, in response order.
     *
     * @param cluster  cluster name
     * @param resource resource kind to enumerate
     * @return future of the identifiers; completes exceptionally on the first failed page
     */
    public CompletableFuture<List<String>> listIdentifiers(String cluster, ScrapedResource resource) {
        List<String> identifiers = new ArrayList<>();
        return fetchFrom(cluster, resource, null, identifiers, 1)
                .thenApply(pages -> {
                    log.debug("Listed {} {} in cluster {} over {} page(s)",
                            identifiers.size(), resource.label(), cluster, pages);
                    return Collections.unmodifiableList(identifiers);
                });
    }

    private CompletableFuture<Integer> fetchFrom(String cluster, ScrapedResource resource, String nextToken,
                                                 List<String> identifiers, int pageNumber) {
        return Futures.invoke(() -> page(cluster, resource, nextToken))
                .thenCompose(page -> {
                    identifiers.addAll(page.identifiers());
                    if (!page.hasNextToken()) {
                        return CompletableFuture.completedFuture(pageNumber);
                    }
                    return fetchFrom(cluster, resource, page.nextToken(), identifiers, pageNumber + 1);
                });
    }

    private CompletableFuture<IdentifierPage> page(String cluster, ScrapedResource resource, String nextToken) {
        return switch (resource) {
            case SERVICES -> api.listServices(cluster, nextToken);
            case CLUSTER_INSTANCES -> api.listContainerInstances(cluster, nextToken);
        };
    }
}
