package io.ecsexporter.core.scrape;

import io.ecsexporter.core.api.EcsApi;
import io.ecsexporter.core.collect.ClusterCollector;
import io.ecsexporter.core.metrics.MetricDeriver;
import io.ecsexporter.core.metrics.MetricSample;
import io.ecsexporter.core.model.ClusterSnapshot;
import io.ecsexporter.core.model.CollectionResult;
import io.ecsexporter.core.model.ScrapeOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Scrapes a fixed set of ECS clusters.
 *
 * <p>Each call collects every cluster again and registers the derived samples
 * as gauges in a new {@link PrometheusMeterRegistry}. The
 * {@code aws_ecs_exporter_success} gauge is registered for every
 * (cluster, resource kind) pair, including the ones that failed.
 */
public class ClusterScraper implements Scraper {

    private static final Logger log = LoggerFactory.getLogger(ClusterScraper.class);

    private final ClusterCollector collector;
    private final List<String> clusterNames;

    public ClusterScraper(EcsApi api, List<String> clusterNames) {
        this(new ClusterCollector(api), clusterNames);
    }

    public ClusterScraper(ClusterCollector collector, List<String> clusterNames) {
        this.collector = Objects.requireNonNull(collector, "collector");
        if (clusterNames == null || clusterNames.isEmpty()) {
            throw new IllegalArgumentException("At least one cluster name is required");
        }
        for (String cluster : clusterNames) {
            if (cluster == null || cluster.isBlank()) {
                throw new IllegalArgumentException("Cluster names must not be blank: " + clusterNames);
            }
        }
        this.clusterNames = List.copyOf(clusterNames);
    }

    @Override
    public CompletableFuture<PrometheusMeterRegistry> scrape() {
        return collector.collect(clusterNames).thenApply(ClusterScraper::toRegistry);
    }

    /**
     * Registry holding only {@code aws_ecs_exporter_success} at 0 for every
     * configured (cluster, resource kind) pair.
     */
    @Override
    public PrometheusMeterRegistry failedScrape() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        for (MetricSample sample : MetricDeriver.deriveOutcome(ScrapeOutcome.allFailed(new LinkedHashSet<>(clusterNames)))) {
            register(registry, sample);
        }
        return registry;
    }

    public List<String> getClusterNames() {
        return clusterNames;
    }

    static PrometheusMeterRegistry toRegistry(CollectionResult result) {
        List<MetricSample> samples = new ArrayList<>();
        for (ClusterSnapshot snapshot : result.snapshots().values()) {
            samples.addAll(MetricDeriver.derive(snapshot));
        }
        samples.addAll(MetricDeriver.deriveOutcome(result.outcome()));

        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        for (MetricSample sample : samples) {
            register(registry, sample);
        }
        log.debug("Scrape produced {} samples for {} cluster(s)", samples.size(), result.snapshots().size());
        return registry;
    }

    static void register(MeterRegistry registry, MetricSample sample) {
        List<Tag> tags = new ArrayList<>(sample.labels().size());
        for (Map.Entry<String, String> label : sample.labels().entrySet()) {
            tags.add(Tag.of(label.getKey(), label.getValue()));
        }
        long value = sample.value();
        Gauge.builder(sample.family().metricName(), () -> value)
                .description(sample.family().help())
                .tags(tags)
                .register(registry);
    }
}
