package io.ecsexporter.core.scrape;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

import java.util.concurrent.CompletableFuture;

/**
 * Produces the metrics of one scrape.
 *
 * Every call must return a registry built from scratch, holding meters that
 * belong to that call only.
 */
public interface Scraper {

    CompletableFuture<PrometheusMeterRegistry> scrape();

    /**
     * Metrics to expose when {@link #scrape()} fails or does not complete in time.
     * Empty unless the implementation has a health signal to report.
     */
    default PrometheusMeterRegistry failedScrape() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }
}
