package io.ecsexporter.server;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.FileDescriptorMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

/**
 * Process-wide metrics of the exporter itself.
 *
 * Created once at startup, rendered in front of every scrape and never reset:
 * JVM and process meters plus the {@code http_requests_total} counter by scrape outcome.
 */
public class ExporterMetrics implements AutoCloseable {

    static final String HTTP_REQUESTS = "http_requests";

    private final PrometheusMeterRegistry registry;
    private final Counter successRequests;
    private final Counter errorRequests;
    private final JvmGcMetrics gcMetrics;

    public ExporterMetrics() {
        this(true);
    }

    /**
     * @param bindJvmMetrics whether to register JVM and process meters
     */
    public ExporterMetrics(boolean bindJvmMetrics) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.successRequests = requests("success");
        this.errorRequests = requests("error");

        if (bindJvmMetrics) {
            new ClassLoaderMetrics().bindTo(registry);
            new JvmMemoryMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
            new UptimeMetrics().bindTo(registry);
            new FileDescriptorMetrics().bindTo(registry);
            this.gcMetrics = new JvmGcMetrics();
            gcMetrics.bindTo(registry);
        } else {
            this.gcMetrics = null;
        }
    }

    private Counter requests(String status) {
        return Counter.builder(HTTP_REQUESTS)
                .description("Number of HTTP requests received by the exporter")
                .tag("status", status)
                .register(registry);
    }

    public void recordSuccess() {
        successRequests.increment();
    }

    public void recordError() {
        errorRequests.increment();
    }

    public double getSuccessCount() {
        return successRequests.count();
    }

    public double getErrorCount() {
        return errorRequests.count();
    }

    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Render the process-wide meters in Prometheus text format.
     */
    public String scrape() {
        return registry.scrape();
    }

    @Override
    public void close() {
        if (gcMetrics != null) {
            gcMetrics.close();
        }
        registry.close();
    }
}
