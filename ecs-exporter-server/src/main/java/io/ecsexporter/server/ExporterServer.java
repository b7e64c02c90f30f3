package io.ecsexporter.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.ecsexporter.core.collect.Futures;
import io.ecsexporter.core.scrape.Scraper;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP endpoint of the exporter.
 *
 * <ul>
 *   <li>{@code /} home page</li>
 *   <li>{@code /status} fixed liveness page</li>
 *   <li>{@code /metrics} process-wide metrics followed by a fresh scrape of the clusters</li>
 * </ul>
 *
 * {@code /metrics} always answers 200. When the scrape fails or does not finish
 * within the scrape timeout the process-wide metrics are returned with the
 * scraper's failure metrics ({@code aws_ecs_exporter_success} at 0), and the
 * failure shows up in {@code http_requests_total{status="error"}}.
 */
public class ExporterServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExporterServer.class);

    static final String METRICS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    static final String HTML_CONTENT_TYPE = "text/html; charset=utf-8";

    static final String STATUS_PAGE =
            "<html><head><title>AWS ECS Exporter</title></head><body>Ok</body></html>";

    static final String HOME_PAGE = """
            <html>
            <head><title>AWS ECS Exporter</title></head>
            <body>
                AWS ECS Exporter
                <ul>
                    <li><a href="/status">Exporter status</a></li>
                    <li><a href="/metrics">Metrics</a></li>
                </ul>
            </body>
            </html>
            """;

    private final HttpServer server;
    private final ExecutorService executor;
    private final Scraper scraper;
    private final ExporterMetrics exporterMetrics;
    private final Duration scrapeTimeout;

    public ExporterServer(String host, int port, Scraper scraper, ExporterMetrics exporterMetrics,
                          Duration scrapeTimeout) throws IOException {
        this.scraper = Objects.requireNonNull(scraper, "scraper");
        this.exporterMetrics = Objects.requireNonNull(exporterMetrics, "exporterMetrics");
        this.scrapeTimeout = Objects.requireNonNull(scrapeTimeout, "scrapeTimeout");

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "exporter-http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext("/", new HomeHandler());
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("Exporter listening on http://{}:{}", server.getAddress().getHostString(), getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        log.info("Exporter HTTP server stopped");
    }

    /**
     * Run one scrape and render the response body.
     */
    String renderMetrics() {
        PrometheusMeterRegistry scrapeRegistry;
        try {
            scrapeRegistry = Futures.invoke(scraper::scrape).get(scrapeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Scrape did not complete within {}ms", scrapeTimeout.toMillis());
            return renderFailure();
        } catch (ExecutionException e) {
            log.warn("Scrape failed: {}", Futures.unwrap(e).toString());
            return renderFailure();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scrape interrupted");
            return renderFailure();
        }

        exporterMetrics.recordSuccess();
        try {
            return exporterMetrics.scrape() + scrapeRegistry.scrape();
        } finally {
            scrapeRegistry.close();
        }
    }

    private String renderFailure() {
        exporterMetrics.recordError();
        PrometheusMeterRegistry failed = scraper.failedScrape();
        try {
            return exporterMetrics.scrape() + failed.scrape();
        } finally {
            failed.close();
        }
    }

    /**
     * Contexts match by prefix; only the context path itself and its sub-paths are served.
     */
    static boolean matchesContext(HttpExchange exchange, String context) {
        String path = exchange.getRequestURI().getPath();
        return path.equals(context) || path.startsWith(context + "/");
    }

    private static void notFound(HttpExchange exchange) throws IOException {
        respond(exchange, 404, HTML_CONTENT_TYPE, "Not Found");
    }

    private static boolean isGet(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        if ("GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method)) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", "GET, HEAD");
        respond(exchange, 405, HTML_CONTENT_TYPE, "Method Not Allowed");
        return false;
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static class HomeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                notFound(exchange);
                return;
            }
            if (isGet(exchange)) {
                respond(exchange, 200, HTML_CONTENT_TYPE, HOME_PAGE);
            }
        }
    }

    private static class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!matchesContext(exchange, "/status")) {
                notFound(exchange);
                return;
            }
            if (isGet(exchange)) {
                respond(exchange, 200, HTML_CONTENT_TYPE, STATUS_PAGE);
            }
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!matchesContext(exchange, "/metrics")) {
                notFound(exchange);
                return;
            }
            if (!isGet(exchange)) {
                return;
            }
            // HEAD carries no body, so no scrape and no request count
            if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
                respond(exchange, 200, METRICS_CONTENT_TYPE, "");
                return;
            }
            respond(exchange, 200, METRICS_CONTENT_TYPE, renderMetrics());
        }
    }
}
