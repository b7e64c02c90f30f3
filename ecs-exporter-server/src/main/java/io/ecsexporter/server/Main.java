package io.ecsexporter.server;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.ecsexporter.aws.AwsEcsApi;
import io.ecsexporter.aws.EcsClientFactory;
import io.ecsexporter.core.scrape.ClusterScraper;
import io.ecsexporter.server.config.ExporterConfig;
import io.ecsexporter.server.config.LogbackConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.ecs.EcsAsyncClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the AWS ECS exporter.
 *
 * Usage:
 * <pre>
 * java -jar ecs-exporter-server.jar --conf 'ecs_exporter.clusters=["production"]'
 * java -jar ecs-exporter-server.jar -c /path/to/exporter.conf
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String VERSION = "0.1.0";

    /**
     * CLI arguments.
     */
    public static class Args {
        @Parameter(names = {"-c", "--config"}, description = "Path to HOCON configuration file")
        public String configPath;

        @Parameter(names = {"--conf"}, description = "Configuration override, e.g. ecs_exporter.http.port=9000")
        public List<String> configs;

        @Parameter(names = {"-h", "--help"}, help = true, description = "Show this help message")
        public boolean help;

        @Parameter(names = {"-v", "--version"}, description = "Show version information")
        public boolean version;

        Config overrides() {
            StringBuilder buffer = new StringBuilder();
            if (configs != null) {
                configs.forEach(c -> buffer.append(c).append('\n'));
            }
            return ConfigFactory.parseString(buffer.toString());
        }
    }

    public static void main(String[] args) {
        Args cliArgs = new Args();
        JCommander jcommander = JCommander.newBuilder()
                .addObject(cliArgs)
                .programName("ecs-exporter")
                .build();

        try {
            jcommander.parse(args);
        } catch (ParameterException e) {
            System.err.println("Error parsing arguments: " + e.getMessage());
            jcommander.usage();
            System.exit(1);
            return;
        }

        if (cliArgs.help) {
            jcommander.usage();
            return;
        }

        if (cliArgs.version) {
            System.out.println("AWS ECS Exporter v" + VERSION);
            return;
        }

        ExporterConfig config;
        try {
            config = new ExporterConfig(cliArgs.configPath, cliArgs.overrides());
            LogbackConfigurator.configure(config.getConfig());
            config.validate();
        } catch (RuntimeException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        try {
            run(config);
        } catch (IOException e) {
            log.error("Failed to start the exporter", e);
            System.exit(1);
        }
    }

    /**
     * Start the exporter and block until the JVM shuts down.
     */
    static void run(ExporterConfig config) throws IOException {
        log.info("Starting AWS ECS Exporter v{}", VERSION);
        log.info("Configuration: {}", config);

        EcsAsyncClient client = new EcsClientFactory(
                config.getRegion(), config.getRole(), config.getExternalId(), config.getRoleSessionName())
                .create();
        ClusterScraper scraper = new ClusterScraper(new AwsEcsApi(client), config.getClusters());
        ExporterMetrics exporterMetrics = new ExporterMetrics();
        ExporterServer server = new ExporterServer(config.getHttpHost(), config.getHttpPort(), scraper,
                exporterMetrics, Duration.ofMillis(config.getScrapeTimeoutMs()));

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down AWS ECS Exporter...");
            server.close();
            exporterMetrics.close();
            client.close();
            shutdownLatch.countDown();
        }, "exporter-shutdown-hook"));

        server.start();
        log.info("  Clusters: {}", scraper.getClusterNames());

        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Exporter interrupted");
        }
    }
}
