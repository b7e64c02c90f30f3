package io.ecsexporter.server.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads exporter configuration from HOCON files.
 *
 * Configuration is loaded in the following order (later sources override earlier):
 * 1. application.conf from classpath (defaults, with environment overrides)
 * 2. File specified by -c/--config CLI argument (optional override)
 * 3. --conf key=value fragments from the command line
 * 4. System properties (highest priority)
 *
 * Example HOCON configuration:
 * <pre>
 * ecs_exporter {
 *     clusters = ["production", "staging"]
 *     region = "eu-west-1"
 *     role = "arn:aws:iam::123456789012:role/ecs-exporter"
 *
 *     http {
 *         host = "0.0.0.0"
 *         port = 6543
 *         scrape-timeout-ms = 30000
 *     }
 * }
 * </pre>
 */
public class ExporterConfig {

    private static final Logger log = LoggerFactory.getLogger(ExporterConfig.class);
    public static final String CONFIG_PREFIX = "ecs_exporter";

    private static final Pattern ROLE_PATTERN = Pattern.compile("(?i)arn:aws:iam::\\d{12}:role/.*");

    private final Config config;

    /**
     * Load configuration from default locations.
     */
    public ExporterConfig() {
        this(ConfigFactory.load().resolve());
    }

    /**
     * Load configuration with an optional external config file and command line overrides.
     *
     * @param externalConfigPath path to external config file (can be null)
     * @param overrides          config parsed from --conf arguments
     */
    public ExporterConfig(String externalConfigPath, Config overrides) {
        Config resultConfig = ConfigFactory.load();

        if (externalConfigPath != null && !externalConfigPath.isEmpty()) {
            File externalFile = new File(externalConfigPath);
            if (!externalFile.exists()) {
                throw new IllegalArgumentException("Configuration file not found: " + externalConfigPath);
            }
            log.info("Loading external configuration from: {}", externalConfigPath);
            resultConfig = ConfigFactory.parseFile(externalFile).withFallback(resultConfig);
        }

        resultConfig = overrides.withFallback(resultConfig);
        this.config = ConfigFactory.systemProperties().withFallback(resultConfig).resolve();
        log.debug("Configuration loaded successfully");
    }

    /**
     * Create ExporterConfig from an existing Config object.
     * Useful for testing.
     */
    public ExporterConfig(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Cluster names. Accepts a HOCON list or a comma-separated string
     * (as set through ECS_EXPORTER_CLUSTERS).
     */
    public List<String> getClusters() {
        List<String> clusters = new ArrayList<>();
        for (String cluster : rawClusters()) {
            String trimmed = cluster.trim();
            if (!trimmed.isEmpty() && !clusters.contains(trimmed)) {
                clusters.add(trimmed);
            }
        }
        return clusters;
    }

    private List<String> rawClusters() {
        String path = CONFIG_PREFIX + ".clusters";
        if (!config.hasPath(path)) {
            return List.of();
        }
        if (config.getValue(path).valueType() == ConfigValueType.STRING) {
            // split with a negative limit keeps trailing empty entries
            return Arrays.asList(config.getString(path).split(",", -1));
        }
        return config.getStringList(path);
    }

    public String getRegion() {
        return getString("region", null);
    }

    public String getRole() {
        return getString("role", null);
    }

    public String getExternalId() {
        return getString("external-id", null);
    }

    public String getRoleSessionName() {
        return getString("role-session-name", null);
    }

    public String getHttpHost() {
        return getString("http.host", "localhost");
    }

    public int getHttpPort() {
        return getInt("http.port", 6543);
    }

    public int getScrapeTimeoutMs() {
        return getInt("http.scrape-timeout-ms", 30000);
    }

    /**
     * Check the configuration is usable.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        List<String> raw = rawClusters();
        if (raw.isEmpty() || (raw.size() == 1 && raw.get(0).isBlank())) {
            throw new IllegalArgumentException("At least one cluster is required: set "
                    + CONFIG_PREFIX + ".clusters or ECS_EXPORTER_CLUSTERS");
        }
        for (String cluster : raw) {
            if (cluster.isBlank()) {
                throw new IllegalArgumentException("Cluster names must not be blank: " + raw);
            }
        }
        String role = getRole();
        if (role != null && !ROLE_PATTERN.matcher(role).matches()) {
            throw new IllegalArgumentException("Invalid role '" + role
                    + "': must be of the form `arn:aws:iam::123456789012:role/something`");
        }
        int port = getHttpPort();
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid http.port: " + port);
        }
        if (getScrapeTimeoutMs() <= 0) {
            throw new IllegalArgumentException("http.scrape-timeout-ms must be positive");
        }
    }

    private String getString(String path, String defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (config.hasPath(fullPath)) {
            String value = config.getString(fullPath);
            return value.isBlank() ? defaultValue : value;
        }
        return defaultValue;
    }

    private int getInt(String path, int defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (config.hasPath(fullPath)) {
            return config.getInt(fullPath);
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "ExporterConfig{" +
                "clusters=" + getClusters() +
                ", region='" + getRegion() + '\'' +
                ", role='" + getRole() + '\'' +
                ", httpHost='" + getHttpHost() + '\'' +
                ", httpPort=" + getHttpPort() +
                ", scrapeTimeoutMs=" + getScrapeTimeoutMs() +
                '}';
    }
}
