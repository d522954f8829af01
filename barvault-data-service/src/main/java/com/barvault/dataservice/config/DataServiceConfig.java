package com.barvault.dataservice.config;

import com.barvault.core.model.Venue;
import com.barvault.dataservice.importer.ConflictPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for the BarVault data service.
 *
 * Each key resolves from the JVM system property {@code barvault.<key>}, then the
 * environment variable {@code BARVAULT_<KEY>}, then {@code {dataDir}/barvault.yaml},
 * then the built-in default. Example file:
 * <pre>
 * port: 9820
 * provider:
 *   baseUrl: http://localhost:8080
 *   requestsPerSecond: 50
 * fetch:
 *   maxRetries: 3
 * import:
 *   conflictPolicy: overwrite
 * </pre>
 */
public class DataServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(DataServiceConfig.class);

    public static final String CONFIG_FILE = "barvault.yaml";
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.barvault";
    private static final int DEFAULT_PORT = 9820;

    private final Path dataDir;
    private final int port;
    private final String providerBaseUrl;
    private final int requestsPerSecond;
    private final double safetyFraction;
    private final Duration connectTimeout;
    private final int maxRetries;
    private final Duration baseDelay;
    private final double backoffMultiplier;
    private final Duration attemptTimeout;
    private final Venue defaultVenue;
    private final ConflictPolicy conflictPolicy;

    private DataServiceConfig(Lookup lookup, Path dataDir) {
        this.dataDir = dataDir;
        this.port = Integer.parseInt(lookup.get("port", String.valueOf(DEFAULT_PORT)));
        this.providerBaseUrl = lookup.find("provider.baseUrl").filter(s -> !s.isBlank()).orElse(null);
        this.requestsPerSecond = Integer.parseInt(lookup.get("provider.requestsPerSecond", "50"));
        this.safetyFraction = Double.parseDouble(lookup.get("provider.safetyFraction", "0.9"));
        this.connectTimeout = Duration.ofSeconds(Long.parseLong(lookup.get("provider.connectTimeoutSeconds", "30")));
        this.maxRetries = Integer.parseInt(lookup.get("fetch.maxRetries", "3"));
        this.baseDelay = Duration.ofMillis(Long.parseLong(lookup.get("fetch.baseDelayMs", "2000")));
        this.backoffMultiplier = Double.parseDouble(lookup.get("fetch.backoffMultiplier", "2.0"));
        this.attemptTimeout = Duration.ofSeconds(Long.parseLong(lookup.get("fetch.attemptTimeoutSeconds", "120")));
        this.defaultVenue = Venue.of(lookup.get("venue.default", Venue.SIM.code()));
        this.conflictPolicy = ConflictPolicy.parse(lookup.get("import.conflictPolicy", "skip"));

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("provider.requestsPerSecond must be > 0, got " + requestsPerSecond);
        }
        if (safetyFraction <= 0 || safetyFraction > 1) {
            throw new IllegalArgumentException("provider.safetyFraction must be in (0, 1], got " + safetyFraction);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("fetch.maxRetries must be >= 0, got " + maxRetries);
        }
    }

    public static DataServiceConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    /**
     * Resolve against the given property and environment sources.
     *
     * @throws IllegalArgumentException if a value does not parse or is out of range
     */
    public static DataServiceConfig load(Properties properties, Map<String, String> env) {
        Lookup early = new Lookup(properties, env, null);
        Path dataDir = Paths.get(early.get("dataDir", DEFAULT_DATA_DIR));
        return new DataServiceConfig(new Lookup(properties, env, readYaml(dataDir.resolve(CONFIG_FILE))), dataDir);
    }

    private static JsonNode readYaml(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("No {} found, using defaults", file);
            return null;
        }
        try {
            JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(file.toFile());
            log.info("Loaded configuration from {}", file);
            return root;
        } catch (IOException e) {
            log.error("Failed to load configuration from {}: {}", file, e.getMessage());
            return null;
        }
    }

    /** "provider.baseUrl" becomes "BARVAULT_PROVIDER_BASE_URL". */
    static String envName(String key) {
        String snake = key.replace('.', '_').replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return "BARVAULT_" + snake.toUpperCase(Locale.ROOT);
    }

    private record Lookup(Properties properties, Map<String, String> env, JsonNode yaml) {

        Optional<String> find(String key) {
            String value = properties.getProperty("barvault." + key);
            if (value == null) {
                value = env.get(envName(key));
            }
            if (value == null && yaml != null) {
                JsonNode node = yaml;
                for (String part : key.split("\\.")) {
                    node = node.path(part);
                }
                if (node.isValueNode()) {
                    value = node.asText();
                }
            }
            return Optional.ofNullable(value).map(String::trim);
        }

        String get(String key, String defaultValue) {
            return find(key).orElse(defaultValue);
        }
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getFetchLogPath() {
        return dataDir.resolve("data").resolve("fetch-log.db");
    }

    public int getPort() {
        return port;
    }

    public Optional<String> getProviderBaseUrl() {
        return Optional.ofNullable(providerBaseUrl);
    }

    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public double getSafetyFraction() {
        return safetyFraction;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    public Venue getDefaultVenue() {
        return defaultVenue;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }
}
