package com.flowsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a {@link DetectorConfig} from YAML and environment variables.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path), if
 * the file exists</li>
 * <li>Otherwise the classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Individual {@code FLOW_SENTINEL_*} variables then override the
 * values read from YAML</li>
 * </ol>
 *
 * <h3>YAML Layout</h3>
 *
 * <pre>
 * suricata:
 *   eve_json_path: /var/log/suricata/eve.json
 * model_path: models/isolation_forest.json
 * feature_columns_path: models/feature_columns.json
 * anomalies_path: /data/anomalies.json
 * detection:
 *   poll_interval_ms: 1000
 *   flush_interval_seconds: 5
 *   store_capacity: 1000
 *   wake_up: poll
 * status:
 *   port: 3001
 * </pre>
 *
 * <p>
 * Validation happens in {@link DetectorConfig.Builder#build()}, so every
 * {@code load*} method fails fast on an invalid configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable pointing at an external YAML file. */
    public static final String ENV_CONFIG_PATH = "FLOW_SENTINEL_CONFIG";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "flow-sentinel.yml";

    public static final String ENV_EVE_PATH = "FLOW_SENTINEL_EVE_PATH";
    public static final String ENV_MODEL_PATH = "FLOW_SENTINEL_MODEL_PATH";
    public static final String ENV_FEATURE_COLUMNS_PATH = "FLOW_SENTINEL_FEATURE_COLUMNS_PATH";
    public static final String ENV_ANOMALIES_PATH = "FLOW_SENTINEL_ANOMALIES_PATH";
    public static final String ENV_POLL_INTERVAL_MS = "FLOW_SENTINEL_POLL_INTERVAL_MS";
    public static final String ENV_FLUSH_INTERVAL_SECONDS = "FLOW_SENTINEL_FLUSH_INTERVAL_SECONDS";
    public static final String ENV_STORE_CAPACITY = "FLOW_SENTINEL_STORE_CAPACITY";
    public static final String ENV_WAKE_UP = "FLOW_SENTINEL_WAKE_UP";
    public static final String ENV_STATUS_PORT = "FLOW_SENTINEL_STATUS_PORT";

    private ConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using the process environment.
     *
     * @return validated configuration
     * @throws IllegalStateException    if a value has the wrong type
     * @throws IllegalArgumentException if a value is out of range
     */
    public static DetectorConfig load() {
        return load(System.getenv());
    }

    /**
     * Load the configuration against an explicit environment.
     *
     * @param env environment variables; must not be {@code null}
     * @return validated configuration
     * @throws IllegalStateException    if a value has the wrong type
     * @throws IllegalArgumentException if a value is out of range
     */
    public static DetectorConfig load(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        String configPath = env.get(ENV_CONFIG_PATH);
        DetectorYaml yaml;
        if (configPath != null && !configPath.isBlank() && Files.exists(Path.of(configPath))) {
            LOG.info("Loading configuration from environment path: {}", configPath);
            yaml = readFile(Path.of(configPath));
        } else {
            LOG.info("Loading configuration from classpath: {}", DEFAULT_RESOURCE);
            yaml = readClasspath(DEFAULT_RESOURCE);
        }
        return build(yaml, env);
    }

    /**
     * Load the configuration from a file, without environment overrides.
     *
     * @param path YAML file; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the file does not exist or a value
     *                                  is out of range
     * @throws IllegalStateException    if reading fails or a value has the
     *                                  wrong type
     */
    public static DetectorConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        return build(readFile(path), Map.of());
    }

    /**
     * Load the configuration from a classpath resource, without environment
     * overrides.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if the resource does not exist or a
     *                                  value is out of range
     * @throws IllegalStateException    if reading fails or a value has the
     *                                  wrong type
     */
    public static DetectorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return build(readClasspath(resource), Map.of());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DetectorYaml readFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    private static DetectorYaml readClasspath(String resource) {
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static DetectorYaml parse(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(DetectorYaml.constructor(options));
        DetectorYaml document;
        try {
            document = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            LOG.warn("Configuration {} is empty, using defaults", source);
            document = new DetectorYaml();
        }
        return document;
    }

    static DetectorConfig build(DetectorYaml yaml, Map<String, String> env) {
        DetectorConfig.Builder builder = yaml.applyTo(DetectorConfig.builder());
        applyEnvironment(builder, env);
        DetectorConfig config = builder.build();
        LOG.info("Resolved {}", config);
        return config;
    }

    private static void applyEnvironment(DetectorConfig.Builder builder, Map<String, String> env) {
        String value;
        if ((value = env.get(ENV_EVE_PATH)) != null) {
            builder.evePath(value);
        }
        if ((value = env.get(ENV_MODEL_PATH)) != null) {
            builder.modelPath(value);
        }
        if ((value = env.get(ENV_FEATURE_COLUMNS_PATH)) != null) {
            builder.featureColumnsPath(value);
        }
        if ((value = env.get(ENV_ANOMALIES_PATH)) != null) {
            builder.anomaliesPath(value);
        }
        if ((value = env.get(ENV_WAKE_UP)) != null) {
            builder.wakeUpMode(WakeUpMode.fromName(value));
        }
        try {
            if ((value = env.get(ENV_POLL_INTERVAL_MS)) != null) {
                builder.pollIntervalMs(Long.parseLong(value.trim()));
            }
            if ((value = env.get(ENV_FLUSH_INTERVAL_SECONDS)) != null) {
                builder.flushIntervalSeconds(Long.parseLong(value.trim()));
            }
            if ((value = env.get(ENV_STORE_CAPACITY)) != null) {
                builder.storeCapacity(Integer.parseInt(value.trim()));
            }
            if ((value = env.get(ENV_STATUS_PORT)) != null) {
                builder.statusPort(Integer.parseInt(value.trim()));
            }
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }
}
