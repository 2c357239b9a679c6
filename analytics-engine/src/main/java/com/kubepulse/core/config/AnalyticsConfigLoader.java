package com.kubepulse.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Loads and validates {@link AnalyticsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Overrides</h3>
 * <p>
 * After parsing, {@value #ENV_DETECTOR_ENABLED} and
 * {@value #ENV_ANOMALY_THRESHOLD} override the corresponding detector
 * settings when set.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link AnalyticsConfig#validate()} after
 * parsing and overriding, so a bad file fails at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyticsConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYTICS_CONFIG_PATH";

    /** Environment variable overriding {@code detector.enabled}. */
    public static final String ENV_DETECTOR_ENABLED = "ANALYTICS_DETECTOR_ENABLED";

    /** Environment variable overriding {@code detector.threshold}. */
    public static final String ENV_ANOMALY_THRESHOLD = "ANALYTICS_ANOMALY_THRESHOLD";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "analytics.yml";

    private AnalyticsConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * <ol>
     * <li>If {@code ANALYTICS_CONFIG_PATH} is set and the file exists, load
     * from there.</li>
     * <li>Otherwise, fall back to {@code analytics.yml} on the classpath.</li>
     * </ol>
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static AnalyticsConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analytics configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading analytics configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalyticsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Configuration file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, System::getenv);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalyticsConfig fromClasspath(String resource) {
        return fromClasspath(resource, System::getenv);
    }

    /**
     * Load configuration from a classpath resource, resolving overrides
     * through {@code environment} instead of the process environment.
     */
    static AnalyticsConfig fromClasspath(String resource, UnaryOperator<String> environment) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalyticsConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, environment);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalyticsConfig parseAndValidate(InputStream is, UnaryOperator<String> environment) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalyticsConfig.class, options));

        AnalyticsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analytics configuration: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Analytics configuration is empty: using defaults");
            config = new AnalyticsConfig();
        }

        applyOverrides(config.getDetector(), environment);
        config.validate();

        LOG.info("Loaded analytics configuration: detector={} slos={}",
                config.getDetector().getEngine(), config.getSlos().size());
        return config;
    }

    static void applyOverrides(DetectorSettings detector, UnaryOperator<String> environment) {
        String enabled = environment.apply(ENV_DETECTOR_ENABLED);
        if (enabled != null && !enabled.isBlank()) {
            detector.setEnabled(parseBoolean(ENV_DETECTOR_ENABLED, enabled));
            LOG.info("Detector enabled overridden by {}: {}", ENV_DETECTOR_ENABLED, detector.isEnabled());
        }

        String threshold = environment.apply(ENV_ANOMALY_THRESHOLD);
        if (threshold != null && !threshold.isBlank()) {
            try {
                detector.setThreshold(Double.parseDouble(threshold.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                        "Failed to parse " + ENV_ANOMALY_THRESHOLD + ": '" + threshold + "'", e);
            }
            LOG.info("Detector threshold overridden by {}: {}", ENV_ANOMALY_THRESHOLD, detector.getThreshold());
        }
    }

    private static boolean parseBoolean(String name, String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalStateException(
                    "Failed to parse " + name + ": '" + value + "' is not a boolean");
        };
    }
}
