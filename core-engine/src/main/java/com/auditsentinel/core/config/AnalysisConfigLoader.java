package com.auditsentinel.core.config;

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
import java.util.Objects;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE} via
 * {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing so that the service
 * fails fast on bad settings. An empty document yields the defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYSIS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private AnalysisConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static AnalysisConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * Load settings from {@code path} when it names an existing file,
     * otherwise from the classpath default.
     *
     * @param path optional file system path; may be {@code null} or blank
     * @return parsed and validated configuration
     */
    public static AnalysisConfig load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading analysis settings from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading analysis settings from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Analysis config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read analysis config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisConfig.class, options));

        AnalysisConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Analysis configuration is empty; using defaults");
            config = AnalysisConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded analysis settings: {}", config);
        return config;
    }
}
