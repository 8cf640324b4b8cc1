package com.driftguard.core.config;

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
 * Loads and validates {@link DriftGuardConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates the parsed configuration, so a
 * misconfigured deployment fails before it processes a single record.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "DRIFTGUARD_CONFIG_PATH";
    public static final String DEFAULT_RESOURCE = "driftguard.yml";

    private ConfigLoader() {
    }

    /**
     * Load the configuration from {@value #ENV_CONFIG_PATH} when it points at
     * an existing file, otherwise from {@value #DEFAULT_RESOURCE} on the
     * classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DriftGuardConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DriftGuardConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DriftGuardConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DriftGuardConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DriftGuardConfig.class, options));

        DriftGuardConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Configuration {} is empty, using defaults", source);
            config = new DriftGuardConfig();
        }
        config.validate();

        LOG.info("Loaded configuration from {}: {}", source, config);
        return config;
    }
}
