package fr.lapetina.admission.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Empty documents, which yield the defaults
 * - Validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "admission.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader() {
        this(DEFAULT_CONFIG_PATH);
    }

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(AdmissionConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, validated configuration
     * @throws ConfigurationException if loading fails or a value is invalid
     */
    public AdmissionConfig load() {
        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads configuration from an input stream.
     */
    public AdmissionConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private AdmissionConfig parse(InputStream inputStream, String source) {
        AdmissionConfig config;
        try {
            config = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
        if (config == null) {
            log.info("Configuration {} is empty, using defaults", source);
            config = createDefault();
        }
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
        log.debug("Configuration loaded from {}: rank={}/{}, rankAware={}, strategy={}",
                source,
                config.getCluster().getRank(),
                config.getCluster().getNumRanks(),
                config.getScheduler().isRankAwareBalancing(),
                config.getScheduler().getPlacementStrategy());
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static AdmissionConfig createDefault() {
        return new AdmissionConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
