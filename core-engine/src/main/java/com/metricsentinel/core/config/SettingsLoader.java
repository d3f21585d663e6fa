package com.metricsentinel.core.config;

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
 * Loads and validates {@link PipelineSettings} from YAML.
 *
 * <p>
 * Resolution mirrors {@link RulesLoader}: the {@value #ENV_SETTINGS_PATH}
 * environment variable first, then {@code pipeline.yml} on the classpath, and
 * built-in defaults when neither exists.
 * </p>
 *
 * @since 1.0.0
 */
public final class SettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String ENV_SETTINGS_PATH = "PIPELINE_CONFIG_PATH";
    static final String DEFAULT_RESOURCE = "pipeline.yml";

    private SettingsLoader() {
        // not instantiable
    }

    /**
     * @return settings from the environment path, the classpath, or defaults
     * @throws IllegalStateException if a document exists but is invalid
     */
    public static PipelineSettings load() {
        String envPath = System.getenv(ENV_SETTINGS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading pipeline settings from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (SettingsLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading pipeline settings from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No pipeline settings found - using defaults");
        return PipelineSettings.defaults();
    }

    public static PipelineSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    public static PipelineSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static PipelineSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(PipelineSettings.class, options));

        PipelineSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse pipeline settings: " + e.getMessage(), e);
        }
        if (settings == null) {
            settings = PipelineSettings.defaults();
        }
        settings.validate();
        return settings;
    }
}
