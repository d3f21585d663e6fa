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
 * Loads and validates alert rules from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * A document that cannot be read or parsed <strong>fails fast</strong> with
 * an exception. Individual malformed rules are rejected, logged and returned
 * in {@link RuleSet#getRejections()} so the remaining rules keep working.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    private RulesLoader() {
        // not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load rules using automatic resolution.
     *
     * <ol>
     * <li>If {@code RULES_CONFIG_PATH} is set and the file exists, load from
     * there.</li>
     * <li>Otherwise, fall back to {@code rules.yml} on the classpath.</li>
     * </ol>
     *
     * @return accepted rules and rejections
     * @throws IllegalStateException if the document cannot be parsed
     */
    public static RuleSet load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading rules from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading rules from classpath: rules.yml");
        return fromClasspath("rules.yml");
    }

    /**
     * Load rules from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return accepted rules and rejections
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static RuleSet fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return accepted rules and rejections
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or parsing fails
     */
    public static RuleSet fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static RuleSet parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));

        RulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse rules configuration: " + e.getMessage(), e);
        }

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No alert rules defined in configuration");
            config = config != null ? config : new RulesConfig();
        }

        RuleSet ruleSet = config.validate();
        LOG.info("Loaded {} alert rule(s), rejected {}, {} maintenance window(s)",
                ruleSet.getRules().size(), ruleSet.getRejections().size(),
                ruleSet.getMaintenanceWindows().size());
        return ruleSet;
    }
}
