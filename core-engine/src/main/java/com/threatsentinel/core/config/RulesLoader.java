package com.threatsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link RulesConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE} via
 * {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods validate after parsing, so a misconfigured
 * pipeline fails at startup instead of misbehaving on live traffic.
 * </p>
 *
 * @since 1.0.0
 */
public final class RulesLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RulesLoader.class);

    /** Environment variable that can override the default rules location. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Rules bundled with the core engine. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RulesLoader() {
        // utility class
    }

    /**
     * Load rules using automatic resolution: {@code RULES_CONFIG_PATH} when it
     * points at an existing file, the bundled {@code rules.yml} otherwise.
     *
     * @return parsed and validated rules configuration
     * @throws IllegalStateException if rule validation fails
     */
    public static RulesConfig load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading rules from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load rules from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parseAndValidate(is, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * Load rules from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated rules configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static RulesConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RulesLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static RulesConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(RulesConfig.class, options));

        RulesConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules YAML in " + source + ": " + e.getMessage(), e);
        }

        if (config == null || config.getRules().isEmpty()) {
            LOG.warn("No detection rules defined in {}", source);
            config = new RulesConfig();
        } else {
            config.validate();
        }

        LOG.info("Loaded {} detection rule(s) from {}", config.getRules().size(), source);
        return config;
    }
}
