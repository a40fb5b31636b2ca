package com.alertsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.Construct;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Loads and validates {@link AlertsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_ALERTS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * All {@code load*} methods call {@link AlertsConfig#validate()} after parsing
 * so that the application <strong>fails fast</strong> on an invalid alert
 * rather than silently never firing it.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_ALERTS_PATH = "ALERTS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "alerts.yml";

    private AlertsLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load alerts using automatic resolution.
     *
     * @return parsed and validated alerts configuration
     * @throws IllegalStateException if validation fails
     */
    public static AlertsConfig load() {
        return load(System.getenv(ENV_ALERTS_PATH));
    }

    /**
     * Load alerts from {@code path} if it names an existing file, otherwise
     * from {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @param path file system path, may be {@code null} or blank
     * @return parsed and validated alerts configuration
     * @throws IllegalStateException if validation fails
     */
    public static AlertsConfig load(String path) {
        if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
            LOG.info("Loading alerts from path: {}", path);
            return fromFile(path);
        }
        LOG.info("Loading alerts from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load alerts from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed and validated alerts configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AlertsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Alerts file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alerts file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerts file: " + path, e);
        }
    }

    /**
     * Load alerts from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated alerts configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static AlertsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertsLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static AlertsConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new AlertsConstructor(options));

        AlertsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed alerts configuration: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Alerts configuration is empty");
            config = new AlertsConfig();
        }
        if (config.getAlerts().isEmpty()) {
            LOG.warn("No alerts defined in configuration");
        }
        config.validate();

        LOG.info("Loaded {} alert(s)", config.getAlerts().size());
        return config;
    }

    /**
     * Reads ISO-8601 scalars into {@link Instant} bean properties.
     */
    private static final class AlertsConstructor extends Constructor {

        private final Construct instantConstruct = new AbstractConstruct() {
            @Override
            public Object construct(Node node) {
                String value = ((ScalarNode) node).getValue();
                try {
                    return Instant.parse(value);
                } catch (DateTimeParseException e) {
                    throw new YAMLException("Invalid instant '" + value + "'", e);
                }
            }
        };

        AlertsConstructor(LoaderOptions options) {
            super(AlertsConfig.class, options);
        }

        @Override
        protected Construct getConstructor(Node node) {
            if (node instanceof ScalarNode && Instant.class.equals(node.getType())) {
                return instantConstruct;
            }
            return super.getConstructor(node);
        }
    }
}
