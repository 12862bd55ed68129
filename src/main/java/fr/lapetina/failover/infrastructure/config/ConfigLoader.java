package fr.lapetina.failover.infrastructure.config;

import fr.lapetina.failover.domain.pool.SelectionPolicyFactory;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Configuration loader.
 *
 * Reads the YAML file once (file system first, then classpath) and overlays
 * the environment variables below. The result is never reloaded.
 * <ul>
 *   <li>{@code FAILOVER_ORIGINS} - ordered, comma-separated origin list</li>
 *   <li>{@code FAILOVER_TIMEOUT_MS} - per-attempt timeout; 500 if non-numeric</li>
 *   <li>{@code FAILOVER_RANDOM} - true/1/yes for random selection, sequential otherwise</li>
 *   <li>{@code FAILOVER_PORT} - inbound server port</li>
 * </ul>
 *
 * The YAML file is bound strictly: a non-numeric {@code attempt.timeoutMs} there
 * fails startup with {@link ConfigurationException}. Only the environment value
 * falls back to the 500 ms default. A non-positive timeout from either source
 * is replaced by the default with a warning.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_ORIGINS = "FAILOVER_ORIGINS";
    public static final String ENV_TIMEOUT_MS = "FAILOVER_TIMEOUT_MS";
    public static final String ENV_RANDOM = "FAILOVER_RANDOM";
    public static final String ENV_PORT = "FAILOVER_PORT";

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RouterConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads the YAML configuration and applies the environment overlay.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public RouterConfig load() {
        RouterConfig config = loadFromPath();
        applyEnvironment(config, environment);
        normalize(config);
        return config;
    }

    private RouterConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return orDefault(yaml.load(is));
            }
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RouterConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return orDefault(yaml.load(is));
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream, then applies the environment overlay.
     */
    public RouterConfig loadFromStream(InputStream inputStream) {
        RouterConfig config = orDefault(yaml.load(inputStream));
        applyEnvironment(config, environment);
        normalize(config);
        return config;
    }

    private static RouterConfig orDefault(RouterConfig config) {
        // An empty document, or an empty section, yields null
        if (config == null) {
            return new RouterConfig();
        }
        RouterConfig defaults = new RouterConfig();
        if (config.getServer() == null) {
            config.setServer(defaults.getServer());
        }
        if (config.getAttempt() == null) {
            config.setAttempt(defaults.getAttempt());
        }
        if (config.getSelection() == null) {
            config.setSelection(defaults.getSelection());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(defaults.getMetrics());
        }
        return config;
    }

    /**
     * Overlays environment variables on top of the file configuration.
     */
    static void applyEnvironment(RouterConfig config, Map<String, String> env) {
        String origins = env.get(ENV_ORIGINS);
        if (origins != null) {
            List<String> parsed = new ArrayList<>();
            for (String part : origins.split(",")) {
                if (!part.isBlank()) {
                    parsed.add(part.trim());
                }
            }
            config.setOrigins(parsed);
        }

        String timeout = env.get(ENV_TIMEOUT_MS);
        if (timeout != null) {
            config.getAttempt().setTimeoutMs(parseTimeoutMs(timeout));
        }

        String random = env.get(ENV_RANDOM);
        if (random != null) {
            boolean enabled = TRUE_VALUES.contains(random.trim().toLowerCase(Locale.ROOT));
            config.getSelection().setType(SelectionPolicyFactory.nameFor(enabled));
        }

        String port = env.get(ENV_PORT);
        if (port != null) {
            try {
                config.getServer().setPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid " + ENV_PORT + ": " + port, e);
            }
        }
    }

    /**
     * Parses a millisecond timeout, falling back to the default for non-numeric input.
     */
    static long parseTimeoutMs(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Non-numeric attempt timeout '{}', using default {} ms",
                    value, RouterConfig.AttemptConfig.DEFAULT_TIMEOUT_MS);
            return RouterConfig.AttemptConfig.DEFAULT_TIMEOUT_MS;
        }
    }

    private static void normalize(RouterConfig config) {
        if (config.getOrigins() == null) {
            config.setOrigins(new ArrayList<>());
        }
        if (config.getAttempt().getTimeoutMs() <= 0) {
            log.warn("Non-positive attempt timeout {} ms, using default {} ms",
                    config.getAttempt().getTimeoutMs(), RouterConfig.AttemptConfig.DEFAULT_TIMEOUT_MS);
            config.getAttempt().setTimeoutMs(RouterConfig.AttemptConfig.DEFAULT_TIMEOUT_MS);
        }
        if (config.getOrigins().isEmpty()) {
            log.warn("No origins configured, every request will be answered with 503");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static RouterConfig createDefault() {
        return new RouterConfig();
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
