package orion.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Loads engine configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots to underscores, upper case)
 * 3. External orion.properties (explicit file, -Dorion.config.dir or ORION_CONFIG_DIR, ./config)
 * 4. Classpath orion.properties
 *
 * @author Orion team
 * @since 14/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    public static final String DEFAULT_CONFIG_FILE = "orion.properties";
    private static final String CONFIG_DIR_PROPERTY = "orion.config.dir";
    private static final String CONFIG_DIR_ENV = "ORION_CONFIG_DIR";

    private final String configFile;
    private final Properties properties;

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    public ConfigurationLoader(String configFile) {
        this.configFile = configFile;
        this.properties = loadProperties(configFile);
    }

    private Properties loadProperties(String configFile) {
        Properties props = new Properties();

        // Classpath defaults first, external values override them
        Properties classpathProps = loadFromClasspath(configFile);
        props.putAll(classpathProps);

        Properties externalProps = loadFromExternalLocations(configFile);
        props.putAll(externalProps);

        if (!externalProps.isEmpty()) {
            logger.info("Loaded external configuration ({} keys, {} defaults from classpath)",
                    externalProps.size(), classpathProps.size());
        } else if (!classpathProps.isEmpty()) {
            logger.info("Loaded configuration from classpath '{}'", configFile);
        } else {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private Properties loadFromExternalLocations(String configFile) {
        Path explicit = Paths.get(configFile);
        if (explicit.isAbsolute()) {
            return loadFile(explicit);
        }

        String configDir = System.getProperty(CONFIG_DIR_PROPERTY);
        if (configDir == null) {
            configDir = System.getenv(CONFIG_DIR_ENV);
        }
        if (configDir != null) {
            Path configPath = Paths.get(configDir, configFile).normalize();
            if (!Files.isRegularFile(configPath)) {
                logger.warn("Config directory specified but file not found: {}", configPath.toAbsolutePath());
            }
            return loadFile(configPath);
        }

        return loadFile(Paths.get("config", configFile));
    }

    private Properties loadFile(Path path) {
        Properties props = new Properties();
        if (!Files.isRegularFile(path)) {
            logger.trace("External config not found at: {}", path.toAbsolutePath());
            return props;
        }
        try (InputStream input = Files.newInputStream(path)) {
            props.load(input);
            logger.debug("Read configuration file {}", path.toAbsolutePath());
        } catch (IOException e) {
            logger.warn("Failed to load config from '{}': {}", path, e.getMessage());
        }
        return props;
    }

    private Properties loadFromClasspath(String configFile) {
        Properties props = new Properties();
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (input != null) {
                props.load(input);
            }
        } catch (IOException e) {
            logger.debug("Error loading configuration from classpath '{}': {}", configFile, e.getMessage());
        }
        return props;
    }

    /**
     * Resolve a key: system property, then environment variable (backend.api.url -> BACKEND_API_URL),
     * then the loaded files, then the given default
     */
    public String getString(String key, String defaultValue) {
        String fromSystem = System.getProperty(key);
        if (fromSystem != null) {
            logger.debug("'{}' overridden by system property: {}", key, fromSystem);
            return fromSystem;
        }

        String envKey = key.replace('.', '_').toUpperCase(Locale.ROOT);
        String fromEnv = System.getenv(envKey);
        if (fromEnv != null) {
            logger.debug("'{}' overridden by {}: {}", key, envKey, fromEnv);
            return fromEnv;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return getNumber(key, defaultValue, Integer::valueOf);
    }

    public long getLong(String key, long defaultValue) {
        return getNumber(key, defaultValue, Long::valueOf);
    }

    private <T extends Number> T getNumber(String key, T defaultValue, Function<String, T> parser) {
        String raw = getString(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Property '{}' is not a number ('{}'), falling back to {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Get required string property (throws exception if missing)
     */
    public String getRequiredString(String key) throws ConfigurationException {
        String value = getString(key, null);
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Required property '" + key + "' is not configured");
        }
        return value;
    }

    /**
     * Re-read the configuration files, keeping the originally requested file name
     */
    public void reload() {
        Properties newProps = loadProperties(configFile);
        properties.clear();
        properties.putAll(newProps);
        logger.info("Configuration reloaded");
    }
}
