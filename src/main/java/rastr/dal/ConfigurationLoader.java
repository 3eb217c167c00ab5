package rastr.dal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Loads configuration with priority:
 * 1. System Properties
 * 2. Environment Variables (dots become underscores, upper case)
 * 3. External config/application.properties (via -Dconfig.dir / CONFIG_DIR, or next to the JAR)
 * 4. Classpath config/application.properties
 * 5. Built-in defaults passed by the caller
 *
 * @since 19/10/2026
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_FILE = "config/application.properties";
    private static final String CONFIG_FILE_NAME = "application.properties";

    // External config locations (relative to JAR)
    private static final String[] EXTERNAL_CONFIG_PATHS = {
            "config/application.properties",
            "../config/application.properties"
    };

    private final Properties properties;

    public ConfigurationLoader() {
        this(DEFAULT_CONFIG_FILE);
    }

    /**
     * @param configFile absolute path of a properties file, or a classpath resource name
     */
    public ConfigurationLoader(String configFile) {
        this.properties = loadProperties(configFile);
    }

    /**
     * Build a loader over explicit properties, bypassing every file lookup
     */
    public static ConfigurationLoader fromProperties(Properties properties) {
        return new ConfigurationLoader(properties);
    }

    private ConfigurationLoader(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    private Properties loadProperties(String configFile) {
        Properties props = new Properties();

        Path configPath = Paths.get(configFile);
        if (configPath.isAbsolute() && Files.isRegularFile(configPath)) {
            if (loadFile(configPath, props)) {
                logger.info("Loaded configuration from absolute path: {}", configPath);
                return props;
            }
        }

        Properties external = loadFromExternalLocations();
        props.putAll(external);

        Properties classpath = loadFromClasspath(configFile);
        for (String key : classpath.stringPropertyNames()) {
            props.putIfAbsent(key, classpath.getProperty(key));
        }

        if (!external.isEmpty()) {
            logger.info("Loaded external configuration ({} keys, {} classpath defaults)", external.size(), classpath.size());
        } else if (!classpath.isEmpty()) {
            logger.info("Loaded configuration from classpath '{}'", configFile);
        } else {
            logger.warn("No configuration file found, using built-in defaults only");
        }
        return props;
    }

    private boolean loadFile(Path path, Properties target) {
        try (InputStream input = Files.newInputStream(path)) {
            target.load(input);
            return true;
        } catch (IOException e) {
            logger.warn("Failed to load configuration from '{}': {}", path, e.getMessage());
            return false;
        }
    }

    private Properties loadFromExternalLocations() {
        Properties props = new Properties();

        String configDir = System.getProperty("config.dir");
        if (configDir == null) {
            configDir = System.getenv("CONFIG_DIR");
        }
        if (configDir != null) {
            Path configPath = Paths.get(configDir, CONFIG_FILE_NAME).normalize();
            if (Files.isRegularFile(configPath) && loadFile(configPath, props)) {
                logger.debug("Using explicit config directory: {}", configPath.toAbsolutePath());
                return props;
            }
            logger.warn("Config directory specified but file not found: {}", configPath.toAbsolutePath());
        }

        String jarDir = getJarDirectory();
        // Running from target/classes would pick up the bundled file as "external"
        String separator = System.getProperty("file.separator");
        if (jarDir.contains("target" + separator + "classes")
                || jarDir.contains("target" + separator + "test-classes")) {
            logger.debug("Running from build directory, skipping external config auto-detection");
            return props;
        }

        for (String relativePath : EXTERNAL_CONFIG_PATHS) {
            Path configPath = Paths.get(jarDir, relativePath).normalize();
            if (Files.isRegularFile(configPath) && loadFile(configPath, props)) {
                logger.debug("Using external configuration: {}", configPath.toAbsolutePath());
                return props;
            }
            logger.trace("External config not found at: {}", configPath.toAbsolutePath());
        }
        return props;
    }

    private Properties loadFromClasspath(String configFile) {
        Properties props = new Properties();
        String[] locations = {configFile, "config/" + configFile};

        for (String location : locations) {
            try (InputStream input = getClass().getClassLoader().getResourceAsStream(location)) {
                if (input != null) {
                    props.load(input);
                    logger.debug("Loaded classpath configuration from '{}'", location);
                    return props;
                }
            } catch (IOException e) {
                logger.debug("Error loading configuration from classpath '{}': {}", location, e.getMessage());
            }
        }
        return props;
    }

    private String getJarDirectory() {
        try {
            Path path = Paths.get(getClass().getProtectionDomain().getCodeSource().getLocation().toURI());
            if (path.toString().endsWith(".jar")) {
                return path.getParent().toString();
            }
            return path.toString();
        } catch (Exception e) {
            logger.warn("Could not determine JAR directory: {}", e.getMessage());
            return System.getProperty("user.dir");
        }
    }

    /**
     * Get string property with priority: System Property > Env Var > Properties File > Default
     */
    public String getString(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from System Properties: {}", key, value);
            return value;
        }

        String envKey = key.replace('.', '_').toUpperCase();
        value = System.getenv(envKey);
        if (value != null) {
            logger.debug("Property '{}' from Environment Variable '{}': {}", key, envKey, value);
            return value;
        }

        value = properties.getProperty(key);
        if (value != null) {
            logger.debug("Property '{}' from configuration file: {}", key, value);
            return value;
        }

        logger.debug("Property '{}' not found, using default: {}", key, defaultValue);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for property '{}': '{}', using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal value for property '{}': '{}', using default: {}", key, value, defaultValue);
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
}
