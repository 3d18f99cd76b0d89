package net.vortexdevelopment.vlazy.config;

import net.vortexdevelopment.vlazy.debug.DebugLogger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Environment class for reading VLazy settings with support for:
 * - Environment variables (highest priority)
 * - System properties
 * - vlazy.properties file (lowest priority)
 */
public class Environment {
    public static final String PROPERTIES_FILE = "vlazy.properties";

    private static volatile Environment instance;
    private final Properties fileProperties;

    private Environment() {
        fileProperties = new Properties();
        loadFileProperties();
    }

    /**
     * Get the singleton Environment instance.
     *
     * @return The Environment instance
     */
    public static Environment getInstance() {
        if (instance == null) {
            synchronized (Environment.class) {
                if (instance == null) {
                    instance = new Environment();
                }
            }
        }
        return instance;
    }

    /**
     * Load vlazy.properties, looking in the following order:
     * <ol>
     *   <li>Current working directory</li>
     *   <li>Classpath resource</li>
     * </ol>
     * A missing file is not an error, settings then come from the environment or system properties.
     */
    private void loadFileProperties() {
        File propertiesFile = new File(System.getProperty("user.dir"), PROPERTIES_FILE);
        if (propertiesFile.isFile()) {
            try (FileInputStream fileInputStream = new FileInputStream(propertiesFile)) {
                fileProperties.load(fileInputStream);
                DebugLogger.log(Environment.class, "Loaded %s from %s", PROPERTIES_FILE, propertiesFile.getAbsolutePath());
                return;
            } catch (IOException e) {
                DebugLogger.log(Environment.class, "Could not read %s: %s, trying classpath", propertiesFile, e.getMessage());
            }
        }

        try (InputStream inputStream = Environment.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (inputStream != null) {
                fileProperties.load(inputStream);
                DebugLogger.log(Environment.class, "Loaded %s from classpath", PROPERTIES_FILE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + PROPERTIES_FILE + " from classpath", e);
        }
    }

    /**
     * Get a property value with resolution priority:
     * 1. Environment variables (converted from dot notation to UPPER_SNAKE_CASE)
     * 2. System properties
     * 3. vlazy.properties file
     *
     * @param key The property key (supports dot notation, e.g., "vlazy.debug.all")
     * @return The property value, or null if not found
     */
    public String getProperty(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        String value = System.getenv(convertToEnvKey(key));
        if (value != null) {
            return value;
        }

        value = System.getProperty(key);
        if (value != null) {
            return value;
        }

        return fileProperties.getProperty(key);
    }

    /**
     * Get a property value with a default value if not found.
     *
     * @param key The property key
     * @param defaultValue The default value to return if property is not found
     * @return The property value or default value
     */
    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a property value as a boolean.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found
     * @return The boolean value
     */
    public boolean getPropertyAsBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Convert a property key from dot notation to environment variable format.
     * Example: "vlazy.transform-defaults" -> "VLAZY_TRANSFORM_DEFAULTS"
     */
    static String convertToEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
