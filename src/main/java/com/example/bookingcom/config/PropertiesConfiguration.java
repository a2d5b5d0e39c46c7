package com.example.bookingcom.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration implementation backed by a {@link Properties} instance,
 * typically loaded from a file or a classpath resource.
 */
public class PropertiesConfiguration implements ClientConfiguration {

    private final Properties properties;

    public PropertiesConfiguration(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads configuration from a properties file.
     *
     * @param file path to a {@code .properties} file, read as UTF-8
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static PropertiesConfiguration load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return new PropertiesConfiguration(properties);
    }

    /**
     * Loads configuration from a classpath resource.
     *
     * @param resource resource name, e.g. {@code bookingcom.properties}
     * @return the loaded configuration
     * @throws IOException if the resource is missing or cannot be read
     */
    public static PropertiesConfiguration loadResource(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = PropertiesConfiguration.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Resource not found: " + resource);
            }
            properties.load(in);
        }
        return new PropertiesConfiguration(properties);
    }

    @Override
    public String get(String key) {
        return properties.getProperty(key);
    }
}
