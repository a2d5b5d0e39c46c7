package com.example.bookingcom.config;

/**
 * Key/value source of client settings.
 *
 * <p>Abstracts configuration sources (system properties, properties files, etc.)
 * so that {@link BookingcomClientConfig#from(ClientConfiguration)} can be
 * tested without touching global state.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * String dataDir = config.get(BookingcomClientConfig.DATA_DIR_KEY);
 * }</pre>
 */
public interface ClientConfiguration {

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
