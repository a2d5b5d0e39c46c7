package com.example.bookingcom.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * // java -Dbookingcom.fetcher=remote -Dbookingcom.username=me ...
 * BookingcomClientConfig config = BookingcomClientConfig.from(new SystemPropertyConfiguration());
 * }</pre>
 */
public class SystemPropertyConfiguration implements ClientConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
